package io.lacuna.lattice;

/**
 * The automaton views a {@link Graph} can hold, one per builder.
 */
public enum Topology {
  ASG,
  CTC,
  HMM,
  WORD
}
