package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

/**
 * A finished automaton: its state count and its sorted edges.  State {@code 0} is the start state and
 * {@code numStates - 1} the end state.
 *
 * @author ztellman
 */
public class Automaton {

  private final int numStates;
  private final IList<Edge> edges;

  Automaton(int numStates, IList<Edge> edges) {
    this.numStates = numStates;
    this.edges = edges;
  }

  public static Automaton of(int numStates, IList<Edge> edges) {
    if (numStates < 0) {
      throw new IllegalArgumentException("negative state count: " + numStates);
    }
    return new Automaton(numStates, Utils.copy(edges).forked());
  }

  public int numStates() {
    return numStates;
  }

  public IList<Edge> edges() {
    return edges;
  }

  public int startState() {
    return 0;
  }

  public int endState() {
    return numStates - 1;
  }

  public ISet<Label> alphabet() {
    LinearSet<Label> alphabet = new LinearSet<>();
    edges.forEach(e -> alphabet.add(e.label));
    return alphabet;
  }

  /**
   * @return this automaton with every state collapsed onto state {@code 0}
   */
  public Automaton singleState() {
    return new Automaton(Math.min(numStates, 1), Graph.singleState(numStates, edges).forked());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("automaton(" + numStates + ")[");
    if (edges.size() > 0) {
      edges.forEach(e -> sb.append(e).append(", "));
      sb.delete(sb.length() - 2, sb.length());
    }
    sb.append("]");
    return sb.toString();
  }
}
