package io.lacuna.lattice.batch;

import io.lacuna.lattice.Automaton;
import io.lacuna.lattice.Edge;
import io.lacuna.lattice.Label;
import io.lacuna.lattice.LabelConversionException;

import java.util.List;

/**
 * One or more automata packed into the parallel arrays an alignment routine consumes:
 * <ul>
 *   <li>{@code edges}, {@code [4][numEdges]}: source state, target state, emission id and sequence index</li>
 *   <li>{@code weights}, {@code [numEdges]}: the weight of each edge</li>
 *   <li>{@code startEndStates}, {@code [2][numBatch]}: the start and end state of each sequence</li>
 * </ul>
 * States of different sequences never overlap.
 */
public class BatchFsa {

  public static final int FROM = 0;
  public static final int TO = 1;
  public static final int EMISSION = 2;
  public static final int SEQUENCE = 3;

  private final int[][] edges;
  private final float[] weights;
  private final int[][] startEndStates;

  public BatchFsa(int[][] edges, float[] weights, int[][] startEndStates) {
    if (edges.length != 4) {
      throw new IllegalArgumentException("edges must have 4 rows, not " + edges.length);
    }
    int numEdges = edges[0].length;
    for (int[] row : edges) {
      if (row.length != numEdges) {
        throw new IllegalArgumentException("edge rows differ in length");
      }
    }
    if (weights.length != numEdges) {
      throw new IllegalArgumentException("expected " + numEdges + " weights, got " + weights.length);
    }
    if (startEndStates.length != 2 || startEndStates[0].length != startEndStates[1].length) {
      throw new IllegalArgumentException("startEndStates must have 2 rows of equal length");
    }
    this.edges = edges;
    this.weights = weights;
    this.startEndStates = startEndStates;
  }

  /**
   * Packs {@code automata} one after the other, the i-th automaton becoming sequence {@code i}.  Every label must
   * already be an integer.
   *
   * @throws LabelConversionException if an automaton still has a symbolic label
   */
  public static BatchFsa pack(List<Automaton> automata) {
    int numEdges = 0;
    for (Automaton a : automata) {
      if (a.numStates() < 1) {
        throw new IllegalArgumentException("can't pack an automaton without states");
      }
      numEdges += (int) a.edges().size();
    }

    int[][] edges = new int[4][numEdges];
    float[] weights = new float[numEdges];
    int[][] startEndStates = new int[2][automata.size()];

    int offset = 0;
    int i = 0;
    for (int seq = 0; seq < automata.size(); seq++) {
      Automaton a = automata.get(seq);
      for (Edge e : a.edges()) {
        edges[FROM][i] = e.source() + offset;
        edges[TO][i] = e.target() + offset;
        edges[EMISSION][i] = emission(e.label());
        edges[SEQUENCE][i] = seq;
        weights[i] = (float) e.weight();
        i++;
      }
      startEndStates[0][seq] = a.startState() + offset;
      startEndStates[1][seq] = a.endState() + offset;
      offset += a.numStates();
    }

    return new BatchFsa(edges, weights, startEndStates);
  }

  private static int emission(Label label) {
    if (!label.isInteger()) {
      throw new LabelConversionException("label '" + label + "' has no emission id");
    }
    return label.code();
  }

  public int numEdges() {
    return weights.length;
  }

  public int numBatch() {
    return startEndStates[0].length;
  }

  public int[][] edges() {
    return edges;
  }

  public float[] weights() {
    return weights;
  }

  public int[][] startEndStates() {
    return startEndStates;
  }
}
