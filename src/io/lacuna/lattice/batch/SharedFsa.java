package io.lacuna.lattice.batch;

import io.lacuna.bifurcan.*;
import io.lacuna.lattice.Edge;
import io.lacuna.lattice.Label;

/**
 * A single automaton shared by every sequence of a batch, replicated once per sequence when packed.
 */
public class SharedFsa {

  private int numStates = 1;
  private final LinearList<Edge> edges = new LinearList<>();

  public SharedFsa addEdge(int source, int target, int emission) {
    return addEdge(source, target, emission, 0.0);
  }

  public SharedFsa addEdge(int source, int target, int emission, double weight) {
    Edge edge = new Edge(source, target, Label.of(emission), weight);
    numStates = Math.max(numStates, Math.max(source, target) + 1);
    edges.addLast(edge);
    return this;
  }

  /**
   * @return this automaton, with a self-loop on {@code state} for every emission in {@code [0, numEmissions)}
   */
  public SharedFsa addInfiniteLoop(int state, int numEmissions) {
    for (int emission = 0; emission < numEmissions; emission++) {
      addEdge(state, state, emission);
    }
    return this;
  }

  public int numStates() {
    return numStates;
  }

  public IList<Edge> edges() {
    return edges;
  }

  public int numEdges(int numBatch) {
    return (int) edges.size() * numBatch;
  }

  public int[][] edges(int numBatch) {
    int n = (int) edges.size();
    int[][] result = new int[4][n * numBatch];
    for (int b = 0; b < numBatch; b++) {
      for (int i = 0; i < n; i++) {
        Edge e = edges.nth(i);
        int j = b * n + i;
        result[BatchFsa.FROM][j] = e.source() + b * numStates;
        result[BatchFsa.TO][j] = e.target() + b * numStates;
        result[BatchFsa.EMISSION][j] = e.label().code();
        result[BatchFsa.SEQUENCE][j] = b;
      }
    }
    return result;
  }

  public float[] weights(int numBatch) {
    int n = (int) edges.size();
    float[] result = new float[n * numBatch];
    for (int b = 0; b < numBatch; b++) {
      for (int i = 0; i < n; i++) {
        result[b * n + i] = (float) edges.nth(i).weight();
      }
    }
    return result;
  }

  /**
   * @return the start state ({@code 0}) and end state (the last one) of each replica
   */
  public int[][] startEndStates(int numBatch) {
    int[][] result = new int[2][numBatch];
    for (int b = 0; b < numBatch; b++) {
      result[0][b] = b * numStates;
      result[1][b] = numStates - 1 + b * numStates;
    }
    return result;
  }

  public BatchFsa toBatch(int numBatch) {
    if (numBatch < 0) {
      throw new IllegalArgumentException("negative batch size: " + numBatch);
    }
    return new BatchFsa(edges(numBatch), weights(numBatch), startEndStates(numBatch));
  }
}
