package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.PriorityQueue;

/**
 * Strategies for renaming the states of an acyclic edge list so that every edge goes from a lower to a higher state.
 * Both rename states bijectively and leave state {@code 0} in place when it has no incoming edges.
 */
public enum StateOrder {

  /**
   * Scans the edges in order and, on finding {@code source > target}, exchanges the two state numbers throughout
   * the whole list and starts over.  Quadratic or worse.
   */
  SWAP {
    @Override
    public void repair(IList<Edge> edges, int numStates) {
      int n = Math.max(numStates, Utils.stateCount(edges));
      long limit = Math.max(1L, (long) n * n) * Math.max(1L, edges.size());
      long swaps = 0;

      long i = 0;
      while (i < edges.size()) {
        Edge e = edges.nth(i);
        if (e.source > e.target) {
          if (++swaps > limit) {
            throw new IllegalStateException("state swapping doesn't converge after " + limit + " swaps");
          }
          swap(edges, e.source, e.target);
          i = 0;
        } else {
          i++;
        }
      }
    }
  },

  /**
   * Computes a topological order with Kahn's algorithm, always picking the smallest ready state, and renames every
   * state in one sweep.
   */
  TOPOLOGICAL {
    @Override
    public void repair(IList<Edge> edges, int numStates) {
      int n = Math.max(numStates, Utils.stateCount(edges));
      int[] inDegree = new int[n];
      IMap<Integer, IList<Edge>> outgoing = Utils.groupBy(edges, e -> e.source);
      for (Edge e : edges) {
        if (e.source != e.target) {
          inDegree[e.target]++;
        }
      }

      PriorityQueue<Integer> ready = new PriorityQueue<>();
      for (int s = 0; s < n; s++) {
        if (inDegree[s] == 0) {
          ready.add(s);
        }
      }

      int[] rename = new int[n];
      int next = 0;
      while (!ready.isEmpty()) {
        int s = ready.poll();
        rename[s] = next++;
        for (Edge e : outgoing.get(s).orElseGet(LinearList::new)) {
          if (e.source != e.target && --inDegree[e.target] == 0) {
            ready.add(e.target);
          }
        }
      }

      if (next != n) {
        throw new IllegalStateException("the automaton has a cycle through " + (n - next) + " states");
      }

      for (Edge e : edges) {
        e.source = rename[e.source];
        e.target = rename[e.target];
      }
    }
  };

  /**
   * Renames the states of {@code edges} in place.
   *
   * @param numStates the state count, at least one more than the largest state referenced
   * @throws IllegalStateException if the edges form a cycle
   */
  public abstract void repair(IList<Edge> edges, int numStates);

  /**
   * @return true if no edge goes from a higher to a lower state
   */
  public static boolean isMonotonic(Iterable<Edge> edges) {
    for (Edge e : edges) {
      if (e.source > e.target) {
        return false;
      }
    }
    return true;
  }

  /**
   * exchanges the state numbers {@code a} and {@code b} in every edge
   */
  static void swap(IList<Edge> edges, int a, int b) {
    for (Edge e : edges) {
      if (e.source == a) {
        e.source = b;
      } else if (e.source == b) {
        e.source = a;
      }

      if (e.target == a) {
        e.target = b;
      } else if (e.target == b) {
        e.target = a;
      }
    }
  }
}
