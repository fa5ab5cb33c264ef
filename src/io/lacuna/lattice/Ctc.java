package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the CTC automaton of a {@link Graph}.  Label {@code c} of the sequence occupies states {@code 2c} (before
 * it), {@code 2c + 1} (after a blank) and {@code 2c + 2} (after the label), and the automaton ends in a single final
 * state.
 */
public class Ctc {

  private static final Logger log = Logger.getLogger(Ctc.class.getName());

  private final Graph graph;
  private boolean labelConversion = false;

  private int finalState = Graph.UNSET;

  public Ctc(Graph graph) {
    this(graph, 256);
  }

  /**
   * @param numLabels the number of labels, excluding blank, silence and epsilon; checked but not otherwise used
   */
  public Ctc(Graph graph, int numLabels) {
    if (graph == null) {
      throw new IllegalArgumentException("graph must not be null");
    }
    if (numLabels <= 0) {
      throw new IllegalArgumentException("numLabels must be positive: " + numLabels);
    }
    this.graph = graph;
  }

  /**
   * @return this builder, converting the labels into integers once the automaton is built
   */
  public Ctc labelConversion(boolean labelConversion) {
    this.labelConversion = labelConversion;
    return this;
  }

  /**
   * @return the final state of the last automaton built, or {@code -1}
   */
  public int finalState() {
    return finalState;
  }

  public Automaton run() {
    IList<IList<String>> words = graph.symbols();
    if (words.size() == 0) {
      throw new IllegalArgumentException("CTC needs a non-empty input");
    }
    for (IList<String> word : words) {
      if (word.size() == 0) {
        throw new IllegalArgumentException("CTC needs non-empty words: " + words);
      }
    }

    log.log(Level.FINE, "Starting CTC creation for {0}", words);
    try {
      graph.numStates = 0;
      int cur = 0;

      for (int w = 0; w < words.size(); w++) {
        IList<String> word = words.nth(w);
        for (int i = 0; i < word.size(); i++) {
          String label = word.nth(i);
          int source = 2 * cur;
          if (cur == 0) {
            graph.numStates++;
          }

          Edge direct = new Edge(source, source + 2, Label.of(label));
          direct.index = cur;
          direct.wordIndex = w;
          direct.phonemeIndex = i;

          // a label repeating its predecessor can only be reached through a blank
          if (i == 0 || word.size() == 1 || !label.equals(word.nth(i - 1))) {
            graph.edges.addLast(direct);
          }
          graph.edges.addLast(new Edge(source, source + 1, Label.BLANK));
          graph.edges.addLast(direct.copy(source + 1, source + 2));

          cur++;
          graph.numStates += 2;
        }

        if (w < words.size() - 1) {
          graph.edges.addLast(new Edge(2 * cur, 2 * cur + 1, Label.BLANK));
          graph.edges.addLast(new Edge(2 * cur + 1, 2 * cur + 2, Label.SIL));
          graph.edges.addLast(new Edge(2 * cur, 2 * cur + 2, Label.SIL));
          graph.numStates += 2;
          cur++;
        }
      }

      IList<String> last = words.nth(words.size() - 1);
      IList<Integer> finalStates = addTail(Label.of(last.nth(last.size() - 1)));
      unifyFinalStates(finalStates);
      addLoops();

      if (labelConversion) {
        Labels.convert(graph.edges);
      }
      graph.edges = Utils.sorted(graph.edges);

      log.log(Level.FINE, "CTC has {0} states and {1} edges", new Object[]{graph.numStates, graph.edges.size()});
      finalState = graph.numStates - 1;
      graph.finish(Topology.CTC);
      return graph.automaton(Topology.CTC);
    } finally {
      graph.reset();
    }
  }

  /**
   * Adds the ways of ending: on a blank, on the last label, and the transition between the two.
   *
   * @return the natural final states
   */
  private IList<Integer> addTail(Label lastLabel) {
    int n = graph.numStates;
    LinearList<Integer> finalStates = LinearList.of(n - 1);

    graph.edges.addLast(new Edge(n - 3, n, Label.BLANK, 1.0));
    graph.edges.addLast(new Edge(n + 1, n + 2, Label.BLANK, 1.0));
    graph.edges.addLast(new Edge(n, n + 1, lastLabel, 1.0));
    graph.numStates += 3;

    finalStates.addLast(graph.numStates - 1);
    return finalStates;
  }

  /**
   * Reroutes everything ending in one of {@code finalStates} into a new, single final state.
   */
  private void unifyFinalStates(IList<Integer> finalStates) {
    LinearSet<Integer> distinct = new LinearSet<>();
    finalStates.forEach(distinct::add);
    if (distinct.size() == 1 && distinct.contains(graph.numStates - 1)) {
      return;
    }

    int unified = graph.numStates++;
    for (int state : finalStates) {
      LinearList<Edge> incoming = new LinearList<>();
      for (Edge e : graph.edges) {
        if (e.target == state) {
          incoming.addLast(e);
        }
      }
      if (incoming.size() == 0) {
        throw new IllegalStateException("no edge ends in final state " + state);
      }

      graph.edges.addLast(new Edge(state, unified, incoming.first().label));
      for (Edge e : incoming) {
        graph.edges.addLast(e.copy(e.source, unified));
      }
    }
  }

  // one loop per intermediate state, duplicating the first edge that reaches it
  private void addLoops() {
    IMap<Integer, IList<Edge>> incoming = Utils.groupBy(graph.edges, e -> e.target);
    for (int state = 1; state < graph.numStates - 1; state++) {
      IList<Edge> edges = incoming.get(state).orElseGet(LinearList::new);
      if (edges.size() > 0) {
        graph.edges.addLast(edges.first().toLoop());
      }
    }
  }
}
