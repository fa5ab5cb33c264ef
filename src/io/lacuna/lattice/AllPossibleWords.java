package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a single-state automaton accepting any sequence of lexicon words: one self-loop per word.
 */
public class AllPossibleWords {

  private static final Logger log = Logger.getLogger(AllPossibleWords.class.getName());

  private final Graph graph;
  private final Lexicon lexicon;

  public AllPossibleWords(Graph graph, Lexicon lexicon) {
    if (graph == null) {
      throw new IllegalArgumentException("graph must not be null");
    }
    if (lexicon == null) {
      throw new IllegalArgumentException("lexicon must not be null");
    }
    this.graph = graph;
    this.lexicon = lexicon;
  }

  public Automaton run() {
    log.fine("Starting all possible words creation");
    LinearList<Edge> edges = new LinearList<>();
    for (String word : lexicon.words()) {
      edges.addLast(new Edge(0, 0, Label.of(word), 0.0));
    }
    edges = Utils.sorted(edges);

    log.log(Level.FINE, "All possible words has {0} edges", edges.size());
    graph.finish(Topology.WORD, 1, edges);
    return graph.automaton(Topology.WORD);
  }
}
