package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the HMM automaton of a {@link Graph}: every word is expanded into its pronunciation variants, every
 * phoneme into a chain of allophone states, and every edge is labeled with its allophone-in-context string or, with
 * state tying, the id of the model that string is tied to.
 * <p>
 * Words are separated by optional silence: a silence edge and an epsilon edge run in parallel before the first word
 * and after each word.  Variants of one word share their first and last state.
 */
public class Hmm {

  private static final Logger log = Logger.getLogger(Hmm.class.getName());

  static final String SILENCE = "[SILENCE]";

  private final Graph graph;
  private final Lexicon lexicon;
  private final int depth;
  private final int alloStates;

  private StateTying stateTying = null;
  private boolean stateTyingConversion = false;
  private StateOrder stateOrder = StateOrder.TOPOLOGICAL;

  private LinearSet<String> unresolved = new LinearSet<>();

  public Hmm(Graph graph, Lexicon lexicon) {
    this(graph, lexicon, 6, 3);
  }

  /**
   * @param depth the depth of the expansion, recorded but not otherwise used
   * @param alloStates the number of allophone states per phoneme
   */
  public Hmm(Graph graph, Lexicon lexicon, int depth, int alloStates) {
    if (graph == null) {
      throw new IllegalArgumentException("graph must not be null");
    }
    if (lexicon == null) {
      throw new IllegalArgumentException("lexicon must not be null");
    }
    if (depth < 0) {
      throw new IllegalArgumentException("depth must not be negative: " + depth);
    }
    if (alloStates <= 0) {
      throw new IllegalArgumentException("alloStates must be positive: " + alloStates);
    }
    this.graph = graph;
    this.lexicon = lexicon;
    this.depth = depth;
    this.alloStates = alloStates;
  }

  /**
   * @return this builder, replacing allophone labels with their ids in {@code stateTying}
   */
  public Hmm stateTying(StateTying stateTying) {
    if (stateTying == null) {
      throw new IllegalArgumentException("stateTying must not be null");
    }
    this.stateTying = stateTying;
    this.stateTyingConversion = true;
    return this;
  }

  public Hmm stateTyingConversion(boolean stateTyingConversion) {
    if (stateTyingConversion && stateTying == null) {
      throw new IllegalArgumentException("state tying conversion needs a state tying");
    }
    this.stateTyingConversion = stateTyingConversion;
    return this;
  }

  /**
   * @return this builder, restoring the state order with {@code stateOrder} after the allophone expansion
   */
  public Hmm stateOrder(StateOrder stateOrder) {
    if (stateOrder == null) {
      throw new IllegalArgumentException("stateOrder must not be null");
    }
    this.stateOrder = stateOrder;
    return this;
  }

  public int depth() {
    return depth;
  }

  public int alloStates() {
    return alloStates;
  }

  /**
   * @return the allophone strings the last build couldn't find in the state tying
   */
  public ISet<String> unresolved() {
    return unresolved.forked();
  }

  public Automaton run() {
    log.log(Level.FINE, "Starting HMM creation for {0}", graph.words());
    unresolved = new LinearSet<>();
    try {
      addWords();
      if (alloStates > 1) {
        expandAllophones();
      }
      stateOrder.repair(graph.edges, graph.numStates);
      addLoops();
      relabel();
      graph.edges = Utils.sorted(graph.edges);

      log.log(Level.FINE, "HMM has {0} states and {1} edges", new Object[]{graph.numStates, graph.edges.size()});
      graph.finish(Topology.HMM);
      return graph.automaton(Topology.HMM);
    } finally {
      graph.reset();
    }
  }

  /**
   * Lays out the words one after the other.  {@code last} is the highest state used so far.
   */
  private void addWords() {
    IList<String> words = graph.words();
    int last = -1;

    for (int w = 0; w < words.size(); w++) {
      if (w == 0) {
        graph.edges.addLast(new Edge(0, 1, Label.SIL));
        graph.edges.addLast(new Edge(0, 1, Label.EPS));
        last += 2;
      }

      String word = words.nth(w);
      IList<Pronunciation> variants = lexicon.pronunciations(word);
      if (variants.size() == 0) {
        throw new UnknownWordException(word);
      }

      int split = 0;
      int merge = 0;
      int target = 0;
      for (int v = 0; v < variants.size(); v++) {
        Pronunciation variant = variants.nth(v);
        IList<String> phonemes = variant.phonemeList();
        int end = (int) phonemes.size() - 1;

        for (int p = 0; p <= end; p++) {
          int source;
          if (variants.size() == 1) {
            source = last;
            target = last + 1;
            last++;
          } else if (v == 0) {
            if (p == 0) {
              split = last;
            }
            if (p == end) {
              merge = last + 1;
            }
            source = last;
            target = last + 1;
            last++;
          } else {
            if (p != 0) {
              last++;
            }
            source = p == 0 ? split : last;
            target = p == end ? merge : last + 1;
          }

          Edge edge = new Edge(source, target, Label.of(phonemes.nth(p)));
          edge.labelPrev = p == 0 ? "" : phonemes.nth(p - 1);
          edge.labelNext = p == end ? "" : phonemes.nth(p + 1);
          edge.score = p == 0 ? variant.score() : null;
          edge.wordIndex = w;
          edge.phonemeIndex = p;
          edge.index = last + p;
          edge.wordBegin = p == 0;
          edge.wordEnd = p == end;
          graph.edges.addLast(edge);
        }
      }

      graph.edges.addLast(new Edge(target, last + 1, Label.SIL));
      graph.edges.addLast(new Edge(target, last + 1, Label.EPS));
      last++;
    }

    graph.numStates = last + 1;
  }

  /**
   * Replaces every phoneme edge with a chain of {@code alloStates} edges.  The first edge of each chain is the
   * phoneme edge itself, redirected into the chain.
   */
  private void expandAllophones() {
    LinearList<Edge> chains = new LinearList<>();
    int n = graph.numStates;

    for (Edge edge : graph.edges) {
      if (edge.label.isSilenceOrEpsilon()) {
        continue;
      }

      int target = edge.target;
      edge.target = n;
      edge.alloIndex = 0;
      for (int s = 1; s < alloStates; s++) {
        Edge e;
        if (s == alloStates - 1) {
          e = edge.copy(n, target);
          n++;
        } else {
          n++;
          e = edge.copy(n - 1, n);
        }
        e.alloIndex = s;
        chains.addLast(e);
      }
    }

    chains.forEach(graph.edges::addLast);
    graph.numStates = n;
  }

  // every edge into a state other than the start state gets a self-loop, unless it's epsilon
  private void addLoops() {
    IMap<Integer, IList<Edge>> incoming = Utils.groupBy(graph.edges, e -> e.target);
    for (int state = 1; state < graph.numStates; state++) {
      for (Edge e : incoming.get(state).orElseGet(LinearList::new)) {
        if (!e.label.equals(Label.EPS)) {
          graph.edges.addLast(e.toLoop());
        }
      }
    }
  }

  private void relabel() {
    for (Edge edge : graph.edges) {
      String allophone = allophone(edge);
      edge.label = Label.of(allophone);

      if (!stateTyingConversion || edge.label.equals(Label.EPS)) {
        continue;
      }

      Optional<Integer> id = stateTying.id(allophone);
      if (id.isPresent()) {
        edge.label = Label.of(id.get());
      } else {
        if (!unresolved.contains(allophone)) {
          log.log(Level.WARNING, "No state tying for allophone ''{0}''", allophone);
        }
        unresolved.add(allophone);
      }
    }
  }

  /**
   * @return the allophone-in-context string of {@code edge}, e.g. {@code "b{a+c}@f.2"}
   */
  static String allophone(Edge edge) {
    StringBuilder sb = new StringBuilder();
    boolean silence = edge.label.equals(Label.SIL);
    boolean epsilon = edge.label.equals(Label.EPS);

    if (silence) {
      sb.append(SILENCE).append("{#+#}");
    } else if (epsilon) {
      sb.append(Label.EPS.symbol());
    } else {
      sb.append(edge.label).append('{')
              .append(context(edge.labelPrev)).append('+').append(context(edge.labelNext))
              .append('}');
    }

    if (edge.wordBegin) {
      sb.append("@i");
    }
    if (edge.wordEnd) {
      sb.append("@f");
    }

    if (silence) {
      sb.append(".0");
    } else if (!epsilon && edge.alloIndex != null) {
      sb.append('.').append(edge.alloIndex);
    }

    return sb.toString();
  }

  private static String context(String label) {
    return label == null || label.isEmpty() ? "#" : label;
  }
}
