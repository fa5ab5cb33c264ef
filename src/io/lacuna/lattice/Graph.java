package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.List;
import java.util.Locale;

/**
 * Holds one input sequence and the automata built from it.  While a builder runs it works on the transient
 * {@code numStates}/{@code edges} pair, which is moved into the builder's {@link Topology} slot once it finishes.
 * <p>
 * Builders share the transient pair, so a graph must not be used by more than one builder at a time.
 */
public class Graph {

  static final int UNSET = -1;

  private final String sentence;
  private final IList<IList<String>> symbols;
  private final IList<String> words;

  int numStates = UNSET;
  LinearList<Edge> edges = new LinearList<>();

  private final LinearMap<Topology, Integer> finishedStates = new LinearMap<>();
  private final LinearMap<Topology, IList<Edge>> finishedEdges = new LinearMap<>();

  private Graph(String sentence, IList<IList<String>> symbols, IList<String> words) {
    this.sentence = sentence;
    this.symbols = symbols;
    this.words = words;
  }

  /**
   * @return a graph over the lowercased, whitespace-separated words of {@code sentence}, each word being a sequence
   * of single-character labels
   */
  public static Graph fromSentence(String sentence) {
    if (sentence == null) {
      throw new IllegalArgumentException("the input sentence must not be null");
    }
    String s = sentence.trim();
    LinearList<IList<String>> symbols = new LinearList<>();
    LinearList<String> words = new LinearList<>();
    if (!s.isEmpty()) {
      for (String word : s.toLowerCase(Locale.ROOT).split("\\s+")) {
        LinearList<String> chars = new LinearList<>();
        word.codePoints().forEach(c -> chars.addLast(new String(Character.toChars(c))));
        symbols.addLast(chars);
        words.addLast(word);
      }
    }
    return new Graph(s, symbols, words);
  }

  /**
   * @return a graph over already segmented label groups (e.g. phonemes), used as given
   */
  public static Graph fromSymbols(List<? extends List<String>> groups) {
    if (groups == null) {
      throw new IllegalArgumentException("the input symbols must not be null");
    }
    LinearList<IList<String>> symbols = new LinearList<>();
    LinearList<String> words = new LinearList<>();
    for (List<String> group : groups) {
      if (group == null || group.contains(null)) {
        throw new IllegalArgumentException("the input symbols contain null: " + groups);
      }
      symbols.addLast(LinearList.from(group));
      words.addLast(String.join("", group));
    }
    return new Graph(null, symbols, words);
  }

  /**
   * @return the trimmed input sentence, or null if the graph was built from symbol groups
   */
  public String sentence() {
    return sentence;
  }

  public IList<IList<String>> symbols() {
    return symbols;
  }

  public IList<String> words() {
    return words;
  }

  public boolean isFinished(Topology topology) {
    return finishedStates.contains(topology);
  }

  /**
   * @return the state count of {@code topology}, or {@code -1} if it hasn't been built
   */
  public int numStates(Topology topology) {
    return finishedStates.get(topology, UNSET);
  }

  /**
   * @return a copy of the sorted edges of {@code topology}, empty if it hasn't been built
   */
  public IList<Edge> edges(Topology topology) {
    return finishedEdges.get(topology)
            .map(l -> (IList<Edge>) Utils.copy(l).forked())
            .orElseGet(LinearList::new);
  }

  /**
   * @return a snapshot of {@code topology}, independent of the graph and of every other snapshot
   */
  public Automaton automaton(Topology topology) {
    if (!isFinished(topology)) {
      throw new IllegalStateException(topology + " has not been built");
    }
    return new Automaton(numStates(topology), edges(topology));
  }

  /**
   * moves the working state into the slot for {@code topology}
   */
  void finish(Topology topology) {
    finish(topology, numStates, edges);
    reset();
  }

  void finish(Topology topology, int numStates, IList<Edge> edges) {
    finishedStates.put(topology, numStates);
    finishedEdges.put(topology, Utils.copy(edges).forked());
  }

  /**
   * clears the working state
   */
  void reset() {
    numStates = UNSET;
    edges = new LinearList<>();
  }

  /**
   * @return copies of {@code edges} with every source and target remapped to state {@code 0}, if there's more than
   * one state
   */
  public static LinearList<Edge> singleState(int numStates, IList<Edge> edges) {
    LinearList<Edge> result = new LinearList<>();
    for (Edge e : edges) {
      result.addLast(numStates > 1 ? e.copy(0, 0) : e.copy());
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Graph:\n").append(symbols);
    for (Topology t : new Topology[]{Topology.ASG, Topology.CTC, Topology.HMM}) {
      sb.append("\n").append(t).append(":\nNum states: ").append(numStates(t))
              .append("\nEdges:\n").append(edges(t));
    }
    return sb.toString();
  }
}
