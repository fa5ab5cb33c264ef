package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the ASG automaton of a {@link Graph}: one state-advancing edge per label, with runs of a repeated label
 * replaced by repetition markers, and a self-loop on every reached state.
 */
public class Asg {

  private static final Logger log = Logger.getLogger(Asg.class.getName());

  private final Graph graph;
  private final int numLabels;
  private final int repetition;
  private boolean separator = false;
  private boolean labelConversion = false;

  public Asg(Graph graph) {
    this(graph, 256, 2);
  }

  /**
   * @param numLabels the number of labels, excluding blank, silence, epsilon and repetition markers; markers are
   *                  numbered from {@code numLabels + 1}
   * @param repetition the largest number of repeats a single marker stands for
   */
  public Asg(Graph graph, int numLabels, int repetition) {
    if (graph == null) {
      throw new IllegalArgumentException("graph must not be null");
    }
    if (numLabels <= 0) {
      throw new IllegalArgumentException("numLabels must be positive: " + numLabels);
    }
    if (repetition <= 1) {
      throw new IllegalArgumentException("repetition must be greater than 1: " + repetition);
    }
    this.graph = graph;
    this.numLabels = numLabels;
    this.repetition = repetition;
  }

  /**
   * @return this builder, separating consecutive words with a blank edge
   */
  public Asg separator(boolean separator) {
    this.separator = separator;
    return this;
  }

  /**
   * @return this builder, converting the labels into integers once the automaton is built
   */
  public Asg labelConversion(boolean labelConversion) {
    this.labelConversion = labelConversion;
    return this;
  }

  public Automaton run() {
    log.log(Level.FINE, "Starting ASG creation for {0}", graph.symbols());
    try {
      IList<IList<Label>> words = repetitions();

      graph.numStates = 0;
      int cur = 0;
      for (int w = 0; w < words.size(); w++) {
        IList<Label> labels = words.nth(w);
        for (int i = 0; i < labels.size(); i++) {
          if (cur == 0) {
            graph.numStates++;
          }
          graph.numStates++;

          Edge edge = new Edge(cur, cur + 1, labels.nth(i));
          edge.wordIndex = w;
          edge.phonemeIndex = i;
          edge.index = cur;
          edge.wordBegin = i == 0;
          edge.wordEnd = i == labels.size() - 1;
          graph.edges.addLast(edge);
          cur++;
        }

        if (separator && w < words.size() - 1) {
          if (cur == 0) {
            graph.numStates++;
          }
          graph.edges.addLast(new Edge(cur, cur + 1, Label.BLANK));
          graph.numStates++;
          cur++;
        }
      }

      addLoops();
      graph.edges = Utils.sorted(graph.edges);

      if (labelConversion) {
        Labels.convert(graph.edges);
      }

      log.log(Level.FINE, "ASG has {0} states and {1} edges", new Object[]{graph.numStates, graph.edges.size()});
      graph.finish(Topology.ASG);
      return graph.automaton(Topology.ASG);
    } finally {
      graph.reset();
    }
  }

  /**
   * @return the labels of each word, with repeated labels collapsed into markers
   */
  IList<IList<Label>> repetitions() {
    LinearList<IList<Label>> result = new LinearList<>();
    for (IList<String> word : graph.symbols()) {
      LinearList<Label> labels = new LinearList<>();
      String prev = null;
      int count = 0;
      for (String label : word) {
        if (label.equals(prev)) {
          if (count < repetition) {
            count++;
          } else {
            labels.addLast(marker(count));
            count = 1;
          }
        } else {
          if (count != 0) {
            labels.addLast(marker(count));
            count = 0;
          }
          labels.addLast(Label.of(label));
        }
        prev = label;
      }
      if (count != 0) {
        labels.addLast(marker(count));
      }
      result.addLast(labels);
    }
    return result;
  }

  private Label marker(int count) {
    return Label.of(numLabels + count);
  }

  // every edge into a state other than the start state gets a self-loop, unless it's silence or epsilon
  private void addLoops() {
    IMap<Integer, IList<Edge>> incoming = Utils.groupBy(graph.edges, e -> e.target);
    for (int state = 1; state < graph.numStates; state++) {
      for (Edge e : incoming.get(state).orElseGet(LinearList::new)) {
        if (!e.label.isSilenceOrEpsilon()) {
          graph.edges.addLast(e.toLoop());
        }
      }
    }
  }
}
