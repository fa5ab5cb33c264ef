package io.lacuna.lattice;

import java.util.Objects;

/**
 * A weighted, labeled transition between two states.  Identity and ordering only consider
 * {@code (source, target, label, weight)}; the remaining fields are context filled in by the builders.
 */
public class Edge implements Comparable<Edge> {

  int source;
  int target;
  Label label;
  final double weight;

  // context
  String labelPrev;
  String labelNext;
  Integer wordIndex;
  Integer phonemeIndex;
  Integer index;
  Integer alloIndex;
  boolean wordBegin;
  boolean wordEnd;
  Double score;
  boolean loop;

  public Edge(int source, int target, Label label) {
    this(source, target, label, 0.0);
  }

  /**
   * @param weight the weight in -log space
   */
  public Edge(int source, int target, Label label, double weight) {
    if (source < 0 || target < 0) {
      throw new IllegalArgumentException("negative state index: " + source + " -> " + target);
    }
    this.source = source;
    this.target = target;
    this.label = Objects.requireNonNull(label);
    this.weight = weight;
  }

  public int source() {
    return source;
  }

  public int target() {
    return target;
  }

  public Label label() {
    return label;
  }

  public double weight() {
    return weight;
  }

  public String labelPrev() {
    return labelPrev;
  }

  public String labelNext() {
    return labelNext;
  }

  public Integer wordIndex() {
    return wordIndex;
  }

  public Integer phonemeIndex() {
    return phonemeIndex;
  }

  public Integer index() {
    return index;
  }

  public Integer alloIndex() {
    return alloIndex;
  }

  public boolean isWordBegin() {
    return wordBegin;
  }

  public boolean isWordEnd() {
    return wordEnd;
  }

  public Double score() {
    return score;
  }

  /**
   * @return true if this edge is a self-loop added after the initial expansion
   */
  public boolean isLoop() {
    return loop;
  }

  /**
   * @return a copy of this edge, context included
   */
  public Edge copy() {
    return copy(source, target);
  }

  Edge copy(int source, int target) {
    Edge e = new Edge(source, target, label, weight);
    e.labelPrev = labelPrev;
    e.labelNext = labelNext;
    e.wordIndex = wordIndex;
    e.phonemeIndex = phonemeIndex;
    e.index = index;
    e.alloIndex = alloIndex;
    e.wordBegin = wordBegin;
    e.wordEnd = wordEnd;
    e.score = score;
    e.loop = loop;
    return e;
  }

  /**
   * @return a copy of this edge turned into a self-loop on its target state
   */
  Edge toLoop() {
    Edge e = copy(target, target);
    e.loop = true;
    return e;
  }

  @Override
  public int compareTo(Edge o) {
    int c = Integer.compare(source, o.source);
    if (c == 0) {
      c = Integer.compare(target, o.target);
    }
    if (c == 0) {
      c = label.compareTo(o.label);
    }
    if (c == 0) {
      c = Double.compare(weight, o.weight);
    }
    return c;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Edge)) {
      return false;
    }
    Edge e = (Edge) o;
    return source == e.source
            && target == e.target
            && Double.compare(weight, e.weight) == 0
            && label.equals(e.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, label, weight);
  }

  @Override
  public String toString() {
    return "[" + source + ", " + target + ", " + label + ", " + weight + "]";
  }
}
