package io.lacuna.lattice;

import io.lacuna.bifurcan.*;
import org.junit.Test;

import java.util.Arrays;

import static io.lacuna.lattice.Edges.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

public class AsgTest {

  @Test
  public void testWordWithoutRepeats() {
    Graph g = Graph.fromSentence("cat");
    Automaton a = new Asg(g).run();

    assertWellFormed(a);
    assertEquals(4, a.numStates());
    assertThat(labels(a.edges()), contains("c", "c", "a", "a", "t", "t"));
    assertEquals(3, count(a.edges(), e -> !e.isLoop()));
    assertEquals(3, count(a.edges(), Edge::isLoop));
    assertTrue(has(a.edges(), 1, 1, Label.of("c")));
    assertTrue(has(a.edges(), 3, 3, Label.of("t")));
  }

  @Test
  public void testRepeatsAreCappedPerMarker() {
    Asg asg = new Asg(Graph.fromSentence("aaa"), 256, 2);
    assertThat(asg.repetitions().nth(0), contains(Label.of("a"), Label.of(258)));

    asg = new Asg(Graph.fromSentence("aaaa"), 256, 2);
    assertThat(asg.repetitions().nth(0), contains(Label.of("a"), Label.of(258), Label.of(257)));

    asg = new Asg(Graph.fromSentence("aaaa"), 256, 3);
    assertThat(asg.repetitions().nth(0), contains(Label.of("a"), Label.of(259)));
  }

  @Test
  public void testRepeatInsideWord() {
    Asg asg = new Asg(Graph.fromSentence("hello"), 10, 2);
    assertThat(asg.repetitions().nth(0),
            contains(Label.of("h"), Label.of("e"), Label.of("l"), Label.of(11), Label.of("o")));
  }

  @Test
  public void testRepeatsDontSpanWords() {
    Asg asg = new Asg(Graph.fromSentence("ab bc"));
    IList<IList<Label>> words = asg.repetitions();
    assertThat(words.nth(0), contains(Label.of("a"), Label.of("b")));
    assertThat(words.nth(1), contains(Label.of("b"), Label.of("c")));
  }

  @Test
  public void testSingleCharacterWord() {
    Automaton a = new Asg(Graph.fromSentence("x")).run();
    assertWellFormed(a);
    assertEquals(2, a.numStates());
    assertThat(labels(a.edges()), contains("x", "x"));
  }

  @Test
  public void testSeparatedWords() {
    Graph g = Graph.fromSentence("ab ab");
    Automaton a = new Asg(g, 256, 2).separator(true).run();

    assertWellFormed(a);
    assertEquals(6, a.numStates());
    assertEquals(10, a.edges().size());
    assertEquals(4, count(a.edges(), e -> !e.isLoop() && !e.label().equals(Label.BLANK)));
    assertEquals(1, count(a.edges(), e -> !e.isLoop() && e.label().equals(Label.BLANK)));
    assertEquals(0, count(a.edges(), e -> e.label().isInteger()));
    assertTrue(has(a.edges(), 2, 3, Label.BLANK));
    assertTrue(has(a.edges(), 3, 3, Label.BLANK));
  }

  @Test
  public void testWordsWithoutSeparator() {
    Automaton a = new Asg(Graph.fromSentence("ab ab")).run();
    assertWellFormed(a);
    assertEquals(5, a.numStates());
    assertEquals(8, a.edges().size());
    assertTrue(has(a.edges(), 2, 3, Label.of("a")));
  }

  @Test
  public void testEdgeContext() {
    Automaton a = new Asg(Graph.fromSentence("ab cd")).run();
    Edge c = between(a.edges(), 2, 3).first();

    assertEquals(Label.of("c"), c.label());
    assertEquals(Integer.valueOf(1), c.wordIndex());
    assertEquals(Integer.valueOf(0), c.phonemeIndex());
    assertEquals(Integer.valueOf(2), c.index());
    assertTrue(c.isWordBegin());
    assertFalse(c.isWordEnd());
    assertFalse(c.isLoop());
  }

  @Test
  public void testLabelConversion() {
    Automaton a = new Asg(Graph.fromSentence("ab b")).separator(true).labelConversion(true).run();

    assertEquals(0, count(a.edges(), e -> e.label().isSymbol()));
    assertTrue(has(a.edges(), 0, 1, Label.of('a')));
    assertTrue(has(a.edges(), 2, 3, Label.of(32)));
    assertTrue(has(a.edges(), 3, 4, Label.of('b')));
  }

  @Test
  public void testSymbolInput() {
    Graph g = Graph.fromSymbols(Arrays.asList(Arrays.asList("a", "a"), Arrays.asList("b")));
    Automaton a = new Asg(g).run();
    assertWellFormed(a);
    assertThat(labels(a.edges()), contains("a", "a", "257", "257", "b", "b"));
  }

  @Test
  public void testResultIsStoredOnGraph() {
    Graph g = Graph.fromSentence("abc");
    assertFalse(g.isFinished(Topology.ASG));
    assertEquals(-1, g.numStates(Topology.ASG));

    Automaton a = new Asg(g).run();

    assertTrue(g.isFinished(Topology.ASG));
    assertEquals(a.numStates(), g.numStates(Topology.ASG));
    assertEquals(a.edges().size(), g.edges(Topology.ASG).size());
    assertEquals(-1, g.numStates);
    assertEquals(0, g.edges.size());
  }

  @Test
  public void testInvalidParameters() {
    Graph g = Graph.fromSentence("abc");
    assertThrows(IllegalArgumentException.class, () -> new Asg(g, 0, 2));
    assertThrows(IllegalArgumentException.class, () -> new Asg(g, 256, 1));
    assertThrows(IllegalArgumentException.class, () -> new Asg(null));
  }

  @Test
  public void testEmptySentence() {
    Automaton a = new Asg(Graph.fromSentence("   ")).run();
    assertThat(a.numStates(), is(0));
    assertThat(a.edges().size(), is(0L));
  }
}
