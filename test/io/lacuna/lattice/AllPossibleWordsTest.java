package io.lacuna.lattice;

import org.junit.Test;

import static io.lacuna.lattice.Edges.labels;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.*;

public class AllPossibleWordsTest {

  @Test
  public void testOneLoopPerWord() {
    Lexicon lexicon = new MapLexicon()
            .add("see", "s iy", 0.0)
            .add("a", "ax", 0.0)
            .add("a", "ey", 0.3)
            .add("cat", "k ae t", 0.0);
    Graph g = Graph.fromSentence("a cat");
    Automaton a = new AllPossibleWords(g, lexicon).run();

    assertEquals(1, a.numStates());
    assertThat(labels(a.edges()), contains("a", "cat", "see"));
    for (Edge e : a.edges()) {
      assertEquals(0, e.source());
      assertEquals(0, e.target());
      assertEquals(0.0, e.weight(), 0.0);
    }

    assertTrue(g.isFinished(Topology.WORD));
    assertEquals(1, g.numStates(Topology.WORD));
    assertEquals(3, g.edges(Topology.WORD).size());
  }

  @Test
  public void testEmptyLexicon() {
    Automaton a = new AllPossibleWords(Graph.fromSentence(""), new MapLexicon()).run();
    assertEquals(1, a.numStates());
    assertEquals(0, a.edges().size());
  }

  @Test
  public void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> new AllPossibleWords(null, new MapLexicon()));
    assertThrows(IllegalArgumentException.class, () -> new AllPossibleWords(Graph.fromSentence("a"), null));
  }
}
