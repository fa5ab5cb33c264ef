package io.lacuna.lattice;

import io.lacuna.bifurcan.*;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class GraphTest {

  @Test
  public void testFromSentence() {
    Graph g = Graph.fromSentence("  Hello   World ");

    assertEquals("Hello   World", g.sentence());
    assertEquals(LinearList.of("hello", "world"), g.words());
    assertEquals(2, g.symbols().size());
    assertEquals(LinearList.of("w", "o", "r", "l", "d"), g.symbols().nth(1));
  }

  @Test
  public void testEmptySentence() {
    Graph g = Graph.fromSentence("   ");
    assertEquals(0, g.words().size());
    assertEquals(0, g.symbols().size());
    assertThrows(IllegalArgumentException.class, () -> Graph.fromSentence(null));
  }

  @Test
  public void testFromSymbols() {
    Graph g = Graph.fromSymbols(Arrays.asList(Arrays.asList("hh", "ax"), Collections.singletonList("ow")));

    assertNull(g.sentence());
    assertEquals(LinearList.of("hhax", "ow"), g.words());
    assertEquals(LinearList.of("hh", "ax"), g.symbols().nth(0));

    assertThrows(IllegalArgumentException.class, () -> Graph.fromSymbols(null));
    assertThrows(IllegalArgumentException.class,
            () -> Graph.fromSymbols(Collections.singletonList(Arrays.asList("a", null))));
  }

  @Test
  public void testTopologySlots() {
    Graph g = Graph.fromSentence("ab");

    assertFalse(g.isFinished(Topology.ASG));
    assertEquals(-1, g.numStates(Topology.ASG));
    assertEquals(0, g.edges(Topology.ASG).size());
    assertThrows(IllegalStateException.class, () -> g.automaton(Topology.ASG));

    Automaton asg = new Asg(g).run();
    Automaton ctc = new Ctc(g).run();

    assertTrue(g.isFinished(Topology.ASG));
    assertTrue(g.isFinished(Topology.CTC));
    assertFalse(g.isFinished(Topology.HMM));
    assertEquals(asg.numStates(), g.numStates(Topology.ASG));
    assertEquals(ctc.numStates(), g.numStates(Topology.CTC));
    assertEquals(asg.edges().size(), g.automaton(Topology.ASG).edges().size());

    assertEquals(Graph.UNSET, g.numStates);
    assertEquals(0, g.edges.size());
  }

  @Test
  public void testFinishedTopologyIsIsolated() {
    Graph g = Graph.fromSentence("cat");
    Automaton a = new Asg(g).run();

    a.edges().addLast(new Edge(7, 9, Label.of("z")));
    g.edges(Topology.ASG).removeFirst();
    Labels.convert(g.edges(Topology.ASG));
    Labels.convert(g.automaton(Topology.ASG).edges());

    assertEquals(6, a.edges().size());
    assertEquals(6, g.edges(Topology.ASG).size());
    assertEquals(4, g.numStates(Topology.ASG));
    assertEquals(4, Utils.stateCount(g.edges(Topology.ASG)));
    assertEquals(Label.of("c"), g.edges(Topology.ASG).first().label());
    assertEquals(Label.of("c"), g.automaton(Topology.ASG).edges().first().label());
  }

  @Test
  public void testAutomatonOfCopiesEdges() {
    LinearList<Edge> edges = LinearList.of(new Edge(0, 1, Label.of("a")));
    Automaton a = Automaton.of(2, edges);
    edges.addLast(new Edge(1, 2, Label.of("b")));
    a.edges().addLast(new Edge(1, 3, Label.of("c")));

    assertEquals(1, a.edges().size());
    assertEquals(2, a.numStates());
  }

  @Test
  public void testSingleState() {
    LinearList<Edge> edges = LinearList.of(new Edge(0, 1, Label.of("a"), 0.5), new Edge(1, 2, Label.of("b")));
    LinearList<Edge> collapsed = Graph.singleState(3, edges);

    assertEquals(new Edge(0, 0, Label.of("a"), 0.5), collapsed.nth(0));
    assertEquals(new Edge(0, 0, Label.of("b")), collapsed.nth(1));
    assertEquals(1, edges.nth(0).target());

    Automaton a = Automaton.of(3, edges).singleState();
    assertEquals(1, a.numStates());
    assertEquals(2, a.edges().size());
  }
}
