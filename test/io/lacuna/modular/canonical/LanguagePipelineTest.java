package io.lacuna.modular.canonical;

import io.lacuna.modular.Automaton;
import org.junit.Test;

import static org.junit.Assert.*;

public class LanguagePipelineTest {

  private final LanguagePipeline pipeline = new LanguagePipeline(Generators.STANDARD);

  @Test
  public void testSingleFlip() {
    Automaton a = pipeline.canonicalDfa("X");
    assertEquals(2, a.states().size());
    assertTrue(a.accepts("X"));
    assertFalse(a.accepts("XX"));
    assertFalse(a.accepts("S"));
    assertFalse(a.accepts("R"));
  }

  @Test
  public void testFlipIsAbsorbed() {
    Automaton a = pipeline.canonicalDfa("(S|R)*");
    for (String w : new String[] {"S", "R", "XS", "XR", "XRR", "XSRRSRSRRSRS"}) {
      assertTrue(w, a.accepts(w));
    }
  }

  @Test
  public void testReducedWords() {
    Automaton a = pipeline.intersectAll(
            Generators.STANDARD.referenceAutomaton(),
            pipeline.canonicalDfa("SRS(XSR)*SRS"));

    for (String w : new String[] {"XSRRS", "SRRSRS", "XSRRSRSRS", "SRRSRSRSRS"}) {
      assertTrue(w, a.accepts(w));
    }
    assertFalse(a.accepts("SRS"));
    assertFalse(a.accepts("SRRS"));
  }

  @Test
  public void testPlainDfa() {
    Automaton a = pipeline.plainDfa("(SR)*");
    assertTrue(a.isDFA());
    assertTrue(a.accepts(""));
    assertTrue(a.accepts("SRSR"));
    assertFalse(a.accepts("XSR"));
    assertEquals(2, a.states().size());
  }

  @Test
  public void testSolve() {
    Automaton a = pipeline.solve("SS", "X");
    assertFalse(a.isEmpty());
    assertTrue(a.accepts("X"));
    assertFalse(a.accepts(""));
    assertEquals(1, a.acceptedWords(4).size());
  }

  @Test
  public void testSolveWithoutSolution() {
    Automaton a = pipeline.solve("SS", "S*");
    assertTrue(a.isEmpty());
  }

  @Test
  public void testCanonicalDfaAgreesWithReduction() {
    Automaton reduced = pipeline.intersectAll(
            Generators.STANDARD.referenceAutomaton(),
            pipeline.canonicalDfa("SRSSRS"));
    assertTrue(reduced.accepts(Words.reduce("SRSSRS")));
  }
}
