package io.lacuna.modular;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import org.junit.Test;

import static io.lacuna.modular.AutomatonTest.automaton;
import static org.junit.Assert.*;

public class PartitionRefinerTest {

  private static Automaton dfa(int states, int start, int[] goals, Object[][] transitions) {
    Automaton a = automaton(states);
    a.setStartState(start);
    for (int g : goals) {
      a.setGoalState(g);
    }
    for (Object[] t : transitions) {
      a.addTransition((Integer) t[0], (Integer) t[1], (Character) t[2]);
    }
    return a;
  }

  private static Automaton scrambled(boolean allGoals) {
    Automaton a = automaton(4);
    a.setStartState(0);
    for (int i = 0; i < 4; i++) {
      if (allGoals) {
        a.setGoalState(i);
      }
      a.addTransition(i, (2 * i + 2) % 4, 'a');
      a.addTransition(i, (5 * i + 1) % 4, 'b');
      a.addTransition(i, (3 * i + 1) % 4, 'c');
    }
    return a;
  }

  private static void assertMinimal(Automaton a, int states, String... accepted) {
    Automaton min = a.minimize();
    assertEquals(states, min.states().size());
    assertTrue(min.isDFA());
    for (String w : accepted) {
      assertTrue(w, min.accepts(w));
    }
    for (String w : AutomatonTest.words(6)) {
      assertEquals(w, a.accepts(w), min.accepts(w));
    }
    assertEquals(states, min.minimize().states().size());
  }

  @Test
  public void testMinimize() {
    Automaton a = dfa(5, 0, new int[] {4}, new Object[][] {
            {0, 1, 'a'}, {0, 2, 'b'}, {1, 1, 'a'}, {1, 3, 'b'}, {2, 1, 'a'},
            {2, 2, 'b'}, {3, 1, 'a'}, {3, 4, 'b'}, {4, 1, 'a'}, {4, 2, 'b'}});
    assertMinimal(a, 4, "abb", "babb", "aaabb");
  }

  @Test
  public void testMinimizeMergesGoals() {
    Automaton a = dfa(4, 0, new int[] {3}, new Object[][] {
            {0, 1, 'a'}, {0, 3, 'b'}, {1, 2, 'a'}, {1, 3, 'b'},
            {2, 2, 'a'}, {2, 3, 'b'}, {3, 3, 'a'}, {3, 2, 'b'}});
    assertMinimal(a, 2, "aaaaaabaaabbaaa", "b");
  }

  @Test
  public void testMinimizeKeepsDistinctPrefix() {
    Automaton a = dfa(4, 0, new int[] {3}, new Object[][] {
            {0, 1, 'a'}, {0, 1, 'b'}, {1, 2, 'a'}, {1, 3, 'b'},
            {2, 2, 'a'}, {2, 3, 'b'}, {3, 3, 'a'}, {3, 2, 'b'}});
    assertMinimal(a, 3, "ab", "abaaaaaaaaaaabaabbaaab");
  }

  @Test
  public void testMinimizeDropsUnreachableStates() {
    Automaton a = dfa(8, 0, new int[] {2}, new Object[][] {
            {0, 1, 'a'}, {0, 5, 'b'}, {1, 6, 'a'}, {1, 2, 'b'}, {2, 0, 'a'}, {2, 2, 'b'}, {3, 2, 'a'}, {3, 6, 'b'},
            {4, 7, 'a'}, {4, 5, 'b'}, {5, 2, 'a'}, {5, 6, 'b'}, {6, 6, 'a'}, {6, 4, 'b'}, {7, 6, 'a'}, {7, 2, 'b'}});
    assertMinimal(a, 5, "ab", "aababbbb");
  }

  @Test
  public void testMinimizeWithSeveralGoals() {
    Automaton a = dfa(6, 0, new int[] {2, 3, 4}, new Object[][] {
            {0, 1, 'a'}, {0, 2, 'b'}, {1, 0, 'a'}, {1, 3, 'b'}, {2, 4, 'a'}, {2, 5, 'b'},
            {3, 4, 'a'}, {3, 5, 'b'}, {4, 4, 'a'}, {4, 5, 'b'}, {5, 5, 'a'}, {5, 5, 'b'}});
    assertMinimal(a, 2, "b", "ba", "ab", "aba");
  }

  @Test
  public void testMinimizeIncomplete() {
    Automaton a = dfa(4, 0, new int[] {2}, new Object[][] {{0, 1, 'a'}, {1, 2, 'a'}, {1, 3, 'b'}});
    assertMinimal(a, 3, "aa");

    Automaton b = dfa(4, 0, new int[] {2}, new Object[][] {{0, 1, 'a'}, {0, 1, 'b'}, {1, 2, 'a'}, {2, 2, 'a'}});
    assertMinimal(b, 3, "aa", "ba", "aaaaaaa");
  }

  @Test
  public void testMinimizeWithoutGoals() {
    Automaton min = scrambled(false).minimize();
    assertEquals(1, min.states().size());
    assertEquals(0, min.transitionCount());
    assertFalse(min.accepts("abc"));
  }

  @Test
  public void testMinimizeWithOnlyGoals() {
    Automaton min = scrambled(true).minimize();
    assertEquals(1, min.states().size());
    assertEquals(1, min.goalStates().size());
    assertTrue(min.accepts("ababcbcbbaccbabbcabcabcabcababcabcbc"));
  }

  @Test(expected = IllegalStateException.class)
  public void testMinimizeRequiresSingleStart() {
    Automaton a = scrambled(false);
    a.setStartState(1);
    a.minimize();
  }

  @Test(expected = IllegalStateException.class)
  public void testMinimizeRejectsEpsilon() {
    Automaton a = scrambled(false);
    a.addTransition(0, 1, Automaton.EPSILON);
    a.minimize();
  }

  @Test
  public void testMinimizeRejectsNondeterminism() {
    Automaton a = automaton(4);
    a.setStartState(0);
    for (int i = 0; i < 4; i++) {
      a.addTransition(i, (i + 1) % 4, 'a');
      a.addTransition(i, (i + 2) % 4, 'a');
    }

    try {
      a.minimize();
      fail();
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().startsWith("minimization requires a DFA"));
    }
  }

  @Test
  public void testRefinement() {
    Automaton a = dfa(4, 0, new int[] {2}, new Object[][] {{0, 1, 'a'}, {1, 2, 'a'}, {1, 3, 'b'}});
    PartitionRefiner refiner = new PartitionRefiner(a);
    assertEquals(2, refiner.partition().size());

    refiner.refine();
    IList<ISet<Integer>> partition = refiner.partition();
    assertEquals(4, partition.size());

    // state 3 can never reach a goal, so it joins the sink
    assertEquals(refiner.deadBlock(), refiner.blockOf(3));
    assertEquals(3, refiner.representative(refiner.deadBlock()));
    assertNotEquals(refiner.blockOf(0), refiner.blockOf(1));
    assertTrue(refiner.parent(refiner.blockOf(0)).isPresent());
    assertFalse(refiner.parent(refiner.blockOf(2)).isPresent());
  }
}
