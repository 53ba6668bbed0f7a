package io.lacuna.modular;

import io.lacuna.bifurcan.*;

import java.util.Optional;

/**
 * Moore-style partition refinement over the states of a deterministic automaton.  Missing transitions are treated as
 * edges into an implicit {@link #DEAD} state, which is placed among the non-goal states, so that every state has a
 * complete signature.
 */
class PartitionRefiner {

  /**
   * The implicit sink state, which loops to itself on every symbol and is never a goal.
   */
  static final int DEAD = -1;

  private final Automaton automaton;
  private final char[] alphabet;

  // state -> block, and block -> sorted members
  private final LinearMap<Integer, Integer> blocks = new LinearMap<>();
  private final LinearMap<Integer, LinearList<Integer>> members = new LinearMap<>();
  // block -> the block it was split from
  private final LinearMap<Integer, Integer> parents = new LinearMap<>();
  private int nextBlock;
  private int rounds;

  PartitionRefiner(Automaton automaton) {
    this.automaton = automaton;
    this.alphabet = automaton.alphabet();

    LinearList<Integer> goals = new LinearList<>();
    LinearList<Integer> rest = LinearList.of(DEAD);
    for (Integer s : Utils.sorted(automaton.states())) {
      (automaton.isGoal(s) ? goals : rest).addLast(s);
    }

    if (goals.size() > 0) {
      assign(goals, -1);
    }
    assign(rest, -1);
  }

  private void assign(LinearList<Integer> states, int parent) {
    int block = nextBlock++;
    members.put(block, states);
    if (parent >= 0) {
      parents.put(block, parent);
    }
    states.forEach(s -> blocks.put(s, block));
  }

  private IList<Integer> signature(int state) {
    LinearList<Integer> signature = new LinearList<>();
    for (char symbol : alphabet) {
      ISet<Integer> targets = state == DEAD ? (ISet<Integer>) Sets.EMPTY : automaton.targets(state, symbol);
      signature.addLast(targets.size() == 0 ? deadBlock() : blockOf(targets.iterator().next()));
    }
    return signature;
  }

  /**
   * Splits blocks until every pair of states sharing a block also share a signature.
   *
   * @return the number of refinement rounds
   */
  int refine() {
    boolean changed = true;
    while (changed) {
      changed = false;
      rounds++;

      // splits are computed against the partition from the previous round
      LinearList<LinearList<Integer>> splits = new LinearList<>();
      LinearList<Integer> splitFrom = new LinearList<>();
      LinearList<Integer> emptied = new LinearList<>();
      for (Integer block : Utils.sorted(members.keys())) {
        LinearMap<IList<Integer>, LinearList<Integer>> groups = Utils.groupBy(members.get(block).get(), this::signature);
        if (groups.size() == 1) {
          continue;
        }

        changed = true;
        emptied.addLast(block);
        for (IEntry<IList<Integer>, LinearList<Integer>> e : groups) {
          splits.addLast(e.value());
          splitFrom.addLast(block);
        }
      }

      emptied.forEach(members::remove);
      for (long i = 0; i < splits.size(); i++) {
        assign(splits.nth(i), splitFrom.nth(i));
      }
    }

    return rounds;
  }

  /**
   * @return the block containing {@code state}, which may be {@link #DEAD}
   */
  int blockOf(int state) {
    return blocks.get(state).get();
  }

  int deadBlock() {
    return blockOf(DEAD);
  }

  /**
   * @return a member of {@code block}, preferring real states over {@link #DEAD}
   */
  int representative(int block) {
    LinearList<Integer> states = members.get(block).get();
    for (Integer s : states) {
      if (s != DEAD) {
        return s;
      }
    }
    return DEAD;
  }

  /**
   * @return the block {@code block} was split from, if it is not one of the two initial blocks
   */
  Optional<Integer> parent(int block) {
    return parents.get(block);
  }

  /**
   * @return the current leaf blocks, in order of creation
   */
  IList<ISet<Integer>> partition() {
    LinearList<ISet<Integer>> result = new LinearList<>();
    for (Integer block : Utils.sorted(members.keys())) {
      result.addLast(Utils.toSet(members.get(block).get().stream()));
    }
    return result;
  }
}
