package io.lacuna.modular.canonical;

import io.lacuna.bifurcan.*;
import io.lacuna.modular.Automaton;
import io.lacuna.modular.Transition;

import java.util.Optional;

/**
 * The rules for joining two adjacent facts into a new one.  A pair of classes either has no rule, or yields a class
 * and whether the join flips the sign:
 *
 * <pre>
 *   N . N    -> N
 *   S . N    -> S
 *   R . N    -> R
 *   RR . N   -> RR
 *   R . R    -> RR
 *   S . S    -> N, flipped
 *   RR . R   -> N, flipped
 * </pre>
 */
public final class Relations {

  private Relations() {
  }

  public static final class Rule {
    public final PathClass result;
    public final boolean flip;

    Rule(PathClass result, boolean flip) {
      this.result = result;
      this.flip = flip;
    }

    /**
     * @return the parity of the joined path, given the combined parity of its two halves
     */
    public ReachabilityStatus apply(ReachabilityStatus status) {
      return flip ? status.negate() : status;
    }
  }

  private static final Rule[][] RULES = new Rule[PathClass.values().length][PathClass.values().length];

  static {
    rule(PathClass.NEUTRAL, PathClass.NEUTRAL, PathClass.NEUTRAL, false);
    rule(PathClass.S, PathClass.NEUTRAL, PathClass.S, false);
    rule(PathClass.R, PathClass.NEUTRAL, PathClass.R, false);
    rule(PathClass.RR, PathClass.NEUTRAL, PathClass.RR, false);
    rule(PathClass.R, PathClass.R, PathClass.RR, false);
    rule(PathClass.S, PathClass.S, PathClass.NEUTRAL, true);
    rule(PathClass.RR, PathClass.R, PathClass.NEUTRAL, true);
  }

  private static void rule(PathClass left, PathClass right, PathClass result, boolean flip) {
    RULES[left.ordinal()][right.ordinal()] = new Rule(result, flip);
  }

  /**
   * @return the rule for a path of class {@code left} followed by one of class {@code right}, if any
   */
  public static Optional<Rule> join(PathClass left, PathClass right) {
    return Optional.ofNullable(RULES[left.ordinal()][right.ordinal()]);
  }

  /**
   * @return the fact represented by a single transition, or nothing if its symbol is not one of the generators
   */
  public static Optional<Fact> fact(Generators generators, Transition t) {
    if (t.symbol == generators.flip) {
      return Optional.of(new Fact(t.from, t.to, PathClass.NEUTRAL, true));
    } else if (t.symbol == Automaton.EPSILON) {
      return Optional.of(new Fact(t.from, t.to, PathClass.NEUTRAL, false));
    } else if (t.symbol == generators.order2) {
      return Optional.of(new Fact(t.from, t.to, PathClass.S, false));
    } else if (t.symbol == generators.order3) {
      return Optional.of(new Fact(t.from, t.to, PathClass.R, false));
    }
    return Optional.empty();
  }

  /**
   * @return every fact not yet in {@code index} that follows from joining {@code fact} with a fact already in it,
   * on either side
   */
  public static IList<Fact> consequences(ReachabilityIndex index, Fact fact) {
    LinearSet<Fact> result = new LinearSet<>();

    for (PathClass left : PathClass.values()) {
      Optional<Rule> rule = join(left, fact.pathClass);
      if (!rule.isPresent()) {
        continue;
      }
      for (IEntry<Integer, ReachabilityStatus> e : index.incoming(fact.from, left)) {
        ReachabilityStatus status = rule.get().apply(e.value().times(ReachabilityStatus.parity(fact.odd)));
        addFacts(result, e.key(), fact.to, rule.get().result, status);
      }
    }

    for (PathClass right : PathClass.values()) {
      Optional<Rule> rule = join(fact.pathClass, right);
      if (!rule.isPresent()) {
        continue;
      }
      for (IEntry<Integer, ReachabilityStatus> e : index.outgoing(fact.to, right)) {
        ReachabilityStatus status = rule.get().apply(ReachabilityStatus.parity(fact.odd).times(e.value()));
        addFacts(result, fact.from, e.key(), rule.get().result, status);
      }
    }

    LinearList<Fact> fresh = new LinearList<>();
    result.stream().filter(f -> !index.contains(f)).forEach(fresh::addLast);
    return fresh;
  }

  private static void addFacts(LinearSet<Fact> result, int from, int to, PathClass pathClass, ReachabilityStatus status) {
    for (boolean odd : new boolean[] {false, true}) {
      if (status.has(odd)) {
        result.add(new Fact(from, to, pathClass, odd));
      }
    }
  }
}
