package io.lacuna.modular.canonical;

import io.lacuna.bifurcan.*;
import io.lacuna.modular.Automaton;
import io.lacuna.modular.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saturates an automaton over a set of {@link Generators} with every sign flip and epsilon transition implied by the
 * group relations, so that words which are equal in the group are treated alike by later intersection and
 * minimization.
 * <p>
 * The closure is a worklist over {@link Fact}s: each transition becomes a fact, and each new fact is joined with its
 * already-known neighbors via {@link Relations}.  Every distinct fact is expanded exactly once, and a derived
 * {@link PathClass#NEUTRAL} fact is written back into the automaton as a sign flip transition if its parity is odd, or
 * an epsilon transition if it is even.
 */
public class Canonicalizer {

  private static final Logger LOG = LoggerFactory.getLogger(Canonicalizer.class);

  private final Generators generators;

  public Canonicalizer(Generators generators) {
    this.generators = generators;
  }

  public Generators generators() {
    return generators;
  }

  private class Closure {
    final Automaton automaton;
    final ReachabilityIndex index = new ReachabilityIndex();
    final LinearList<Fact> queue = new LinearList<>();
    long added;

    Closure(Automaton automaton) {
      this.automaton = automaton;
    }

    void seed(Iterable<Transition> transitions) {
      for (Transition t : transitions) {
        Relations.fact(generators, t).ifPresent(queue::addLast);
      }
    }

    void run() {
      while (queue.size() > 0) {
        Fact fact = queue.popFirst();
        if (!index.add(fact)) {
          continue;
        }

        if (fact.pathClass == PathClass.NEUTRAL) {
          materialize(fact);
        }
        Relations.consequences(index, fact).forEach(queue::addLast);
      }
    }

    private void materialize(Fact fact) {
      boolean isNew;
      if (fact.odd) {
        isNew = automaton.addTransition(fact.from, fact.to, generators.flip);
      } else if (fact.from != fact.to) {
        isNew = automaton.addTransition(fact.from, fact.to, Automaton.EPSILON);
      } else {
        isNew = false;
      }

      if (isNew) {
        added++;
      }
    }
  }

  private void checkAlphabet(Automaton automaton) {
    if (!automaton.inAlphabet(generators.flip)) {
      throw new IllegalArgumentException("automaton alphabet " + new String(automaton.alphabet())
              + " does not contain the sign flip '" + generators.flip + "'");
    }
  }

  /**
   * Adds every transition implied by the relations along existing paths.
   *
   * @return the number of transitions added, which is zero if {@code automaton} is already saturated
   */
  public long saturate(Automaton automaton) {
    checkAlphabet(automaton);

    Closure closure = new Closure(automaton);
    closure.seed(automaton.transitions());
    closure.run();

    LOG.debug("saturation derived {} facts and added {} transitions", closure.index.size(), closure.added);
    return closure.added;
  }

  /**
   * Saturates {@code automaton}, then surrounds every {@code S} and {@code R} transition with a parallel path through
   * two new states joined to its ends by sign flips, and saturates again.
   *
   * @return {@code automaton}, which is modified in place
   */
  public Automaton canonicalize(Automaton automaton) {
    checkAlphabet(automaton);

    Closure closure = new Closure(automaton);
    closure.seed(automaton.transitions());
    closure.run();

    IList<Transition> buffered = addSurroundedPaths(automaton);
    closure.seed(buffered);
    closure.run();

    LOG.debug("canonicalization derived {} facts, and added {} transitions with {} buffered paths",
            closure.index.size(), closure.added + buffered.size(), buffered.size() / 3);
    return automaton;
  }

  /**
   * For each generator transition {@code p -g-> q} not already surrounded, adds {@code p -X-> b -g-> a -X-> q} with
   * fresh states {@code b} and {@code a}.
   *
   * @return the transitions added
   */
  IList<Transition> addSurroundedPaths(Automaton automaton) {
    IList<Transition> transitions = automaton.transitions();

    // target -> sources, for sign flip edges
    LinearMap<Integer, LinearSet<Integer>> flipSources = new LinearMap<>();
    for (Transition t : transitions) {
      if (t.symbol == generators.flip) {
        flipSources.getOrCreate(t.to, LinearSet::new).add(t.from);
      }
    }

    LinearList<Transition> pending = new LinearList<>();
    for (Transition t : transitions) {
      if ((t.symbol == generators.order2 || t.symbol == generators.order3) && !isSurrounded(automaton, flipSources, t)) {
        pending.addLast(t);
      }
    }

    LinearList<Transition> added = new LinearList<>();
    for (Transition t : pending) {
      int before = automaton.addState();
      int after = automaton.addState();
      Transition[] path = {
              new Transition(t.from, before, generators.flip),
              new Transition(before, after, t.symbol),
              new Transition(after, t.to, generators.flip)};
      for (Transition p : path) {
        automaton.addTransition(p.from, p.to, p.symbol);
        added.addLast(p);
      }
    }

    return added;
  }

  // whether some other transition with the same symbol runs parallel to t, one sign flip away at each end
  private boolean isSurrounded(Automaton automaton, IMap<Integer, LinearSet<Integer>> flipSources, Transition t) {
    // t.from -X-> u.from -g-> u.to -X-> t.to
    for (Integer from : automaton.targets(t.from, generators.flip)) {
      for (Integer to : automaton.targets(from, t.symbol)) {
        if ((from != t.from || to != t.to) && automaton.hasTransition(to, t.to, generators.flip)) {
          return true;
        }
      }
    }

    // u.from -X-> t.from -g-> t.to -X-> u.to
    for (Integer from : flipSources.get(t.from, new LinearSet<>())) {
      for (Integer to : automaton.targets(from, t.symbol)) {
        if ((from != t.from || to != t.to) && automaton.hasTransition(t.to, to, generators.flip)) {
          return true;
        }
      }
    }

    return false;
  }
}
