package io.lacuna.modular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * A finite automaton over a fixed alphabet of characters.  States are non-negative integers handed out by
 * {@link #addState(boolean, boolean)}, and are never reused within the lifetime of an automaton, even after deletion.
 * <p>
 * {@link #toDFA()}, {@link #intersection(Automaton)} and {@link #minimize()} always return a new automaton, and never
 * modify the receiver.  Instances are not safe for concurrent modification.
 */
public class Automaton {

  private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

  /**
   * The silent symbol, usable in transitions regardless of the alphabet.
   */
  public static final char EPSILON = 'Ɛ';

  private final char[] alphabet;
  private final char[] labels;
  private final ISet<Character> symbols;

  private final LinearSet<Integer> states;
  private final LinearSet<Integer> startStates;
  private final LinearSet<Integer> goalStates;
  private final TransitionRelation transitions;
  private int nextState;

  /**
   * @param alphabet the symbols accepted by this automaton, which must not include {@link #EPSILON}
   */
  public Automaton(char... alphabet) {
    LinearSet<Character> symbols = new LinearSet<>();
    StringBuilder declared = new StringBuilder();
    for (char c : alphabet) {
      if (c == EPSILON) {
        throw new IllegalArgumentException("the epsilon symbol cannot be part of an alphabet");
      }
      if (!symbols.contains(c)) {
        symbols.add(c);
        declared.append(c);
      }
    }

    this.symbols = symbols;
    this.alphabet = declared.toString().toCharArray();
    this.labels = Arrays.copyOf(this.alphabet, this.alphabet.length + 1);
    this.labels[this.alphabet.length] = EPSILON;

    this.states = new LinearSet<>();
    this.startStates = new LinearSet<>();
    this.goalStates = new LinearSet<>();
    this.transitions = new TransitionRelation();
  }

  private Automaton(Automaton a) {
    this.alphabet = a.alphabet;
    this.labels = a.labels;
    this.symbols = a.symbols;
    this.states = a.states.clone();
    this.startStates = a.startStates.clone();
    this.goalStates = a.goalStates.clone();
    this.transitions = a.transitions.clone();
    this.nextState = a.nextState;
  }

  /// accessors

  /**
   * @return a copy of the alphabet, in the order it was declared
   */
  public char[] alphabet() {
    return alphabet.clone();
  }

  public boolean inAlphabet(char symbol) {
    return symbols.contains(symbol);
  }

  public ISet<Integer> states() {
    return states.clone();
  }

  public ISet<Integer> startStates() {
    return startStates.clone();
  }

  public ISet<Integer> goalStates() {
    return goalStates.clone();
  }

  public boolean isStart(int state) {
    return startStates.contains(state);
  }

  public boolean isGoal(int state) {
    return goalStates.contains(state);
  }

  /**
   * @return a copy of the states reachable from {@code state} by a single {@code symbol} edge
   */
  public ISet<Integer> targets(int state, char symbol) {
    return Utils.toSet(transitions.targets(state, symbol).stream());
  }

  public boolean hasTransition(int from, int to, char symbol) {
    return transitions.contains(from, to, symbol);
  }

  public long transitionCount() {
    return transitions.size();
  }

  /**
   * @return every transition, ordered by source state, then by symbol in alphabet order with epsilon last,
   * then by destination state
   */
  public IList<Transition> transitions() {
    LinearList<Transition> result = new LinearList<>();
    for (Integer from : Utils.sorted(states)) {
      for (char symbol : labels) {
        for (Integer to : Utils.sorted(transitions.targets(from, symbol))) {
          result.addLast(new Transition(from, to, symbol));
        }
      }
    }
    return result;
  }

  /// mutation

  public int addState() {
    return addState(false, false);
  }

  /**
   * @return the id of the new state
   */
  public int addState(boolean isGoal, boolean isStart) {
    int state = nextState++;
    if (states.contains(state)) {
      throw new IllegalStateException("state " + state + " already exists");
    }

    states.add(state);
    if (isGoal) {
      goalStates.add(state);
    }
    if (isStart) {
      startStates.add(state);
    }
    return state;
  }

  /**
   * @return true if the transition was not already present
   */
  public boolean addTransition(int from, int to, char symbol) {
    checkSymbol(symbol);
    checkState(from);
    checkState(to);

    return transitions.add(from, to, symbol);
  }

  /**
   * @return true if the transition was present
   */
  public boolean removeTransition(int from, int to, char symbol) {
    checkSymbol(symbol);
    checkState(from);
    checkState(to);

    return transitions.remove(from, to, symbol);
  }

  /**
   * Removes {@code state} along with every transition leaving it.  Incoming transitions are only removed if
   * {@code skipIncoming} is false, so it should only be set when there are known to be none.
   */
  public void deleteState(int state, boolean skipIncoming) {
    checkState(state);

    states.remove(state);
    startStates.remove(state);
    goalStates.remove(state);
    transitions.removeState(state, skipIncoming);
  }

  /**
   * @return true if the start states changed
   */
  public boolean setStartState(int state) {
    checkState(state);
    return toggle(startStates, state, true);
  }

  /**
   * @return true if the start states changed
   */
  public boolean unsetStartState(int state) {
    checkState(state);
    return toggle(startStates, state, false);
  }

  /**
   * @return true if the goal states changed
   */
  public boolean setGoalState(int state) {
    checkState(state);
    return toggle(goalStates, state, true);
  }

  /**
   * @return true if the goal states changed
   */
  public boolean unsetGoalState(int state) {
    checkState(state);
    return toggle(goalStates, state, false);
  }

  private static boolean toggle(LinearSet<Integer> set, int state, boolean member) {
    if (set.contains(state) == member) {
      return false;
    }

    if (member) {
      set.add(state);
    } else {
      set.remove(state);
    }
    return true;
  }

  private void checkState(int state) {
    if (!states.contains(state)) {
      throw new IllegalArgumentException("state " + state + " does not exist");
    }
  }

  private void checkSymbol(char symbol) {
    if (symbol != EPSILON && !symbols.contains(symbol)) {
      throw new IllegalArgumentException("symbol '" + symbol + "' is not in the alphabet " + new String(alphabet));
    }
  }

  /// simulation

  /**
   * @return all states reachable from {@code states} through zero or more epsilon transitions
   */
  public LinearSet<Integer> epsilonClosure(ISet<Integer> states) {
    LinearSet<Integer> closure = new LinearSet<>();
    LinearList<Integer> queue = new LinearList<>();
    for (Integer s : states) {
      closure.add(s);
      queue.addLast(s);
    }

    while (queue.size() > 0) {
      int s = queue.popFirst();
      for (Integer t : transitions.targets(s, EPSILON)) {
        if (!closure.contains(t)) {
          closure.add(t);
          queue.addLast(t);
        }
      }
    }

    return closure;
  }

  /**
   * @return the direct {@code symbol} successors of {@code states}, without any epsilon closure
   */
  public LinearSet<Integer> step(ISet<Integer> states, char symbol) {
    LinearSet<Integer> next = new LinearSet<>();
    states.forEach(s -> transitions.targets(s, symbol).forEach(next::add));
    return next;
  }

  /**
   * @return true if some path labelled with {@code word} leads from a start state to a goal state
   */
  public boolean accepts(CharSequence word) {
    if (startStates.size() == 0 || goalStates.size() == 0) {
      return false;
    }

    ISet<Integer> current = epsilonClosure(startStates);
    for (int i = 0; i < word.length(); i++) {
      current = epsilonClosure(step(current, word.charAt(i)));
      if (current.size() == 0) {
        return false;
      }
    }

    return current.containsAny(goalStates);
  }

  /**
   * @return true if no goal state is reachable from any start state
   */
  public boolean isEmpty() {
    LinearSet<Integer> visited = epsilonClosure(startStates);
    LinearList<Integer> queue = new LinearList<>();
    visited.forEach(queue::addLast);

    while (queue.size() > 0) {
      int s = queue.popFirst();
      if (goalStates.contains(s)) {
        return false;
      }

      for (char symbol : labels) {
        for (Integer t : transitions.targets(s, symbol)) {
          if (!visited.contains(t)) {
            visited.add(t);
            queue.addLast(t);
          }
        }
      }
    }

    return true;
  }

  /**
   * @return every accepted word of at most {@code maxLength} symbols, shortest first, and otherwise in alphabet order
   */
  public IList<String> acceptedWords(int maxLength) {
    LinearList<String> words = new LinearList<>();
    if (startStates.size() == 0 || goalStates.size() == 0) {
      return words;
    }

    LinearList<String> prefixes = LinearList.of("");
    LinearList<ISet<Integer>> frontiers = LinearList.of(epsilonClosure(startStates));

    for (int length = 0; length <= maxLength && prefixes.size() > 0; length++) {
      LinearList<String> nextPrefixes = new LinearList<>();
      LinearList<ISet<Integer>> nextFrontiers = new LinearList<>();

      for (long i = 0; i < prefixes.size(); i++) {
        String prefix = prefixes.nth(i);
        ISet<Integer> frontier = frontiers.nth(i);
        if (frontier.containsAny(goalStates)) {
          words.addLast(prefix);
        }

        if (length < maxLength) {
          for (char symbol : alphabet) {
            ISet<Integer> next = epsilonClosure(step(frontier, symbol));
            if (next.size() > 0) {
              nextPrefixes.addLast(prefix + symbol);
              nextFrontiers.addLast(next);
            }
          }
        }
      }

      prefixes = nextPrefixes;
      frontiers = nextFrontiers;
    }

    return words;
  }

  /// determinism

  /**
   * @return a description of the first way in which this automaton fails to be deterministic, if any
   */
  public Optional<String> dfaViolation() {
    if (startStates.size() != 1) {
      return Optional.of("expected exactly one start state, but found " + startStates.size());
    }

    IList<Integer> sorted = Utils.sorted(states);
    for (Integer state : sorted) {
      for (char symbol : alphabet) {
        long n = transitions.targets(state, symbol).size();
        if (n > 1) {
          return Optional.of("state " + state + " has " + n + " transitions on '" + symbol + "'");
        }
      }
    }

    for (Integer state : sorted) {
      if (transitions.targets(state, EPSILON).size() > 0) {
        return Optional.of("state " + state + " has an epsilon transition");
      }
    }

    return Optional.empty();
  }

  public boolean isDFA() {
    return !dfaViolation().isPresent();
  }

  private void requireDFA(String operation) {
    Optional<String> violation = dfaViolation();
    if (violation.isPresent()) {
      throw new IllegalStateException(operation + " requires a DFA, but " + violation.get());
    }
  }

  int startState() {
    return startStates.iterator().next();
  }

  /// transformations

  /**
   * @return a deterministic automaton accepting the same language, built by subset construction
   */
  public Automaton toDFA() {
    Automaton dfa = new Automaton(alphabet);
    LinearMap<ISet<Integer>, Integer> cache = new LinearMap<>();
    LinearList<ISet<Integer>> queue = new LinearList<>();

    Function<ISet<Integer>, Integer> enqueue = set -> {
      Optional<Integer> s = cache.get(set);
      if (s.isPresent()) {
        return s.get();
      }

      int state = dfa.addState(set.containsAny(goalStates), cache.size() == 0);
      cache.put(set, state);
      queue.addLast(set);
      return state;
    };

    enqueue.apply(epsilonClosure(startStates));

    while (queue.size() > 0) {
      ISet<Integer> set = queue.popFirst();
      int from = cache.get(set).get();

      for (char symbol : alphabet) {
        LinearSet<Integer> next = step(set, symbol);
        if (next.size() > 0) {
          dfa.addTransition(from, enqueue.apply(epsilonClosure(next)), symbol);
        }
      }
    }

    LOG.debug("subset construction: {} states -> {} states", states.size(), dfa.states.size());
    return dfa;
  }

  /**
   * @return a deterministic automaton accepting exactly the words accepted by both this and {@code automaton}, which
   * must both be deterministic and share an alphabet
   */
  public Automaton intersection(Automaton automaton) {
    requireDFA("intersection");
    automaton.requireDFA("intersection");

    if (symbols.size() != automaton.symbols.size() || !symbols.containsAll(automaton.symbols)) {
      throw new IllegalArgumentException("cannot intersect automata over distinct alphabets "
              + new String(alphabet) + " and " + new String(automaton.alphabet));
    }

    Automaton product = new Automaton(alphabet);
    LinearMap<IList<Integer>, Integer> cache = new LinearMap<>();
    LinearList<IList<Integer>> queue = new LinearList<>();

    Function<IList<Integer>, Integer> enqueue = pair -> {
      Optional<Integer> s = cache.get(pair);
      if (s.isPresent()) {
        return s.get();
      }

      boolean isGoal = goalStates.contains(pair.nth(0)) && automaton.goalStates.contains(pair.nth(1));
      int state = product.addState(isGoal, cache.size() == 0);
      cache.put(pair, state);
      queue.addLast(pair);
      return state;
    };

    enqueue.apply(LinearList.of(startState(), automaton.startState()));

    while (queue.size() > 0) {
      IList<Integer> pair = queue.popFirst();
      int from = cache.get(pair).get();

      for (char symbol : alphabet) {
        ISet<Integer> a = transitions.targets(pair.nth(0), symbol);
        ISet<Integer> b = automaton.transitions.targets(pair.nth(1), symbol);
        if (a.size() > 0 && b.size() > 0) {
          int to = enqueue.apply(LinearList.of(a.iterator().next(), b.iterator().next()));
          product.addTransition(from, to, symbol);
        }
      }
    }

    LOG.debug("intersection: {} x {} states -> {} states", states.size(), automaton.states.size(), product.states.size());
    return product;
  }

  /**
   * @return the minimal deterministic automaton accepting the same language, which only contains states reachable
   * from the start state
   */
  public Automaton minimize() {
    requireDFA("minimization");

    PartitionRefiner refiner = new PartitionRefiner(this);
    refiner.refine();

    Automaton min = new Automaton(alphabet);
    LinearMap<Integer, Integer> cache = new LinearMap<>();
    LinearList<Integer> queue = new LinearList<>();

    Function<Integer, Integer> enqueue = block -> {
      Optional<Integer> s = cache.get(block);
      if (s.isPresent()) {
        return s.get();
      }

      int state = min.addState(goalStates.contains(refiner.representative(block)), cache.size() == 0);
      cache.put(block, state);
      queue.addLast(block);
      return state;
    };

    enqueue.apply(refiner.blockOf(startState()));

    while (queue.size() > 0) {
      int block = queue.popFirst();
      int from = cache.get(block).get();
      int representative = refiner.representative(block);

      for (char symbol : alphabet) {
        ISet<Integer> next = transitions.targets(representative, symbol);
        if (next.size() > 0) {
          int target = refiner.blockOf(next.iterator().next());
          if (target != refiner.deadBlock()) {
            min.addTransition(from, enqueue.apply(target), symbol);
          }
        }
      }
    }

    LOG.debug("minimization: {} states -> {} states", states.size(), min.states.size());
    return min;
  }

  /// object

  @Override
  public Automaton clone() {
    return new Automaton(this);
  }

  @Override
  public int hashCode() {
    return (int) ((states.size() * 31 + startStates.size()) * 31 + goalStates.size()) * 31 + transitions.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Automaton)) {
      return false;
    }

    Automaton a = (Automaton) obj;
    return sameElements(symbols, a.symbols)
            && sameElements(states, a.states)
            && sameElements(startStates, a.startStates)
            && sameElements(goalStates, a.goalStates)
            && transitions.equals(a.transitions);
  }

  private static <V> boolean sameElements(ISet<V> a, ISet<V> b) {
    return a.size() == b.size() && a.containsAll(b);
  }

  @Override
  public String toString() {
    return "Automaton[alphabet=" + new String(alphabet)
            + ", states=" + Utils.sorted(states)
            + ", start=" + Utils.sorted(startStates)
            + ", goal=" + Utils.sorted(goalStates)
            + ", transitions=" + transitions() + "]";
  }
}
