package io.lacuna.modular.canonical;

import com.google.common.base.Stopwatch;
import io.lacuna.modular.Automaton;
import io.lacuna.modular.RegexCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Turns patterns over a set of {@link Generators} into minimal deterministic automata, and intersects them.  Exactly
 * one operand of {@link #solve(String, String)} is canonicalized, and the result is further restricted to reduced
 * words by intersecting with {@link Generators#referenceAutomaton()}.
 */
public class LanguagePipeline {

  private static final Logger LOG = LoggerFactory.getLogger(LanguagePipeline.class);

  private final Generators generators;
  private final RegexCompiler compiler;
  private final Canonicalizer canonicalizer;
  private final Automaton reference;

  public LanguagePipeline(Generators generators) {
    this.generators = generators;
    this.compiler = new RegexCompiler(generators.alphabet());
    this.canonicalizer = new Canonicalizer(generators);
    this.reference = generators.referenceAutomaton();
  }

  public Generators generators() {
    return generators;
  }

  private static <T> T timed(String stage, Supplier<T> f) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    T result = f.get();
    LOG.debug("{} took {}ms", stage, stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return result;
  }

  /**
   * @return the minimal automaton accepting the words matched by {@code regex}
   */
  public Automaton plainDfa(String regex) {
    Automaton nfa = timed("compilation", () -> compiler.compile(regex));
    Automaton dfa = timed("subset construction", nfa::toDFA);
    return timed("minimization", dfa::minimize);
  }

  /**
   * @return the minimal automaton accepting the words matched by {@code regex}, along with every word reachable from
   * them by inserting or removing relators
   */
  public Automaton canonicalDfa(String regex) {
    Automaton nfa = timed("compilation", () -> compiler.compile(regex));
    Automaton dfa = timed("subset construction", nfa::toDFA);
    Automaton saturated = timed("canonicalization", () -> canonicalizer.canonicalize(dfa));
    Automaton redetermined = timed("subset construction", saturated::toDFA);
    return timed("minimization", redetermined::minimize);
  }

  /**
   * @return the minimal automaton accepting the words accepted by every one of {@code dfas}
   */
  public Automaton intersectAll(Automaton first, Automaton... rest) {
    Automaton result = first;
    for (Automaton a : rest) {
      Automaton acc = result;
      result = timed("intersection", () -> acc.intersection(a));
    }
    Automaton product = result;
    return timed("minimization", product::minimize);
  }

  /**
   * @return the minimal automaton accepting the reduced words which are equal in the group to some word matched by
   * {@code canonicalRegex}, and are themselves matched by {@code plainRegex}
   */
  public Automaton solve(String canonicalRegex, String plainRegex) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Automaton result = intersectAll(reference, canonicalDfa(canonicalRegex), plainDfa(plainRegex));
    LOG.debug("solved '{}' against '{}' in {}ms, with {} states",
            canonicalRegex, plainRegex, stopwatch.elapsed(TimeUnit.MILLISECONDS), result.states().size());
    return result;
  }
}
