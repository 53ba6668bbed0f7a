package io.lacuna.modular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles patterns built from alphabet symbols, grouping parentheses, postfix {@code *}, alternation {@code |} and
 * implicit concatenation into nondeterministic automata, via Thompson's construction.  The result has exactly one
 * start state and one goal state.
 */
public class RegexCompiler {

  private static final Logger LOG = LoggerFactory.getLogger(RegexCompiler.class);

  public static final char STAR = '*';
  public static final char UNION = '|';
  public static final char CONCAT = '.';
  public static final char OPEN = '(';
  public static final char CLOSE = ')';

  private final char[] alphabet;
  private final LinearSet<Character> symbols = new LinearSet<>();

  public RegexCompiler(char... alphabet) {
    for (char c : alphabet) {
      if (isOperator(c) || c == OPEN || c == CLOSE) {
        throw new IllegalArgumentException("'" + c + "' is reserved, and cannot be part of an alphabet");
      }
      symbols.add(c);
    }
    this.alphabet = alphabet.clone();
  }

  private static boolean isOperator(char c) {
    return c == STAR || c == UNION || c == CONCAT;
  }

  private static int precedence(char c) {
    switch (c) {
      case STAR:
        return 3;
      case CONCAT:
        return 2;
      case UNION:
        return 1;
      default:
        return 0;
    }
  }

  private boolean isSymbol(char c) {
    return c == Automaton.EPSILON || symbols.contains(c);
  }

  /// parsing

  /**
   * @return {@code pattern} with an explicit {@link #CONCAT} between every pair of juxtaposed operands
   */
  String explicitConcatenation(String pattern) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (!isSymbol(c) && c != STAR && c != UNION && c != OPEN && c != CLOSE) {
        throw new RegexSyntaxException("'" + c + "' is neither an operator nor in the alphabet", pattern, i);
      }

      if (i > 0) {
        char prev = pattern.charAt(i - 1);
        if (c == STAR && !(isSymbol(prev) || prev == CLOSE || prev == STAR)) {
          throw new RegexSyntaxException("dangling '*'", pattern, i);
        }
        if ((isSymbol(prev) || prev == CLOSE || prev == STAR) && (isSymbol(c) || c == OPEN)) {
          sb.append(CONCAT);
        }
      } else if (c == STAR) {
        throw new RegexSyntaxException("dangling '*'", pattern, i);
      }

      sb.append(c);
    }
    return sb.toString();
  }

  /**
   * @return the postfix form of {@code pattern}, with {@link #CONCAT} as the explicit concatenation operator
   */
  public String toPostfix(String pattern) {
    String infix = explicitConcatenation(pattern);
    StringBuilder out = new StringBuilder();
    LinearList<Character> stack = new LinearList<>();
    LinearList<Integer> openings = new LinearList<>();

    for (int i = 0; i < infix.length(); i++) {
      char c = infix.charAt(i);
      switch (c) {
        case OPEN:
          stack.addLast(c);
          openings.addLast(i);
          break;
        case CLOSE:
          while (stack.size() > 0 && stack.nth(stack.size() - 1) != OPEN) {
            out.append(stack.popLast());
          }
          if (stack.size() == 0) {
            throw new RegexSyntaxException("unmatched ')'", pattern, -1);
          }
          stack.popLast();
          openings.popLast();
          break;
        case STAR:
        case CONCAT:
        case UNION:
          while (stack.size() > 0 && precedence(stack.nth(stack.size() - 1)) >= precedence(c)) {
            out.append(stack.popLast());
          }
          stack.addLast(c);
          break;
        default:
          out.append(c);
      }
    }

    while (stack.size() > 0) {
      char c = stack.popLast();
      if (c == OPEN) {
        throw new RegexSyntaxException("unmatched '('", pattern, -1);
      }
      out.append(c);
    }

    return out.toString();
  }

  /// construction

  private static class Fragment {
    final int entry, exit;

    Fragment(int entry, int exit) {
      this.entry = entry;
      this.exit = exit;
    }
  }

  /**
   * @return an automaton accepting exactly the words matched by {@code pattern}
   * @throws RegexSyntaxException if the pattern is malformed or uses symbols outside the alphabet
   */
  public Automaton compile(String pattern) {
    Automaton a = new Automaton(alphabet);
    if (pattern.isEmpty()) {
      a.addState(true, true);
      return a;
    }

    String postfix = toPostfix(pattern);
    LinearList<Fragment> stack = new LinearList<>();

    for (int i = 0; i < postfix.length(); i++) {
      char c = postfix.charAt(i);
      if (!isOperator(c)) {
        int entry = a.addState();
        int exit = a.addState();
        a.addTransition(entry, exit, c);
        stack.addLast(new Fragment(entry, exit));
        continue;
      }

      if (stack.size() < (c == STAR ? 1 : 2)) {
        throw new RegexSyntaxException("missing operand for '" + c + "'", pattern, -1);
      }

      switch (c) {
        case STAR: {
          Fragment f = stack.popLast();
          int entry = a.addState();
          int exit = a.addState();
          a.addTransition(entry, f.entry, Automaton.EPSILON);
          a.addTransition(entry, exit, Automaton.EPSILON);
          a.addTransition(f.exit, f.entry, Automaton.EPSILON);
          a.addTransition(f.exit, exit, Automaton.EPSILON);
          stack.addLast(new Fragment(entry, exit));
          break;
        }
        case CONCAT: {
          Fragment right = stack.popLast();
          Fragment left = stack.popLast();
          splice(a, left.exit, right.entry);
          stack.addLast(new Fragment(left.entry, right.exit));
          break;
        }
        case UNION: {
          Fragment right = stack.popLast();
          Fragment left = stack.popLast();
          int entry = a.addState();
          int exit = a.addState();
          a.addTransition(entry, left.entry, Automaton.EPSILON);
          a.addTransition(entry, right.entry, Automaton.EPSILON);
          a.addTransition(left.exit, exit, Automaton.EPSILON);
          a.addTransition(right.exit, exit, Automaton.EPSILON);
          stack.addLast(new Fragment(entry, exit));
          break;
        }
        default:
          throw new IllegalStateException();
      }
    }

    if (stack.size() != 1) {
      throw new RegexSyntaxException("expected a single expression, found " + stack.size(), pattern, -1);
    }

    Fragment f = stack.popLast();
    a.setStartState(f.entry);
    a.setGoalState(f.exit);

    LOG.debug("compiled '{}' into {} states and {} transitions", pattern, a.states().size(), a.transitionCount());
    return a;
  }

  // entry states never have incoming edges, so the old entry can be dropped without scanning for them
  private void splice(Automaton a, int exit, int entry) {
    for (char symbol : alphabet) {
      a.targets(entry, symbol).forEach(t -> a.addTransition(exit, t, symbol));
    }
    a.targets(entry, Automaton.EPSILON).forEach(t -> a.addTransition(exit, t, Automaton.EPSILON));
    a.deleteState(entry, true);
  }
}
