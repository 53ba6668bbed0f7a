package io.lacuna.modular.canonical;

/**
 * Operations on words over a set of {@link Generators}.
 */
public final class Words {

  private Words() {
  }

  public static String reduce(CharSequence word) {
    return reduce(Generators.STANDARD, word);
  }

  /**
   * Removes every sign flip, cancels each {@code S S} and {@code R R R} as it appears, and prefixes a single sign flip
   * if an odd number of them were removed or produced.
   *
   * @return the reduced form of {@code word}, which is accepted by {@link Generators#referenceAutomaton()}
   */
  public static String reduce(Generators generators, CharSequence word) {
    StringBuilder stack = new StringBuilder();
    boolean negative = false;

    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      int n = stack.length();

      if (c == generators.flip) {
        negative = !negative;
      } else if (c == generators.order2) {
        if (n > 0 && stack.charAt(n - 1) == c) {
          stack.setLength(n - 1);
          negative = !negative;
        } else {
          stack.append(c);
        }
      } else if (c == generators.order3) {
        if (n > 1 && stack.charAt(n - 1) == c && stack.charAt(n - 2) == c) {
          stack.setLength(n - 2);
          negative = !negative;
        } else {
          stack.append(c);
        }
      } else {
        throw new IllegalArgumentException("'" + c + "' at index " + i + " is not a generator of " + generators);
      }
    }

    return negative ? generators.flip + stack.toString() : stack.toString();
  }
}
