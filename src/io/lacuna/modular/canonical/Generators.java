package io.lacuna.modular.canonical;

import io.lacuna.modular.Automaton;

/**
 * The symbols standing for the generators of the modular group: a central sign flip {@code X}, an order-2 generator
 * {@code S} and an order-3 generator {@code R}, related by {@code S S = R R R = X} and {@code X X = 1}.
 */
public final class Generators {

  public static final Generators STANDARD = new Generators('X', 'S', 'R');

  public final char flip;
  public final char order2;
  public final char order3;

  public Generators(char flip, char order2, char order3) {
    if (flip == order2 || flip == order3 || order2 == order3) {
      throw new IllegalArgumentException("generator symbols must be distinct");
    }
    this.flip = flip;
    this.order2 = order2;
    this.order3 = order3;
  }

  public char[] alphabet() {
    return new char[] {flip, order2, order3};
  }

  /**
   * @return a deterministic automaton accepting exactly the reduced words: an optional sign flip, followed by
   * alternating {@code S} and {@code R} or {@code RR} blocks
   */
  public Automaton referenceAutomaton() {
    Automaton a = new Automaton(alphabet());
    int start = a.addState(true, true);
    int flipped = a.addState(true, false);
    int afterS = a.addState(true, false);
    int afterR = a.addState(true, false);
    int afterRR = a.addState(true, false);

    a.addTransition(start, flipped, flip);
    a.addTransition(start, afterS, order2);
    a.addTransition(start, afterR, order3);
    a.addTransition(flipped, afterS, order2);
    a.addTransition(flipped, afterR, order3);
    a.addTransition(afterS, afterR, order3);
    a.addTransition(afterR, afterRR, order3);
    a.addTransition(afterR, afterS, order2);
    a.addTransition(afterRR, afterS, order2);

    return a;
  }

  @Override
  public int hashCode() {
    return (flip * 31 + order2) * 31 + order3;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Generators) {
      Generators g = (Generators) obj;
      return flip == g.flip && order2 == g.order2 && order3 == g.order3;
    }
    return false;
  }

  @Override
  public String toString() {
    return "Generators[flip=" + flip + ", order2=" + order2 + ", order3=" + order3 + "]";
  }
}
