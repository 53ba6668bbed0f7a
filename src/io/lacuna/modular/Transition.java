package io.lacuna.modular;

/**
 * A single labelled edge between two states.
 */
public final class Transition {

  public final int from;
  public final int to;
  public final char symbol;

  public Transition(int from, int to, char symbol) {
    this.from = from;
    this.to = to;
    this.symbol = symbol;
  }

  @Override
  public int hashCode() {
    return (from * 31 + to) * 31 + symbol;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Transition) {
      Transition t = (Transition) obj;
      return from == t.from && to == t.to && symbol == t.symbol;
    }
    return false;
  }

  @Override
  public String toString() {
    return from + " -" + symbol + "-> " + to;
  }
}
