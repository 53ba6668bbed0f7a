package io.lacuna.modular.canonical;

/**
 * A derived path of some {@link PathClass} between two states, along with the parity of its sign flips.
 */
public final class Fact {

  public final int from;
  public final int to;
  public final PathClass pathClass;
  public final boolean odd;

  public Fact(int from, int to, PathClass pathClass, boolean odd) {
    this.from = from;
    this.to = to;
    this.pathClass = pathClass;
    this.odd = odd;
  }

  @Override
  public int hashCode() {
    return ((from * 31 + to) * 31 + pathClass.ordinal()) * 2 + (odd ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Fact) {
      Fact f = (Fact) obj;
      return from == f.from && to == f.to && pathClass == f.pathClass && odd == f.odd;
    }
    return false;
  }

  @Override
  public String toString() {
    return from + " -" + pathClass + (odd ? "/odd" : "/even") + "-> " + to;
  }
}
