package io.lacuna.modular.canonical;

/**
 * Whether two states are connected by a path with an even number of sign flips, an odd number, or both.
 */
public final class ReachabilityStatus {

  public static final ReachabilityStatus NONE = new ReachabilityStatus(false, false);
  public static final ReachabilityStatus EVEN = new ReachabilityStatus(true, false);
  public static final ReachabilityStatus ODD = new ReachabilityStatus(false, true);
  public static final ReachabilityStatus BOTH = new ReachabilityStatus(true, true);

  public final boolean even;
  public final boolean odd;

  private ReachabilityStatus(boolean even, boolean odd) {
    this.even = even;
    this.odd = odd;
  }

  public static ReachabilityStatus of(boolean even, boolean odd) {
    return even ? (odd ? BOTH : EVEN) : (odd ? ODD : NONE);
  }

  public static ReachabilityStatus parity(boolean odd) {
    return odd ? ODD : EVEN;
  }

  public boolean has(boolean odd) {
    return odd ? this.odd : this.even;
  }

  public boolean isEmpty() {
    return !even && !odd;
  }

  /**
   * @return the status of a path made of a path with this status followed by one with {@code s}
   */
  public ReachabilityStatus times(ReachabilityStatus s) {
    return of((even && s.even) || (odd && s.odd), (even && s.odd) || (odd && s.even));
  }

  public ReachabilityStatus or(ReachabilityStatus s) {
    return of(even || s.even, odd || s.odd);
  }

  public ReachabilityStatus negate() {
    return of(odd, even);
  }

  @Override
  public int hashCode() {
    return (even ? 1 : 0) | (odd ? 2 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof ReachabilityStatus) {
      ReachabilityStatus s = (ReachabilityStatus) obj;
      return even == s.even && odd == s.odd;
    }
    return false;
  }

  @Override
  public String toString() {
    return even ? (odd ? "both" : "even") : (odd ? "odd" : "none");
  }
}
