package io.lacuna.modular.canonical;

/**
 * The shapes of path tracked while saturating an automaton, where {@code N} is any path that reduces to the identity
 * or the sign flip.
 */
public enum PathClass {
  /** {@code N} */
  NEUTRAL,
  /** {@code S N} */
  S,
  /** {@code R N} */
  R,
  /** {@code R N R N} */
  RR
}
