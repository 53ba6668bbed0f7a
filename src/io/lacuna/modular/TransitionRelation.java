package io.lacuna.modular;

import io.lacuna.bifurcan.*;

/**
 * A sparse mapping of {@code (state, symbol)} onto the set of destination states.  Parallel identical edges collapse,
 * but a state may have several distinct destinations for the same symbol.
 */
public class TransitionRelation {

  private final LinearMap<Integer, LinearMap<Character, LinearSet<Integer>>> transitions;
  private long size;

  public TransitionRelation() {
    this(new LinearMap<>(), 0);
  }

  private TransitionRelation(LinearMap<Integer, LinearMap<Character, LinearSet<Integer>>> transitions, long size) {
    this.transitions = transitions;
    this.size = size;
  }

  /**
   * @return true if the edge was not already present
   */
  public boolean add(int from, int to, char symbol) {
    LinearSet<Integer> targets = transitions
            .getOrCreate(from, LinearMap::new)
            .getOrCreate(symbol, LinearSet::new);

    if (targets.contains(to)) {
      return false;
    }

    targets.add(to);
    size++;
    return true;
  }

  /**
   * @return true if the edge was present
   */
  public boolean remove(int from, int to, char symbol) {
    LinearSet<Integer> targets = transitions.get(from).flatMap(row -> row.get(symbol)).orElse(null);
    if (targets == null || !targets.contains(to)) {
      return false;
    }

    targets.remove(to);
    size--;
    return true;
  }

  /**
   * Removes every edge leaving {@code state}, and unless {@code skipIncoming} is set, every edge entering it.
   */
  public void removeState(int state, boolean skipIncoming) {
    transitions.get(state).ifPresent(row -> {
      for (IEntry<Character, LinearSet<Integer>> e : row) {
        size -= e.value().size();
      }
    });
    transitions.remove(state);

    if (skipIncoming) {
      return;
    }

    for (IEntry<Integer, LinearMap<Character, LinearSet<Integer>>> row : transitions) {
      for (IEntry<Character, LinearSet<Integer>> e : row.value()) {
        if (e.value().contains(state)) {
          e.value().remove(state);
          size--;
        }
      }
    }
  }

  /**
   * @return the states reachable from {@code from} by a single {@code symbol} edge, which must not be modified
   */
  public ISet<Integer> targets(int from, char symbol) {
    return transitions.get(from)
            .flatMap(row -> row.get(symbol))
            .map(s -> (ISet<Integer>) s)
            .orElse((ISet<Integer>) Sets.EMPTY);
  }

  public boolean contains(int from, int to, char symbol) {
    return targets(from, symbol).contains(to);
  }

  /**
   * @return the number of edges
   */
  public long size() {
    return size;
  }

  @Override
  public TransitionRelation clone() {
    return new TransitionRelation(
            Utils.mapVals(transitions, row -> Utils.mapVals(row, LinearSet::clone)),
            size);
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (IEntry<Integer, LinearMap<Character, LinearSet<Integer>>> row : transitions) {
      for (IEntry<Character, LinearSet<Integer>> e : row.value()) {
        for (Integer to : e.value()) {
          hash += (row.key() * 31 + e.key()) * 31 + to;
        }
      }
    }
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TransitionRelation)) {
      return false;
    }

    TransitionRelation other = (TransitionRelation) obj;
    if (size != other.size) {
      return false;
    }

    for (IEntry<Integer, LinearMap<Character, LinearSet<Integer>>> row : transitions) {
      for (IEntry<Character, LinearSet<Integer>> e : row.value()) {
        for (Integer to : e.value()) {
          if (!other.contains(row.key(), to, e.key())) {
            return false;
          }
        }
      }
    }
    return true;
  }
}
