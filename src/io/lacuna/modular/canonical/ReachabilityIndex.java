package io.lacuna.modular.canonical;

import io.lacuna.bifurcan.*;

/**
 * Every fact derived so far, viewed from both ends: for each state and {@link PathClass}, the states it reaches and
 * the states reaching it, each with a {@link ReachabilityStatus}.
 */
public class ReachabilityIndex {

  private final LinearMap<Integer, LinearMap<PathClass, LinearMap<Integer, ReachabilityStatus>>> outgoing =
          new LinearMap<>();
  private final LinearMap<Integer, LinearMap<PathClass, LinearMap<Integer, ReachabilityStatus>>> incoming =
          new LinearMap<>();
  private long size;

  private static LinearMap<Integer, ReachabilityStatus> view(
          LinearMap<Integer, LinearMap<PathClass, LinearMap<Integer, ReachabilityStatus>>> index,
          int state,
          PathClass pathClass) {
    return index.getOrCreate(state, LinearMap::new).getOrCreate(pathClass, LinearMap::new);
  }

  public boolean contains(Fact fact) {
    return outgoing.get(fact.from)
            .flatMap(m -> m.get(fact.pathClass))
            .flatMap(m -> m.get(fact.to))
            .map(s -> s.has(fact.odd))
            .orElse(false);
  }

  /**
   * @return true if the fact was not already known
   */
  public boolean add(Fact fact) {
    if (contains(fact)) {
      return false;
    }

    ReachabilityStatus s = ReachabilityStatus.parity(fact.odd);
    LinearMap<Integer, ReachabilityStatus> out = view(outgoing, fact.from, fact.pathClass);
    out.put(fact.to, out.get(fact.to, ReachabilityStatus.NONE).or(s));
    LinearMap<Integer, ReachabilityStatus> in = view(incoming, fact.to, fact.pathClass);
    in.put(fact.from, in.get(fact.from, ReachabilityStatus.NONE).or(s));

    size++;
    return true;
  }

  /**
   * @return the states reached from {@code state} by a path of {@code pathClass}
   */
  public IMap<Integer, ReachabilityStatus> outgoing(int state, PathClass pathClass) {
    return view(outgoing, state, pathClass);
  }

  /**
   * @return the states reaching {@code state} by a path of {@code pathClass}
   */
  public IMap<Integer, ReachabilityStatus> incoming(int state, PathClass pathClass) {
    return view(incoming, state, pathClass);
  }

  public ReachabilityStatus status(int from, int to, PathClass pathClass) {
    return view(outgoing, from, pathClass).get(to, ReachabilityStatus.NONE);
  }

  /**
   * @return the number of distinct facts, counting each parity separately
   */
  public long size() {
    return size;
  }
}
