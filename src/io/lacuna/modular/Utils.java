package io.lacuna.modular;

import io.lacuna.bifurcan.*;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Small helpers over bifurcan collections.
 */
public class Utils {

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  public static <K, U, V> LinearMap<K, V> mapVals(IMap<K, U> map, Function<U, V> f) {
    LinearMap<K, V> m = new LinearMap<>();
    for (IEntry<K, U> e : map) {
      m.put(e.key(), f.apply(e.value()));
    }
    return m;
  }

  public static <K, V> LinearMap<K, LinearList<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, LinearList<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearList::new).addLast(v));
    return m;
  }

  /**
   * @return the elements of {@code set} in ascending order
   */
  public static LinearList<Integer> sorted(ISet<Integer> set) {
    LinearList<Integer> list = new LinearList<>();
    set.stream().sorted().forEach(list::addLast);
    return list;
  }
}
