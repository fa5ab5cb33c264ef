package io.lacuna.lattice;

import io.lacuna.bifurcan.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.function.Function;

/**
 * @author ztellman
 */
public class Utils {

  /**
   * @return a new list holding the elements of {@code list} in their natural order, equal elements keeping their
   * relative order
   */
  public static <V extends Comparable<? super V>> LinearList<V> sorted(IList<V> list) {
    ArrayList<V> l = new ArrayList<>((int) list.size());
    list.forEach(l::add);
    Collections.sort(l);
    return LinearList.from(l);
  }

  /**
   * @return deep copies of every edge in {@code edges}
   */
  public static LinearList<Edge> copy(IList<Edge> edges) {
    LinearList<Edge> result = new LinearList<>();
    edges.forEach(e -> result.addLast(e.copy()));
    return result;
  }

  public static <K, V> IMap<K, IList<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, IList<V>> m = new LinearMap<>();
    for (V v : vals) {
      K k = f.apply(v);
      IList<V> l = m.get(k).orElse(null);
      if (l == null) {
        l = new LinearList<>();
        m.put(k, l);
      }
      l.addLast(v);
    }
    return m;
  }

  /**
   * @return one more than the largest state referenced by {@code edges}, or 0 if there are none
   */
  public static int stateCount(Iterable<Edge> edges) {
    int max = -1;
    for (Edge e : edges) {
      max = Math.max(max, Math.max(e.source, e.target));
    }
    return max + 1;
  }
}
