package io.lacuna.rex;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.bifurcan.Maps;
import io.lacuna.bifurcan.Sets;

import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * @author ztellman
 */
public class Utils {

  private Utils() {
  }

  public static <V> LinearSet<V> toSet(Stream<V> s) {
    return s.collect(Sets.linearCollector());
  }

  /**
   * @return the characters of {@code s} as a set
   */
  public static ISet<Character> chars(String s) {
    return toSet(s.chars().mapToObj(c -> (char) c));
  }

  public static <K, U, V> IMap<K, V> mapVals(IMap<K, U> map, Function<U, V> f) {
    return map.stream()
            .collect(Maps.linearCollector(
                    e -> e.key(),
                    e -> f.apply(e.value())));
  }

  static String join(Iterable<?> values) {
    return StreamSupport.stream(values.spliterator(), false)
            .map(String::valueOf)
            .collect(Collectors.joining(", ", "[", "]"));
  }
}
