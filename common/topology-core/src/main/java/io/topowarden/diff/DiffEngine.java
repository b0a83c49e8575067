package io.topowarden.diff;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed structural diff over two sequences of records.
 * <p>
 * Each side is indexed by {@code keyOf}; a repeated key keeps the last record and is logged as a
 * data-quality warning. Records are compared with {@link Object#equals}, so map-valued fields
 * compare regardless of entry order.
 */
public final class DiffEngine {

  private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

  private DiffEngine() {
  }

  public static <T, K> DiffResult<K> diff(List<? extends T> expected,
                                          List<? extends T> actual,
                                          Function<? super T, ? extends K> keyOf) {
    Objects.requireNonNull(keyOf, "keyOf");
    Map<K, T> expectedByKey = index("expected", expected, keyOf);
    Map<K, T> actualByKey = index("actual", actual, keyOf);

    Set<K> missing = new LinkedHashSet<>();
    Set<K> different = new LinkedHashSet<>();
    expectedByKey.forEach((key, record) -> {
      if (!actualByKey.containsKey(key)) {
        missing.add(key);
      } else if (!Objects.equals(record, actualByKey.get(key))) {
        different.add(key);
      }
    });

    Set<K> extra = new LinkedHashSet<>();
    for (K key : actualByKey.keySet()) {
      if (!expectedByKey.containsKey(key)) {
        extra.add(key);
      }
    }
    return new DiffResult<>(missing, extra, different);
  }

  private static <T, K> Map<K, T> index(String side,
                                        List<? extends T> records,
                                        Function<? super T, ? extends K> keyOf) {
    Map<K, T> byKey = new LinkedHashMap<>();
    if (records == null) {
      return byKey;
    }
    for (T record : records) {
      K key = keyOf.apply(record);
      if (byKey.put(key, record) != null) {
        log.warn("duplicate key {} on {} side, keeping the last record", key, side);
      }
    }
    return byKey;
  }
}
