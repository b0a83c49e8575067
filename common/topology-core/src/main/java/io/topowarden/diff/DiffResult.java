package io.topowarden.diff;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keys missing from the actual side, keys only present on the actual side, and keys present on
 * both sides whose records differ.
 */
public record DiffResult<K>(Set<K> missing, Set<K> extra, Set<K> different) {

  public DiffResult {
    missing = freeze(missing);
    extra = freeze(extra);
    different = freeze(different);
  }

  public static <K> DiffResult<K> empty() {
    return new DiffResult<>(Set.of(), Set.of(), Set.of());
  }

  public boolean isEmpty() {
    return missing.isEmpty() && extra.isEmpty() && different.isEmpty();
  }

  private static <K> Set<K> freeze(Set<K> keys) {
    if (keys == null || keys.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(keys));
  }
}
