package io.topowarden.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class TopologyMaps {

  private TopologyMaps() {
  }

  // Broker argument values may legitimately be JSON null, so Map.copyOf is not an option.
  static Map<String, Object> immutableCopy(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
