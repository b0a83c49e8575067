package io.topowarden.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Exchange, queue and binding records exactly as a broker's management API reported them.
 */
public record RawTopology(List<JsonNode> exchanges, List<JsonNode> queues, List<JsonNode> bindings) {

  public RawTopology {
    exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    queues = queues == null ? List.of() : List.copyOf(queues);
    bindings = bindings == null ? List.of() : List.copyOf(bindings);
  }
}
