package io.topowarden.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topowarden.topology.StructuralException;
import java.util.List;
import java.util.Set;

/**
 * Strips runtime and statistics fields from raw broker records so that only declared
 * configuration is left. Inputs are never mutated; cleaning a cleaned record is a no-op.
 */
public final class RecordCleaner {

  static final Set<String> EXCHANGE_RUNTIME_FIELDS = Set.of("message_stats");

  static final Set<String> QUEUE_RUNTIME_FIELDS = Set.of(
      "node",
      "consumer_details",
      "consumers",
      "consumer_utilisation",
      "messages",
      "messages_details",
      "messages_ready",
      "messages_ready_details",
      "messages_unacknowledged",
      "messages_unacknowledged_details",
      "message_stats",
      "memory",
      "idle_since",
      "backing_queue_status",
      "policy",
      "slave_nodes",
      "synchronised_slave_nodes",
      "state");

  // broker-side identity hash, not declared configuration
  static final Set<String> BINDING_RUNTIME_FIELDS = Set.of("properties_key");

  private RecordCleaner() {
  }

  public static ObjectNode cleanExchange(JsonNode exchange) {
    return strip(exchange, "exchange", EXCHANGE_RUNTIME_FIELDS);
  }

  public static ObjectNode cleanQueue(JsonNode queue) {
    return strip(queue, "queue", QUEUE_RUNTIME_FIELDS);
  }

  public static ObjectNode cleanBinding(JsonNode binding) {
    return strip(binding, "binding", BINDING_RUNTIME_FIELDS);
  }

  private static ObjectNode strip(JsonNode record, String kind, Set<String> runtimeFields) {
    if (record == null || !record.isObject()) {
      throw new StructuralException(kind + " record must be a JSON object");
    }
    ObjectNode copy = ((ObjectNode) record).deepCopy();
    copy.remove(List.copyOf(runtimeFields));
    return copy;
  }
}
