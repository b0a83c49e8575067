package io.topowarden.topology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts between broker/snapshot JSON records and the typed topology model.
 * <p>
 * Decoding never invents identity fields: a record without {@code name} (exchanges, queues) or
 * {@code source}/{@code destination} (bindings) raises {@link StructuralException}. Any field that
 * is not a typed component ends up in the record's {@code attributes} map and is written back
 * unchanged on encode.
 */
public final class TopologyRecords {

  public static final String EXCHANGES = "exchanges";
  public static final String QUEUES = "queues";
  public static final String BINDINGS = "bindings";

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final Set<String> EXCHANGE_FIELDS =
      Set.of("name", "vhost", "type", "durable", "auto_delete", "internal", "arguments");
  private static final Set<String> QUEUE_FIELDS =
      Set.of("name", "vhost", "durable", "auto_delete", "arguments");
  private static final Set<String> BINDING_FIELDS =
      Set.of("source", "destination", "destination_type", "routing_key", "vhost", "arguments");

  private TopologyRecords() {
  }

  public static Exchange exchange(JsonNode node) {
    requireObject(node, "exchange");
    return new Exchange(
        requireText(node, "exchange", "name"),
        optionalText(node, "vhost"),
        optionalText(node, "type"),
        node.path("durable").asBoolean(false),
        node.path("auto_delete").asBoolean(false),
        node.path("internal").asBoolean(false),
        arguments(node, "exchange"),
        attributes(node, EXCHANGE_FIELDS));
  }

  public static Queue queue(JsonNode node) {
    requireObject(node, "queue");
    return new Queue(
        requireText(node, "queue", "name"),
        optionalText(node, "vhost"),
        node.path("durable").asBoolean(false),
        node.path("auto_delete").asBoolean(false),
        arguments(node, "queue"),
        attributes(node, QUEUE_FIELDS));
  }

  public static Binding binding(JsonNode node) {
    requireObject(node, "binding");
    return new Binding(
        requireText(node, "binding", "source"),
        requireText(node, "binding", "destination"),
        DestinationType.fromWireName(optionalText(node, "destination_type")),
        optionalText(node, "routing_key"),
        optionalText(node, "vhost"),
        arguments(node, "binding"),
        attributes(node, BINDING_FIELDS));
  }

  /**
   * Decode a snapshot document. A missing top-level section reads as empty.
   */
  public static Topology topology(JsonNode document) {
    if (document == null || !document.isObject()) {
      throw new StructuralException("topology document must be a JSON object");
    }
    return new Topology(
        decodeSection(document, EXCHANGES, TopologyRecords::exchange),
        decodeSection(document, QUEUES, TopologyRecords::queue),
        decodeSection(document, BINDINGS, TopologyRecords::binding));
  }

  public static ObjectNode toJson(Exchange exchange) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("name", exchange.name());
    node.put("vhost", exchange.vhost());
    node.put("type", exchange.type());
    node.put("durable", exchange.durable());
    node.put("auto_delete", exchange.autoDelete());
    node.put("internal", exchange.internal());
    node.set("arguments", MAPPER.valueToTree(exchange.arguments()));
    appendAttributes(node, exchange.attributes());
    return node;
  }

  public static ObjectNode toJson(Queue queue) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("name", queue.name());
    node.put("vhost", queue.vhost());
    node.put("durable", queue.durable());
    node.put("auto_delete", queue.autoDelete());
    node.set("arguments", MAPPER.valueToTree(queue.arguments()));
    appendAttributes(node, queue.attributes());
    return node;
  }

  public static ObjectNode toJson(Binding binding) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("source", binding.source());
    node.put("destination", binding.destination());
    node.put("destination_type", binding.destinationType().wireName());
    node.put("routing_key", binding.routingKey());
    node.put("vhost", binding.vhost());
    node.set("arguments", MAPPER.valueToTree(binding.arguments()));
    appendAttributes(node, binding.attributes());
    return node;
  }

  public static ObjectNode toJson(Topology topology) {
    ObjectNode document = MAPPER.createObjectNode();
    ArrayNode exchanges = document.putArray(EXCHANGES);
    topology.exchanges().forEach(exchange -> exchanges.add(toJson(exchange)));
    ArrayNode queues = document.putArray(QUEUES);
    topology.queues().forEach(queue -> queues.add(toJson(queue)));
    ArrayNode bindings = document.putArray(BINDINGS);
    topology.bindings().forEach(binding -> bindings.add(toJson(binding)));
    return document;
  }

  /**
   * Read a required, textual identity field.
   *
   * @throws StructuralException when the field is absent, null or not a string
   */
  public static String requireText(JsonNode node, String kind, String field) {
    requireObject(node, kind);
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new StructuralException(kind + " record is missing required field '" + field + "'");
    }
    if (!value.isTextual()) {
      throw new StructuralException(kind + " field '" + field + "' must be a string, got " + value.getNodeType());
    }
    return value.asText();
  }

  static void requireObject(JsonNode node, String kind) {
    if (node == null || !node.isObject()) {
      throw new StructuralException(kind + " record must be a JSON object");
    }
  }

  private static String optionalText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private static Map<String, Object> arguments(JsonNode node, String kind) {
    JsonNode arguments = node.get("arguments");
    if (arguments == null || arguments.isNull()) {
      return Map.of();
    }
    if (arguments.isArray() && arguments.isEmpty()) {
      // older management API versions render an empty argument table as []
      return Map.of();
    }
    if (!arguments.isObject()) {
      throw new StructuralException(kind + " field 'arguments' must be an object, got " + arguments.getNodeType());
    }
    return MAPPER.convertValue(arguments, MAP_TYPE);
  }

  private static Map<String, Object> attributes(JsonNode node, Set<String> typedFields) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!typedFields.contains(field.getKey())) {
        attributes.put(field.getKey(), MAPPER.convertValue(field.getValue(), Object.class));
      }
    }
    return attributes;
  }

  private static void appendAttributes(ObjectNode node, Map<String, Object> attributes) {
    attributes.forEach((key, value) -> {
      if (!node.has(key)) {
        node.set(key, MAPPER.valueToTree(value));
      }
    });
  }

  private static <T> List<T> decodeSection(JsonNode document, String section, Function<JsonNode, T> decoder) {
    JsonNode records = document.get(section);
    if (records == null || records.isNull()) {
      return List.of();
    }
    if (!records.isArray()) {
      throw new StructuralException("topology section '" + section + "' must be an array");
    }
    List<T> decoded = new ArrayList<>(records.size());
    for (JsonNode record : records) {
      decoded.add(decoder.apply(record));
    }
    return decoded;
  }
}
