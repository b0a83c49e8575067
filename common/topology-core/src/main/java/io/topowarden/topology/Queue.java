package io.topowarden.topology;

import java.util.Map;
import java.util.Optional;

/**
 * Declared queue configuration. Runtime state (consumers, message counts, node placement) never
 * lives here; see {@link QueueConsumers} for the one runtime value the checks need.
 */
public record Queue(String name,
                    String vhost,
                    boolean durable,
                    boolean autoDelete,
                    Map<String, Object> arguments,
                    Map<String, Object> attributes) {

  public static final String MESSAGE_TTL = "x-message-ttl";
  public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";

  public Queue {
    name = StructuralException.requireIdentity(name, "queue", "name");
    vhost = vhost == null || vhost.isBlank() ? Topology.DEFAULT_VHOST : vhost;
    arguments = TopologyMaps.immutableCopy(arguments);
    attributes = TopologyMaps.immutableCopy(attributes);
  }

  public Queue(String name, String vhost, boolean durable, boolean autoDelete, Map<String, Object> arguments) {
    this(name, vhost, durable, autoDelete, arguments, Map.of());
  }

  public boolean isPermanent() {
    return durable && !autoDelete;
  }

  public boolean hasArgument(String key) {
    return arguments.containsKey(key);
  }

  /**
   * Exchange this queue dead-letters into, if one is configured. The default exchange ({@code ""})
   * is not a user-managed resource and is reported as absent.
   */
  public Optional<String> deadLetterExchange() {
    Object value = arguments.get(DEAD_LETTER_EXCHANGE);
    if (value instanceof String exchange && !exchange.isEmpty()) {
      return Optional.of(exchange);
    }
    return Optional.empty();
  }
}
