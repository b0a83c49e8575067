package io.topowarden.topology;

import java.util.Map;

/**
 * Routing rule from a source exchange to a queue or exchange.
 */
public record Binding(String source,
                      String destination,
                      DestinationType destinationType,
                      String routingKey,
                      String vhost,
                      Map<String, Object> arguments,
                      Map<String, Object> attributes) {

  public Binding {
    source = StructuralException.requireIdentity(source, "binding", "source");
    destination = StructuralException.requireIdentity(destination, "binding", "destination");
    destinationType = destinationType == null ? DestinationType.QUEUE : destinationType;
    routingKey = routingKey == null ? "" : routingKey;
    vhost = vhost == null || vhost.isBlank() ? Topology.DEFAULT_VHOST : vhost;
    arguments = TopologyMaps.immutableCopy(arguments);
    attributes = TopologyMaps.immutableCopy(attributes);
  }

  public Binding(String source, String destination, DestinationType destinationType, String routingKey, String vhost) {
    this(source, destination, destinationType, routingKey, vhost, Map.of(), Map.of());
  }

  public boolean targetsQueue() {
    return destinationType == DestinationType.QUEUE;
  }

  public boolean targetsExchange() {
    return destinationType == DestinationType.EXCHANGE;
  }
}
