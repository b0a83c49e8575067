package io.topowarden.topology;

/**
 * Key functions used to match records between two topologies.
 * <p>
 * Binding keys leave out the routing key, so a routing-key change shows up as a changed binding
 * rather than as one removed and one added.
 */
public final class TopologyKeys {

  static final String SEPARATOR = "|";

  private TopologyKeys() {
  }

  public static String exchangeKey(Exchange exchange) {
    return StructuralException.requireIdentity(exchange.name(), "exchange", "name");
  }

  public static String queueKey(Queue queue) {
    return StructuralException.requireIdentity(queue.name(), "queue", "name");
  }

  /**
   * Name qualified by its vhost. Unique per resource kind within one {@link Topology}.
   */
  public static String vhostScoped(String vhost, String name) {
    String scope = vhost == null || vhost.isBlank() ? Topology.DEFAULT_VHOST : vhost;
    return scope + SEPARATOR + name;
  }

  public static String bindingKey(Binding binding) {
    return StructuralException.requireIdentity(binding.source(), "binding", "source")
        + SEPARATOR
        + StructuralException.requireIdentity(binding.destination(), "binding", "destination")
        + SEPARATOR
        + binding.destinationType().wireName();
  }
}
