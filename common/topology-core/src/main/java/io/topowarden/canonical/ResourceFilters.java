package io.topowarden.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import io.topowarden.topology.TopologyRecords;

/**
 * Predicates deciding which raw broker records describe user-managed, permanent topology.
 * <p>
 * {@link Canonicalizer} applies them in this order: {@link #isUserManagedExchange} to exchanges,
 * {@link #isPermanent} to exchanges and queues, {@link #hasNamedSource} to bindings. Each one
 * validates the identity field it reads.
 */
public final class ResourceFilters {

  /** Name prefix the broker reserves for its own exchanges. */
  public static final String INTERNAL_PREFIX = "amq.";

  private ResourceFilters() {
  }

  /**
   * False for the default exchange, for {@code amq.*} exchanges and for exchanges flagged
   * {@code internal}.
   */
  public static boolean isUserManagedExchange(JsonNode exchange) {
    String name = TopologyRecords.requireText(exchange, "exchange", "name");
    if (name.isEmpty() || name.startsWith(INTERNAL_PREFIX)) {
      return false;
    }
    return !exchange.path("internal").asBoolean(false);
  }

  /**
   * True for durable, non-auto-delete resources.
   */
  public static boolean isPermanent(JsonNode resource) {
    return resource.path("durable").asBoolean(false)
        && !resource.path("auto_delete").asBoolean(false);
  }

  /**
   * False for bindings from the default exchange, which every queue gets implicitly.
   */
  public static boolean hasNamedSource(JsonNode binding) {
    return !TopologyRecords.requireText(binding, "binding", "source").isEmpty();
  }
}
