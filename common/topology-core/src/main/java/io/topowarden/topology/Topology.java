package io.topowarden.topology;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declared broker topology: exchanges, queues and bindings.
 * <p>
 * List order is kept for rendering only. Two topologies are equal when each of their three lists,
 * keyed by the vhost-scoped {@link TopologyKeys} (bindings also by routing key), maps to equal
 * records.
 */
public final class Topology {

  public static final String DEFAULT_VHOST = "/";

  private static final Logger log = LoggerFactory.getLogger(Topology.class);
  private static final Topology EMPTY = new Topology(List.of(), List.of(), List.of());

  private final List<Exchange> exchanges;
  private final List<Queue> queues;
  private final List<Binding> bindings;

  public Topology(List<Exchange> exchanges, List<Queue> queues, List<Binding> bindings) {
    this.exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    this.queues = queues == null ? List.of() : List.copyOf(queues);
    this.bindings = bindings == null ? List.of() : List.copyOf(bindings);
    requireUniqueNames("exchange", this.exchanges, Exchange::vhost, Exchange::name);
    requireUniqueNames("queue", this.queues, Queue::vhost, Queue::name);
    logSharedNames();
  }

  public static Topology empty() {
    return EMPTY;
  }

  public List<Exchange> exchanges() {
    return exchanges;
  }

  public List<Queue> queues() {
    return queues;
  }

  public List<Binding> bindings() {
    return bindings;
  }

  public boolean isEmpty() {
    return exchanges.isEmpty() && queues.isEmpty() && bindings.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Topology that)) {
      return false;
    }
    return keyed(exchanges, Topology::exchangeIdentity).equals(keyed(that.exchanges, Topology::exchangeIdentity))
        && keyed(queues, Topology::queueIdentity).equals(keyed(that.queues, Topology::queueIdentity))
        && keyed(bindings, Topology::bindingIdentity).equals(keyed(that.bindings, Topology::bindingIdentity));
  }

  @Override
  public int hashCode() {
    int result = keyed(exchanges, Topology::exchangeIdentity).hashCode();
    result = 31 * result + keyed(queues, Topology::queueIdentity).hashCode();
    return 31 * result + keyed(bindings, Topology::bindingIdentity).hashCode();
  }

  @Override
  public String toString() {
    return "Topology{exchanges=" + exchanges.size()
        + ", queues=" + queues.size()
        + ", bindings=" + bindings.size() + '}';
  }

  private static String exchangeIdentity(Exchange exchange) {
    return TopologyKeys.vhostScoped(exchange.vhost(), TopologyKeys.exchangeKey(exchange));
  }

  private static String queueIdentity(Queue queue) {
    return TopologyKeys.vhostScoped(queue.vhost(), TopologyKeys.queueKey(queue));
  }

  private static String bindingIdentity(Binding binding) {
    return TopologyKeys.vhostScoped(binding.vhost(), TopologyKeys.bindingKey(binding))
        + TopologyKeys.SEPARATOR + binding.routingKey();
  }

  private static <T> Map<String, T> keyed(List<T> records, Function<T, String> keyOf) {
    Map<String, T> byKey = new LinkedHashMap<>();
    for (T record : records) {
      byKey.put(keyOf.apply(record), record);
    }
    return byKey;
  }

  private static <T> void requireUniqueNames(String kind,
                                             List<T> records,
                                             Function<T, String> vhostOf,
                                             Function<T, String> nameOf) {
    Set<String> seen = new HashSet<>();
    for (T record : records) {
      String vhost = vhostOf.apply(record);
      String name = nameOf.apply(record);
      if (!seen.add(TopologyKeys.vhostScoped(vhost, name))) {
        throw new StructuralException(
            "duplicate " + kind + " '" + name + "' in vhost '" + vhost + "'");
      }
    }
  }

  private void logSharedNames() {
    if (!log.isDebugEnabled() || exchanges.isEmpty() || queues.isEmpty()) {
      return;
    }
    Set<String> exchangeNames = new HashSet<>();
    exchanges.forEach(exchange -> exchangeNames.add(exchange.name()));
    for (Queue queue : queues) {
      if (exchangeNames.contains(queue.name())) {
        log.debug("exchange and queue share the name '{}'", queue.name());
      }
    }
  }
}
