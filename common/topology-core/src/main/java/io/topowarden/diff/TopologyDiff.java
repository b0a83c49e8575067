package io.topowarden.diff;

import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import io.topowarden.topology.Topology;
import io.topowarden.topology.TopologyKeys;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@link DiffEngine} to each entity list of two topologies.
 * <p>
 * Keys are vhost-free, so same-named records from different vhosts collide. Both sides are
 * stably ordered by vhost (bindings then by routing key) before indexing, which makes the record
 * that wins such a collision independent of list order.
 */
public final class TopologyDiff {

  private static final Comparator<Exchange> EXCHANGE_ORDER = Comparator.comparing(Exchange::vhost);
  private static final Comparator<Queue> QUEUE_ORDER = Comparator.comparing(Queue::vhost);
  private static final Comparator<Binding> BINDING_ORDER =
      Comparator.comparing(Binding::vhost).thenComparing(Binding::routingKey);

  private TopologyDiff() {
  }

  public static TopologyDiffReport diff(Topology expected, Topology actual) {
    return new TopologyDiffReport(
        DiffEngine.diff(ordered(expected.exchanges(), EXCHANGE_ORDER), ordered(actual.exchanges(), EXCHANGE_ORDER),
            TopologyKeys::exchangeKey),
        DiffEngine.diff(ordered(expected.queues(), QUEUE_ORDER), ordered(actual.queues(), QUEUE_ORDER),
            TopologyKeys::queueKey),
        DiffEngine.diff(ordered(expected.bindings(), BINDING_ORDER), ordered(actual.bindings(), BINDING_ORDER),
            TopologyKeys::bindingKey));
  }

  private static <T> List<T> ordered(List<T> records, Comparator<? super T> order) {
    return records.stream().sorted(order).collect(Collectors.toList());
  }
}
