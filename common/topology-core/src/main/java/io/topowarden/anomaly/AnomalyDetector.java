package io.topowarden.anomaly;

import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.ObservedTopology;
import io.topowarden.topology.Queue;
import io.topowarden.topology.QueueConsumers;
import io.topowarden.topology.Topology;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rules that flag unbound or misconfigured resources in a canonical topology.
 * <p>
 * Every rule is a pure function returning offending names in encounter order; none of them fail.
 * The consumer rules only flag queues whose captured consumer count is exactly zero, a queue with
 * an unknown count (for example one loaded from a snapshot) is never reported.
 */
public final class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  private AnomalyDetector() {
  }

  public static AnomalyReport check(ObservedTopology observed) {
    Topology topology = observed.topology();
    QueueConsumers consumers = observed.consumers();
    AnomalyReport report = new AnomalyReport(
        unboundQueues(topology.bindings(), topology.queues()),
        unboundExchanges(topology.bindings(), topology.exchanges(), topology.queues()),
        noConsumersNoTtl(topology.queues(), consumers),
        noConsumersNoDlx(topology.queues(), consumers));
    log.debug("anomaly check over {} found {}", topology, report);
    return report;
  }

  /**
   * Queues that are not the destination of any queue binding.
   */
  public static List<String> unboundQueues(List<Binding> bindings, List<Queue> queues) {
    Set<String> bound = new HashSet<>();
    for (Binding binding : bindings) {
      if (binding.targetsQueue()) {
        bound.add(binding.destination());
      }
    }
    return names(queues, Queue::name, queue -> !bound.contains(queue.name()));
  }

  /**
   * Exchanges that no binding starts from or routes to, and that no queue dead-letters into.
   */
  public static List<String> unboundExchanges(List<Binding> bindings, List<Exchange> exchanges, List<Queue> queues) {
    Set<String> referenced = new HashSet<>();
    for (Binding binding : bindings) {
      referenced.add(binding.source());
      if (binding.targetsExchange()) {
        referenced.add(binding.destination());
      }
    }
    for (Queue queue : queues) {
      queue.deadLetterExchange().ifPresent(referenced::add);
    }
    return names(exchanges, Exchange::name, exchange -> !referenced.contains(exchange.name()));
  }

  /**
   * Queues nobody consumes from whose messages never expire.
   */
  public static List<String> noConsumersNoTtl(List<Queue> queues, QueueConsumers consumers) {
    return names(queues, Queue::name,
        queue -> consumers.hasNoConsumers(queue) && !queue.hasArgument(Queue.MESSAGE_TTL));
  }

  /**
   * Queues nobody consumes from that have nowhere to dead-letter to.
   */
  public static List<String> noConsumersNoDlx(List<Queue> queues, QueueConsumers consumers) {
    return names(queues, Queue::name,
        queue -> consumers.hasNoConsumers(queue) && !queue.hasArgument(Queue.DEAD_LETTER_EXCHANGE));
  }

  private static <T> List<String> names(List<T> resources,
                                        Function<T, String> nameOf,
                                        Predicate<T> offending) {
    Set<String> flagged = new LinkedHashSet<>();
    for (T resource : resources) {
      if (offending.test(resource)) {
        flagged.add(nameOf.apply(resource));
      }
    }
    return new ArrayList<>(flagged);
  }
}
