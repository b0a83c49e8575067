package io.topowarden.diff;

import static org.assertj.core.api.Assertions.assertThat;

import io.topowarden.topology.Binding;
import io.topowarden.topology.DestinationType;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import io.topowarden.topology.Topology;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TopologyDiffTest {

  private final Exchange orders = new Exchange("orders", "/", "topic", true, false);
  private final Queue created = new Queue("orders.created", "/", true, false, Map.of());
  private final Binding binding = new Binding("orders", "orders.created", DestinationType.QUEUE, "created", "/");

  @Test
  void routingKeyChangeIsReportedAsDifferentBinding() {
    Topology expected = new Topology(List.of(orders), List.of(created), List.of(binding));
    Binding rerouted = new Binding("orders", "orders.created", DestinationType.QUEUE, "order.created", "/");
    Topology actual = new Topology(List.of(orders), List.of(created), List.of(rerouted));

    TopologyDiffReport report = TopologyDiff.diff(expected, actual);

    assertThat(report.bindings().different()).containsExactly("orders|orders.created|queue");
    assertThat(report.bindings().missing()).isEmpty();
    assertThat(report.bindings().extra()).isEmpty();
    assertThat(report.exchanges().isEmpty()).isTrue();
    assertThat(report.isEmpty()).isFalse();
  }

  @Test
  void reportsEachEntityTypeSeparately() {
    Topology expected = new Topology(List.of(orders), List.of(created), List.of(binding));
    Queue jobs = new Queue("jobs", "/", true, false, Map.of());
    Topology actual = new Topology(List.of(), List.of(created, jobs), List.of());

    TopologyDiffReport report = TopologyDiff.diff(expected, actual);

    assertThat(report.exchanges().missing()).containsExactly("orders");
    assertThat(report.queues().extra()).containsExactly("jobs");
    assertThat(report.bindings().missing()).containsExactly("orders|orders.created|queue");
  }

  @Test
  void sameNamesAcrossVhostsDiffEmptyRegardlessOfOrder() {
    Exchange rootA = new Exchange("A", "/", "topic", true, false);
    Exchange otherA = new Exchange("A", "v2", "fanout", true, false);
    Binding first = new Binding("A", "orders.created", DestinationType.QUEUE, "a", "/");
    Binding second = new Binding("A", "orders.created", DestinationType.QUEUE, "b", "/");

    Topology expected = new Topology(List.of(rootA, otherA), List.of(created), List.of(first, second));
    Topology actual = new Topology(List.of(otherA, rootA), List.of(created), List.of(second, first));

    TopologyDiffReport report = TopologyDiff.diff(expected, actual);

    assertThat(report.isEmpty()).isTrue();
    assertThat(expected).isEqualTo(actual);
  }

  @Test
  void equalTopologiesProduceEmptyReport() {
    Topology topology = new Topology(List.of(orders), List.of(created), List.of(binding));

    assertThat(TopologyDiff.diff(topology, topology).isEmpty()).isTrue();
  }
}
