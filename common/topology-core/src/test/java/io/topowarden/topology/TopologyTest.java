package io.topowarden.topology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TopologyTest {

  private final Exchange orders = new Exchange("orders", "/", "topic", true, false);
  private final Exchange billing = new Exchange("billing", "/", "direct", true, false);
  private final Queue created = new Queue("orders.created", "/", true, false, Map.of());

  @Test
  void equalityIgnoresListOrder() {
    Topology first = new Topology(List.of(orders, billing), List.of(created), List.of());
    Topology second = new Topology(List.of(billing, orders), List.of(created), List.of());

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
  }

  @Test
  void equalityIgnoresArgumentOrder() {
    Map<String, Object> forward = new LinkedHashMap<>();
    forward.put(Queue.MESSAGE_TTL, 1000);
    forward.put(Queue.DEAD_LETTER_EXCHANGE, "dlx");
    Map<String, Object> reverse = new LinkedHashMap<>();
    reverse.put(Queue.DEAD_LETTER_EXCHANGE, "dlx");
    reverse.put(Queue.MESSAGE_TTL, 1000);

    Topology first = new Topology(List.of(), List.of(new Queue("jobs", "/", true, false, forward)), List.of());
    Topology second = new Topology(List.of(), List.of(new Queue("jobs", "/", true, false, reverse)), List.of());

    assertThat(first).isEqualTo(second);
  }

  @Test
  void equalityAcrossVhostsIgnoresListOrder() {
    Exchange rootA = new Exchange("A", "/", "topic", true, false);
    Exchange stagingA = new Exchange("A", "v2", "fanout", true, false);
    Binding rootBinding = new Binding("A", "orders.created", DestinationType.QUEUE, "a", "/");
    Binding stagingBinding = new Binding("A", "orders.created", DestinationType.QUEUE, "b", "v2");

    Topology first = new Topology(List.of(rootA, stagingA), List.of(created), List.of(rootBinding, stagingBinding));
    Topology second = new Topology(List.of(stagingA, rootA), List.of(created), List.of(stagingBinding, rootBinding));

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(first).isNotEqualTo(new Topology(List.of(rootA), List.of(created), List.of(rootBinding, stagingBinding)));
  }

  @Test
  void consumerCountsAreScopedByVhost() {
    QueueConsumers consumers = new QueueConsumers(Map.of(
        TopologyKeys.vhostScoped("/", "jobs"), 0,
        TopologyKeys.vhostScoped("billing", "jobs"), 3));

    assertThat(consumers.countFor("/", "jobs")).hasValue(0);
    assertThat(consumers.countFor("billing", "jobs")).hasValue(3);
    assertThat(consumers.countFor(null, "jobs")).hasValue(0);
    assertThat(consumers.countFor("other", "jobs")).isEmpty();
  }

  @Test
  void changedRecordBreaksEquality() {
    Topology first = new Topology(List.of(orders), List.of(), List.of());
    Topology second = new Topology(List.of(new Exchange("orders", "/", "fanout", true, false)), List.of(), List.of());

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void rejectsDuplicateExchangeInSameVhost() {
    assertThatThrownBy(() -> new Topology(List.of(orders, orders), List.of(), List.of()))
        .isInstanceOf(StructuralException.class)
        .hasMessageContaining("duplicate exchange 'orders'");
  }

  @Test
  void allowsSameNameAcrossNamespacesAndVhosts() {
    Exchange sharedName = new Exchange("orders.created", "/", "fanout", true, false);
    Exchange otherVhost = new Exchange("orders", "staging", "topic", true, false);

    Topology topology = new Topology(List.of(orders, otherVhost, sharedName), List.of(created), List.of());

    assertThat(topology.exchanges()).hasSize(3);
    assertThat(topology.queues()).hasSize(1);
  }

  @Test
  void listsAreImmutable() {
    Topology topology = new Topology(List.of(orders), List.of(created), List.of());

    assertThatThrownBy(() -> topology.exchanges().add(billing))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void bindingKeyExcludesRoutingKey() {
    Binding created = new Binding("orders", "orders.created", DestinationType.QUEUE, "created", "/");
    Binding renamed = new Binding("orders", "orders.created", DestinationType.QUEUE, "order.created", "/");

    assertThat(TopologyKeys.bindingKey(created))
        .isEqualTo(TopologyKeys.bindingKey(renamed))
        .isEqualTo("orders|orders.created|queue");
  }

  @Test
  void deadLetterExchangeIgnoresDefaultExchange() {
    Queue toDefault = new Queue("jobs", "/", true, false, Map.of(Queue.DEAD_LETTER_EXCHANGE, ""));
    Queue toDlx = new Queue("jobs", "/", true, false, Map.of(Queue.DEAD_LETTER_EXCHANGE, "jobs.dlx"));

    assertThat(toDefault.deadLetterExchange()).isEmpty();
    assertThat(toDlx.deadLetterExchange()).contains("jobs.dlx");
  }

  @Test
  void unknownConsumerCountIsNeverZero() {
    QueueConsumers consumers = new QueueConsumers(Map.of(
        TopologyKeys.vhostScoped("/", "jobs"), 0,
        TopologyKeys.vhostScoped("/", "orders.created"), 2));

    assertThat(consumers.hasNoConsumers(new Queue("jobs", "/", true, false, Map.of()))).isTrue();
    assertThat(consumers.hasNoConsumers(created)).isFalse();
    assertThat(consumers.hasNoConsumers(new Queue("unknown", "/", true, false, Map.of()))).isFalse();
    assertThat(QueueConsumers.unknown().countFor("/", "jobs")).isEmpty();
  }
}
