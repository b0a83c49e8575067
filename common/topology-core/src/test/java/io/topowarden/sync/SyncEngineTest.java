package io.topowarden.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.topowarden.management.BrokerCredentials;
import io.topowarden.management.BrokerManagementPort;
import io.topowarden.management.BrokerTarget;
import io.topowarden.management.BrokerTransportException;
import io.topowarden.management.MutationResult;
import io.topowarden.topology.Binding;
import io.topowarden.topology.DestinationType;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import io.topowarden.topology.Topology;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SyncEngineTest {

  private final BrokerTarget target =
      new BrokerTarget(URI.create("http://rabbit-b:15672/api/"), new BrokerCredentials("guest", "guest"));

  private final Exchange orders = new Exchange("orders", "/", "topic", true, false);
  private final Queue created = new Queue("orders.created", "/", true, false, Map.of());
  private final Binding binding = new Binding("orders", "orders.created", DestinationType.QUEUE, "created", "/");

  @Mock
  private BrokerManagementPort management;

  private SyncEngine engine;

  @BeforeEach
  void setUp() {
    engine = new SyncEngine(management);
  }

  @Test
  void rejectedQueueIsRecordedAndBindingIsStillAttempted() {
    when(management.createExchange(target, orders))
        .thenReturn(MutationResult.alreadyExists("PUT /api/exchanges/%2F/orders", 204));
    when(management.createQueue(target, created))
        .thenReturn(MutationResult.failed("PUT /api/queues/%2F/orders.created", 400,
            "{\"error\":\"bad_request\",\"reason\":\"inequivalent arg 'durable'\"}"));
    when(management.createBinding(target, binding))
        .thenReturn(MutationResult.created("POST /api/bindings/%2F/e/orders/q/orders.created", 201));

    SyncResult result = engine.sync(new Topology(List.of(orders), List.of(created), List.of(binding)), target);

    assertThat(result.failures()).hasSize(1);
    SyncFailure failure = result.failures().get(0);
    assertThat(failure.kind()).isEqualTo(SyncFailure.Kind.REJECTED);
    assertThat(failure.resourceType()).isEqualTo("queue");
    assertThat(failure.resource()).isEqualTo("orders.created");
    assertThat(failure.target()).isEqualTo("PUT /api/queues/%2F/orders.created");
    assertThat(failure.httpStatus()).isEqualTo(400);
    assertThat(failure.payload()).contains("inequivalent arg");
    assertThat(result.attempted()).isEqualTo(3);
    assertThat(result.succeeded()).isEqualTo(2);
    assertThat(result.isFullySynced()).isFalse();
    verify(management).createBinding(target, binding);
  }

  @Test
  void createsExchangesThenQueuesThenBindings() {
    Exchange dlx = new Exchange("orders.dlx", "/", "fanout", true, false);
    Queue dead = new Queue("orders.dead", "/", true, false, Map.of());
    Binding deadBinding = new Binding("orders.dlx", "orders.dead", DestinationType.QUEUE, "", "/");
    when(management.createExchange(eq(target), any())).thenReturn(MutationResult.created("PUT exchange", 201));
    when(management.createQueue(eq(target), any())).thenReturn(MutationResult.created("PUT queue", 201));
    when(management.createBinding(eq(target), any())).thenReturn(MutationResult.created("POST binding", 201));

    // bindings listed first on purpose
    Topology topology = new Topology(List.of(orders, dlx), List.of(created, dead), List.of(deadBinding, binding));
    SyncResult result = engine.sync(topology, target);

    InOrder order = inOrder(management);
    order.verify(management).createExchange(target, orders);
    order.verify(management).createExchange(target, dlx);
    order.verify(management).createQueue(target, created);
    order.verify(management).createQueue(target, dead);
    order.verify(management).createBinding(target, deadBinding);
    order.verify(management).createBinding(target, binding);
    assertThat(result.isFullySynced()).isTrue();
    assertThat(result.attempted()).isEqualTo(6);
  }

  @Test
  void failuresKeepReplayOrder() {
    Exchange audit = new Exchange("audit", "/", "fanout", true, false);
    when(management.createExchange(target, orders)).thenReturn(MutationResult.failed("PUT orders", 403, "denied"));
    when(management.createExchange(target, audit)).thenReturn(MutationResult.failed("PUT audit", 403, "denied"));
    when(management.createQueue(target, created)).thenReturn(MutationResult.failed("PUT queue", 403, "denied"));

    SyncResult result = engine.sync(new Topology(List.of(orders, audit), List.of(created), List.of()), target);

    assertThat(result.failures()).extracting(SyncFailure::resource)
        .containsExactly("orders", "audit", "orders.created");
    assertThat(result.succeeded()).isZero();
  }

  @Test
  void exchangeToExchangeBindingIsReportedNotSent() {
    Exchange audit = new Exchange("audit", "/", "fanout", true, false);
    Binding toAudit = new Binding("orders", "audit", DestinationType.EXCHANGE, "#", "/");
    when(management.createExchange(eq(target), any())).thenReturn(MutationResult.created("PUT exchange", 201));

    SyncResult result = engine.sync(new Topology(List.of(orders, audit), List.of(), List.of(toAudit)), target);

    verify(management, never()).createBinding(any(), any());
    assertThat(result.failures()).singleElement().satisfies(failure -> {
      assertThat(failure.kind()).isEqualTo(SyncFailure.Kind.UNSUPPORTED);
      assertThat(failure.resource()).isEqualTo("orders|audit|exchange");
      assertThat(failure.httpStatus()).isZero();
      assertThat(failure.payload()).contains("exchange-to-exchange");
    });
    assertThat(result.attempted()).isEqualTo(2);
  }

  @Test
  void transportErrorAbortsTheRun() {
    when(management.createExchange(target, orders)).thenThrow(new BrokerTransportException("connection refused"));

    Topology topology = new Topology(List.of(orders), List.of(created), List.of(binding));

    assertThatThrownBy(() -> engine.sync(topology, target))
        .isInstanceOf(BrokerTransportException.class)
        .hasMessageContaining("connection refused");
    verify(management, never()).createQueue(any(), any());
  }

  @Test
  void emptyTopologyMakesNoCalls() {
    SyncResult result = engine.sync(Topology.empty(), target);

    assertThat(result.isFullySynced()).isTrue();
    assertThat(result.attempted()).isZero();
    verify(management, never()).createExchange(any(), any());
  }
}
