package io.topowarden.sync;

import io.topowarden.management.BrokerManagementPort;
import io.topowarden.management.BrokerTarget;
import io.topowarden.management.MutationResult;
import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;
import io.topowarden.topology.Topology;
import io.topowarden.topology.TopologyKeys;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a topology onto a broker with idempotent create calls.
 * <p>
 * Calls go out one at a time: every exchange, then every queue, then every binding, since
 * bindings need both ends to exist. A rejected call is recorded and the run carries on; a
 * {@link io.topowarden.management.BrokerTransportException} ends the run.
 */
public final class SyncEngine {

  static final String EXCHANGE_TO_EXCHANGE_UNSUPPORTED = "exchange-to-exchange bindings are not supported";

  private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

  private final BrokerManagementPort management;

  public SyncEngine(BrokerManagementPort management) {
    this.management = Objects.requireNonNull(management, "management");
  }

  public SyncResult sync(Topology source, BrokerTarget target) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    log.info("replaying {} onto {}", source, target);

    Run run = new Run();
    for (Exchange exchange : source.exchanges()) {
      run.call("exchange", TopologyKeys.exchangeKey(exchange), () -> management.createExchange(target, exchange));
    }
    for (Queue queue : source.queues()) {
      run.call("queue", TopologyKeys.queueKey(queue), () -> management.createQueue(target, queue));
    }
    for (Binding binding : source.bindings()) {
      String key = TopologyKeys.bindingKey(binding);
      if (binding.targetsExchange()) {
        log.warn("skipping binding {}: {}", key, EXCHANGE_TO_EXCHANGE_UNSUPPORTED);
        run.failures.add(SyncFailure.unsupported("binding", key, EXCHANGE_TO_EXCHANGE_UNSUPPORTED));
        continue;
      }
      run.call("binding", key, () -> management.createBinding(target, binding));
    }

    SyncResult result = new SyncResult(run.failures, run.attempted, run.succeeded);
    log.info("replay onto {} finished: {} of {} calls succeeded, {} failures",
        target, result.succeeded(), result.attempted(), result.failures().size());
    return result;
  }

  private static final class Run {
    private final List<SyncFailure> failures = new ArrayList<>();
    private int attempted;
    private int succeeded;

    void call(String resourceType, String resource, Supplier<MutationResult> create) {
      attempted++;
      MutationResult result = Objects.requireNonNull(create.get(), "mutation result");
      if (result.isSuccess()) {
        succeeded++;
        log.debug("{} {}: {}", resourceType, resource, result.status());
        return;
      }
      log.warn("{} {} rejected with status {}: {}", resourceType, resource, result.httpStatus(), result.payload());
      failures.add(SyncFailure.rejected(resourceType, resource, result));
    }
  }
}
