package io.topowarden.diff;

import java.util.Objects;

/**
 * Per-entity diff of two topologies. Keys are exchange and queue names and binding keys as built
 * by {@link io.topowarden.topology.TopologyKeys}.
 */
public record TopologyDiffReport(DiffResult<String> exchanges,
                                 DiffResult<String> queues,
                                 DiffResult<String> bindings) {

  public TopologyDiffReport {
    exchanges = Objects.requireNonNull(exchanges, "exchanges");
    queues = Objects.requireNonNull(queues, "queues");
    bindings = Objects.requireNonNull(bindings, "bindings");
  }

  public boolean isEmpty() {
    return exchanges.isEmpty() && queues.isEmpty() && bindings.isEmpty();
  }
}
