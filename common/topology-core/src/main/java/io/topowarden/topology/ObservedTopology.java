package io.topowarden.topology;

import java.util.Objects;

/**
 * A topology together with the runtime consumer counts observed while it was loaded.
 */
public record ObservedTopology(Topology topology, QueueConsumers consumers) {

  public ObservedTopology {
    topology = Objects.requireNonNull(topology, "topology");
    consumers = consumers == null ? QueueConsumers.unknown() : consumers;
  }

  public static ObservedTopology withoutRuntimeData(Topology topology) {
    return new ObservedTopology(topology, QueueConsumers.unknown());
  }
}
