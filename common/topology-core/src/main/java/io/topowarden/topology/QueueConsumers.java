package io.topowarden.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Consumer counts captured from raw queue records before canonicalization strips them, keyed by
 * {@link TopologyKeys#vhostScoped(String, String)} so same-named queues in different vhosts keep
 * their own count. A queue without an entry has an unknown count.
 */
public final class QueueConsumers {

  private static final QueueConsumers UNKNOWN = new QueueConsumers(Map.of());

  private final Map<String, Integer> counts;

  public QueueConsumers(Map<String, Integer> counts) {
    this.counts = counts == null || counts.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(counts));
  }

  public static QueueConsumers unknown() {
    return UNKNOWN;
  }

  public OptionalInt countFor(String vhost, String queueName) {
    Integer count = counts.get(TopologyKeys.vhostScoped(vhost, queueName));
    return count == null ? OptionalInt.empty() : OptionalInt.of(count);
  }

  public OptionalInt countFor(Queue queue) {
    return countFor(queue.vhost(), queue.name());
  }

  public boolean hasNoConsumers(Queue queue) {
    OptionalInt count = countFor(queue);
    return count.isPresent() && count.getAsInt() == 0;
  }

  public Map<String, Integer> asMap() {
    return counts;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof QueueConsumers that && counts.equals(that.counts);
  }

  @Override
  public int hashCode() {
    return counts.hashCode();
  }

  @Override
  public String toString() {
    return "QueueConsumers" + counts;
  }
}
