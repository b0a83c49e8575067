package io.topowarden.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.ObservedTopology;
import io.topowarden.topology.Queue;
import io.topowarden.topology.QueueConsumers;
import io.topowarden.topology.Topology;
import io.topowarden.topology.TopologyKeys;
import io.topowarden.topology.TopologyRecords;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a live broker's raw records into a typed {@link Topology} of permanent, user-managed
 * resources.
 * <p>
 * Queue consumer counts are read from the raw records before cleaning removes them and are
 * returned alongside the topology in {@link ObservedTopology}.
 */
public final class Canonicalizer {

  private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

  public ObservedTopology canonicalize(RawTopology raw) {
    List<Exchange> exchanges = new ArrayList<>();
    for (JsonNode record : raw.exchanges()) {
      if (ResourceFilters.isUserManagedExchange(record) && ResourceFilters.isPermanent(record)) {
        exchanges.add(TopologyRecords.exchange(RecordCleaner.cleanExchange(record)));
      }
    }

    List<Queue> queues = new ArrayList<>();
    Map<String, Integer> consumers = new LinkedHashMap<>();
    for (JsonNode record : raw.queues()) {
      TopologyRecords.requireText(record, "queue", "name");
      if (!ResourceFilters.isPermanent(record)) {
        continue;
      }
      OptionalInt count = consumerCount(record.get("consumers"));
      Queue queue = TopologyRecords.queue(RecordCleaner.cleanQueue(record));
      count.ifPresent(value -> consumers.put(TopologyKeys.vhostScoped(queue.vhost(), queue.name()), value));
      queues.add(queue);
    }

    List<Binding> bindings = new ArrayList<>();
    for (JsonNode record : raw.bindings()) {
      if (ResourceFilters.hasNamedSource(record)) {
        bindings.add(TopologyRecords.binding(RecordCleaner.cleanBinding(record)));
      }
    }

    log.debug("kept {}/{} exchanges, {}/{} queues, {}/{} bindings",
        exchanges.size(), raw.exchanges().size(),
        queues.size(), raw.queues().size(),
        bindings.size(), raw.bindings().size());
    return new ObservedTopology(new Topology(exchanges, queues, bindings), new QueueConsumers(consumers));
  }

  static OptionalInt consumerCount(JsonNode value) {
    if (value == null || value.isNull()) {
      return OptionalInt.empty();
    }
    if (value.isNumber()) {
      return OptionalInt.of(value.intValue());
    }
    if (value.isTextual()) {
      try {
        return OptionalInt.of(Integer.parseInt(value.asText().trim()));
      } catch (NumberFormatException ignored) {
        return OptionalInt.empty();
      }
    }
    return OptionalInt.empty();
  }
}
