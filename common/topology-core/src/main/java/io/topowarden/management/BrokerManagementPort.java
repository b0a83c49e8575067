package io.topowarden.management;

import io.topowarden.canonical.RawTopology;
import io.topowarden.topology.Binding;
import io.topowarden.topology.Exchange;
import io.topowarden.topology.Queue;

/**
 * Port to a broker's management API, used for live topology loading and for replay.
 * <p>
 * Implementations hold no session state: everything a call needs, credentials included, arrives
 * through the {@link BrokerTarget} argument.
 */
public interface BrokerManagementPort {

  /**
   * Read every exchange, queue and binding the broker reports, uncleaned.
   *
   * @throws BrokerTransportException when the broker is unreachable or answers with anything
   *                                  other than JSON arrays
   */
  RawTopology fetchTopology(BrokerTarget target);

  /**
   * Declare an exchange. Declaring an exchange that already exists with the same settings is a
   * successful no-op.
   *
   * @return the outcome (never null); broker rejections are reported, not thrown
   * @throws BrokerTransportException when the call could not be completed at all
   */
  MutationResult createExchange(BrokerTarget target, Exchange exchange);

  /**
   * Declare a queue.
   *
   * @see #createExchange(BrokerTarget, Exchange)
   */
  MutationResult createQueue(BrokerTarget target, Queue queue);

  /**
   * Declare a binding from an exchange to a queue.
   *
   * @see #createExchange(BrokerTarget, Exchange)
   */
  MutationResult createBinding(BrokerTarget target, Binding binding);
}
