package io.topowarden.management;

/**
 * The broker could not be reached, or answered a query with an unexpected status or body.
 * Never retried; fatal for the command that triggered it.
 */
public class BrokerTransportException extends RuntimeException {

  public BrokerTransportException(String message) {
    super(message);
  }

  public BrokerTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
