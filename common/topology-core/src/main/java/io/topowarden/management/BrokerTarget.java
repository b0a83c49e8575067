package io.topowarden.management;

import java.net.URI;
import java.util.Objects;

/**
 * Resolved management API base URI of one broker plus the credentials to use against it.
 * Passed explicitly to every {@link BrokerManagementPort} call.
 */
public record BrokerTarget(URI managementUri, BrokerCredentials credentials) {

  public BrokerTarget {
    managementUri = Objects.requireNonNull(managementUri, "managementUri");
    credentials = Objects.requireNonNull(credentials, "credentials");
  }

  @Override
  public String toString() {
    return managementUri + " as " + credentials.username();
  }
}
