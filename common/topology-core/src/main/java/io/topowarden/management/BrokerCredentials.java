package io.topowarden.management;

import java.util.Objects;

/**
 * Basic-auth credentials for a broker's management API.
 */
public record BrokerCredentials(String username, String password) {

  public BrokerCredentials {
    username = Objects.requireNonNull(username, "username");
    password = Objects.requireNonNull(password, "password");
  }

  @Override
  public String toString() {
    return "BrokerCredentials{username='" + username + "', password=***}";
  }
}
