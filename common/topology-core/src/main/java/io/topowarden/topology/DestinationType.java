package io.topowarden.topology;

import java.util.Locale;

/**
 * Kind of resource a binding routes to.
 */
public enum DestinationType {
  QUEUE("queue"),
  EXCHANGE("exchange");

  private final String wireName;

  DestinationType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static DestinationType fromWireName(String value) {
    if (value == null || value.isBlank()) {
      return QUEUE;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (DestinationType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new StructuralException("binding destination_type must be 'queue' or 'exchange', got '" + value + "'");
  }

  @Override
  public String toString() {
    return wireName;
  }
}
