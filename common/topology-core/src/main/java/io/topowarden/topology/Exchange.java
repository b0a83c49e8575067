package io.topowarden.topology;

import java.util.Map;

/**
 * Declared exchange configuration.
 * <p>
 * {@code attributes} carries any broker-reported field that is neither a typed component nor
 * stripped by canonicalization, so nothing the broker declares is silently dropped.
 */
public record Exchange(String name,
                       String vhost,
                       String type,
                       boolean durable,
                       boolean autoDelete,
                       boolean internal,
                       Map<String, Object> arguments,
                       Map<String, Object> attributes) {

  public static final String DEFAULT_TYPE = "direct";

  public Exchange {
    name = StructuralException.requireIdentity(name, "exchange", "name");
    vhost = vhost == null || vhost.isBlank() ? Topology.DEFAULT_VHOST : vhost;
    type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
    arguments = TopologyMaps.immutableCopy(arguments);
    attributes = TopologyMaps.immutableCopy(attributes);
  }

  public Exchange(String name, String vhost, String type, boolean durable, boolean autoDelete) {
    this(name, vhost, type, durable, autoDelete, false, Map.of(), Map.of());
  }

  public boolean isPermanent() {
    return durable && !autoDelete;
  }
}
