package io.topowarden.sync;

import io.topowarden.management.MutationResult;
import java.util.Objects;

/**
 * One resource that could not be replayed.
 *
 * @param kind         why the resource was not created
 * @param resourceType {@code exchange}, {@code queue} or {@code binding}
 * @param resource     resource identity (name, or binding key)
 * @param target       request target the call was sent to, or would have been
 * @param httpStatus   broker response status, {@code 0} when no call was made
 * @param payload      broker error body, or the reason the call was skipped
 */
public record SyncFailure(Kind kind,
                          String resourceType,
                          String resource,
                          String target,
                          int httpStatus,
                          String payload) {

  public enum Kind {
    REJECTED,
    UNSUPPORTED
  }

  public SyncFailure {
    kind = Objects.requireNonNull(kind, "kind");
    resourceType = Objects.requireNonNull(resourceType, "resourceType");
    resource = Objects.requireNonNull(resource, "resource");
    target = target == null ? "" : target;
    payload = payload == null ? "" : payload;
  }

  static SyncFailure rejected(String resourceType, String resource, MutationResult result) {
    return new SyncFailure(Kind.REJECTED, resourceType, resource, result.target(), result.httpStatus(),
        result.payload());
  }

  static SyncFailure unsupported(String resourceType, String resource, String reason) {
    return new SyncFailure(Kind.UNSUPPORTED, resourceType, resource, "", 0, reason);
  }
}
