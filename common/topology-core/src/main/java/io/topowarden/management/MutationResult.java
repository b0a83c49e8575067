package io.topowarden.management;

import java.util.Objects;

/**
 * Outcome of one create call.
 *
 * @param status     what the broker did
 * @param target     request target (method and path) the call was sent to
 * @param httpStatus broker response status
 * @param payload    broker response body, empty when there was none
 */
public record MutationResult(MutationStatus status, String target, int httpStatus, String payload) {

  public MutationResult {
    status = Objects.requireNonNull(status, "status");
    target = Objects.requireNonNull(target, "target");
    payload = payload == null ? "" : payload;
  }

  public static MutationResult created(String target, int httpStatus) {
    return new MutationResult(MutationStatus.CREATED, target, httpStatus, "");
  }

  public static MutationResult alreadyExists(String target, int httpStatus) {
    return new MutationResult(MutationStatus.ALREADY_EXISTS, target, httpStatus, "");
  }

  public static MutationResult failed(String target, int httpStatus, String payload) {
    return new MutationResult(MutationStatus.FAILED, target, httpStatus, payload);
  }

  public boolean isSuccess() {
    return status.isSuccess();
  }
}
