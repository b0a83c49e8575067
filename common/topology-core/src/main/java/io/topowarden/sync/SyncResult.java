package io.topowarden.sync;

import java.util.List;

/**
 * Outcome of a replay. Failures are in the order the resources were replayed.
 */
public record SyncResult(List<SyncFailure> failures, int attempted, int succeeded) {

  public SyncResult {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public boolean isFullySynced() {
    return failures.isEmpty();
  }
}
