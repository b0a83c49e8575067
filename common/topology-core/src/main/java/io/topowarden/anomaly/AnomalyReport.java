package io.topowarden.anomaly;

import java.util.List;

/**
 * Names flagged by each {@link AnomalyDetector} rule. Advisory only.
 */
public record AnomalyReport(List<String> unboundQueues,
                            List<String> unboundExchanges,
                            List<String> noConsumersNoTtl,
                            List<String> noConsumersNoDlx) {

  public AnomalyReport {
    unboundQueues = unboundQueues == null ? List.of() : List.copyOf(unboundQueues);
    unboundExchanges = unboundExchanges == null ? List.of() : List.copyOf(unboundExchanges);
    noConsumersNoTtl = noConsumersNoTtl == null ? List.of() : List.copyOf(noConsumersNoTtl);
    noConsumersNoDlx = noConsumersNoDlx == null ? List.of() : List.copyOf(noConsumersNoDlx);
  }

  public boolean isClean() {
    return unboundQueues.isEmpty()
        && unboundExchanges.isEmpty()
        && noConsumersNoTtl.isEmpty()
        && noConsumersNoDlx.isEmpty();
  }
}
