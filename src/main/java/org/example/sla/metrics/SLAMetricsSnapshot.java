package org.example.sla.metrics;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.example.sla.SLATier;

/** Point-in-time copy of one tier's metrics. Shares no state with the tracker. */
@Value
@Builder
public class SLAMetricsSnapshot {
  @NonNull SLATier tier;

  double currentAvailability;
  double currentResponseTime;
  double errorBudgetRemaining;
  double errorBudgetBurnRate;

  @NonNull Instant lastUpdate;

  long totalRequests;
  long successfulRequests;
  long failedRequests;

  /** Most recent response times in seconds, oldest first. */
  @NonNull List<Double> responseTimes;
}
