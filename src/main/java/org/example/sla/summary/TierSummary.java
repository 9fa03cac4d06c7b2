package org.example.sla.summary;

import lombok.Builder;
import lombok.Value;
import org.example.sla.status.HealthStatus;

/** Per-tier block of {@link SLASummary}: each indicator with its target and graded status. */
@Value
@Builder
public class TierSummary {
  Indicator availability;
  Indicator responseTime;
  ErrorBudget errorBudget;
  Requests requests;

  @Value
  @Builder
  public static class Indicator {
    double current;
    double target;
    HealthStatus status;
  }

  @Value
  @Builder
  public static class ErrorBudget {
    double remaining;
    double burnRate;
    HealthStatus status;
  }

  @Value
  @Builder
  public static class Requests {
    long total;
    long successful;
    long failed;
  }
}
