package org.example.sla.status;

import org.example.sla.config.SLAConfiguration;

/** Grades a measured indicator against its target. Stateless; callers classify on every read. */
public final class StatusClassifier {

  static final double AVAILABILITY_WARNING_FACTOR = 0.95;
  static final double RESPONSE_TIME_WARNING_FACTOR = 1.5;

  private StatusClassifier() {}

  /** Healthy at or above target, warning within 95% of it, critical below. */
  public static HealthStatus availabilityStatus(double current, double target) {
    if (current >= target) {
      return HealthStatus.HEALTHY;
    } else if (current >= target * AVAILABILITY_WARNING_FACTOR) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.CRITICAL;
  }

  /** Healthy at or below target, warning up to 150% of it, critical above. */
  public static HealthStatus responseTimeStatus(double current, double target) {
    if (current <= target) {
      return HealthStatus.HEALTHY;
    } else if (current <= target * RESPONSE_TIME_WARNING_FACTOR) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.CRITICAL;
  }

  public static HealthStatus errorBudgetStatus(double remaining, SLAConfiguration config) {
    if (remaining >= config.getAlertThreshold()) {
      return HealthStatus.HEALTHY;
    } else if (remaining >= config.getCriticalThreshold()) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.CRITICAL;
  }

  public static boolean isErrorBudgetCritical(double remaining, SLAConfiguration config) {
    return remaining < config.getCriticalThreshold();
  }
}
