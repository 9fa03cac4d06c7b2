package org.example.sla.config;

import java.time.Duration;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.example.sla.SLATier;

/**
 * SLA targets for a single tier. Immutable; every value is range-checked on construction so a
 * tracker can never run against a target it cannot compute a budget for.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SLAConfiguration {

  private final SLATier tier;

  /** Fraction of requests that must succeed, e.g. 0.995. */
  private final double availabilityTarget;

  /** Mean response time target in seconds. Also the upper latency bound of the tier. */
  private final double responseTimeTarget;

  private final Duration errorBudgetPeriod;

  /** Remaining budget below which the tier is reported as warning. */
  private final double alertThreshold;

  /** Remaining budget below which the tier is reported as critical. */
  private final double criticalThreshold;

  @Builder(toBuilder = true)
  public SLAConfiguration(
      @NonNull SLATier tier,
      double availabilityTarget,
      double responseTimeTarget,
      @NonNull Duration errorBudgetPeriod,
      double alertThreshold,
      double criticalThreshold) {
    if (!(availabilityTarget > 0.0 && availabilityTarget <= 1.0)) {
      throw new SLAConfigurationException(
          tier.label() + ": availabilityTarget must be in (0,1], got " + availabilityTarget);
    }
    if (!(responseTimeTarget >= 0.0) || Double.isInfinite(responseTimeTarget)) {
      throw new SLAConfigurationException(
          tier.label() + ": responseTimeTarget must be a finite value >= 0, got "
              + responseTimeTarget);
    }
    if (errorBudgetPeriod.isNegative() || errorBudgetPeriod.isZero()) {
      throw new SLAConfigurationException(
          tier.label() + ": errorBudgetPeriod must be positive, got " + errorBudgetPeriod);
    }
    checkUnitInterval(tier, "alertThreshold", alertThreshold);
    checkUnitInterval(tier, "criticalThreshold", criticalThreshold);
    if (criticalThreshold >= alertThreshold) {
      throw new SLAConfigurationException(
          tier.label() + ": criticalThreshold (" + criticalThreshold
              + ") must be below alertThreshold (" + alertThreshold + ")");
    }
    this.tier = tier;
    this.availabilityTarget = availabilityTarget;
    this.responseTimeTarget = responseTimeTarget;
    this.errorBudgetPeriod = errorBudgetPeriod;
    this.alertThreshold = alertThreshold;
    this.criticalThreshold = criticalThreshold;
  }

  /** Error rate the target tolerates, {@code 1 - availabilityTarget}. */
  public double allowableErrorRate() {
    return 1.0 - availabilityTarget;
  }

  private static void checkUnitInterval(SLATier tier, String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new SLAConfigurationException(
          tier.label() + ": " + name + " must be in [0,1], got " + value);
    }
  }
}
