package org.example.sla;

/**
 * Ratio arithmetic behind the recompute. Every division is guarded, so no result is ever NaN or
 * infinite, and the two fractions always stay within [0,1].
 */
public final class SLAMath {

  private SLAMath() {}

  /** Successful over total requests, or {@code previous} when nothing has been recorded. */
  public static double availability(long successful, long total, double previous) {
    if (total <= 0) {
      return previous;
    }
    return clampUnit((double) successful / (double) total);
  }

  /**
   * Arithmetic mean of the samples, 0 for an empty window. Kept as a running mean so that very large
   * finite samples cannot overflow a sum.
   */
  public static double meanResponseTime(double[] samples) {
    double mean = 0.0;
    for (int i = 0; i < samples.length; i++) {
      mean += (samples[i] - mean) / (i + 1);
    }
    return mean;
  }

  /**
   * Share of the error budget still unspent: 1 when observed unavailability is within the target's
   * allowance, 0 once the gap to the target reaches the whole allowance. A target of 1.0 has no
   * allowance and always reports 1.
   */
  public static double errorBudgetRemaining(double availabilityTarget, double currentAvailability) {
    double gap = availabilityTarget - currentAvailability;
    double maxGap = 1.0 - availabilityTarget;
    if (maxGap > 0.0) {
      return clampUnit(1.0 - gap / maxGap);
    }
    return 1.0;
  }

  /**
   * Observed error rate over the rate the target allows. 1.0 spends the budget exactly over its
   * period; above 1.0 the budget runs out early. Not normalised by elapsed time within the period.
   */
  public static double burnRate(long failed, long total, double availabilityTarget) {
    double errorRate = total > 0 ? (double) failed / (double) total : 0.0;
    double allowableErrorRate = 1.0 - availabilityTarget;
    if (allowableErrorRate > 0.0) {
      return errorRate / allowableErrorRate;
    }
    return 0.0;
  }

  static double clampUnit(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
