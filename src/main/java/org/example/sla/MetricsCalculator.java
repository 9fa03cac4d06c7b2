package org.example.sla;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.example.sla.config.SLAConfiguration;
import org.example.sla.config.TrackerSettings;
import org.example.sla.metrics.TierMetrics;
import org.example.sla.metrics.TierMetrics.DerivedMetrics;
import org.example.sla.metrics.TierMetrics.RawCounts;
import org.example.sla.sink.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes availability, mean response time, remaining error budget and burn rate for every
 * tier, then hands the result to the {@link MetricsSink}.
 *
 * <p>Counters are copied under each tier's lock and the arithmetic runs after the lock is released,
 * so recording is only blocked for the copy. A pass includes whatever was recorded before its copy;
 * requests recorded concurrently show up in the next pass. Passes are serialised, so a scheduled pass
 * and a manual one never interleave their copy and write-back.
 */
public class MetricsCalculator {

  private static final Logger log = LoggerFactory.getLogger(MetricsCalculator.class);

  private final TrackerSettings settings;
  private final Map<SLATier, TierMetrics> metrics;
  private final MetricsSink sink;
  private final Object passLock = new Object();

  public MetricsCalculator(
      TrackerSettings settings, Map<SLATier, TierMetrics> metrics, MetricsSink sink) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /** Runs one pass over all tiers and returns what was computed. */
  public Map<SLATier, DerivedMetrics> recompute() {
    synchronized (passLock) {
      return recomputeAll();
    }
  }

  private Map<SLATier, DerivedMetrics> recomputeAll() {
    Map<SLATier, DerivedMetrics> results = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      TierMetrics tierMetrics = metrics.get(tier);
      SLAConfiguration config = settings.forTier(tier);

      DerivedMetrics derived = compute(tierMetrics.capture(), config);
      tierMetrics.applyDerived(derived);
      results.put(tier, derived);

      publish(tier, derived);

      log.debug(
          "Updated SLA metrics: tier={}, availability={}, response_time={}, error_budget={}, burn_rate={}",
          tier.label(),
          derived.availability(),
          derived.responseTime(),
          derived.errorBudgetRemaining(),
          derived.burnRate());
    }
    return results;
  }

  static DerivedMetrics compute(RawCounts counts, SLAConfiguration config) {
    double availability =
        SLAMath.availability(
            counts.successfulRequests(), counts.totalRequests(), counts.previousAvailability());
    return new DerivedMetrics(
        availability,
        SLAMath.meanResponseTime(counts.responseTimes()),
        SLAMath.errorBudgetRemaining(config.getAvailabilityTarget(), availability),
        SLAMath.burnRate(
            counts.failedRequests(), counts.totalRequests(), config.getAvailabilityTarget()));
  }

  private void publish(SLATier tier, DerivedMetrics derived) {
    try {
      sink.updateSLAMetrics(
          settings.getServiceName(),
          tier.label(),
          derived.availability(),
          derived.errorBudgetRemaining(),
          derived.burnRate());
    } catch (RuntimeException e) {
      log.warn("Metrics sink failed to accept {} SLA metrics", tier.label(), e);
    }
  }
}
