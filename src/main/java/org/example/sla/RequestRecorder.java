package org.example.sla;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.example.sla.metrics.TierMetrics;
import org.example.sla.sink.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingests completed requests. Safe for any number of concurrent callers; each call holds only the
 * lock of the tier the request lands in, for a constant amount of work.
 *
 * <p>Latency values that cannot be used as-is are never rejected:
 *
 * <ul>
 *   <li>negative latency is clamped to 0 and recorded as gold;
 *   <li>NaN or infinite latency is counted in bronze without a response time sample, so the mean
 *       stays finite.
 * </ul>
 *
 * Both cases are logged and counted in {@link #malformedSampleCount()}.
 */
public class RequestRecorder {

  private static final Logger log = LoggerFactory.getLogger(RequestRecorder.class);
  static final String UNKNOWN_ENDPOINT = "unknown";

  private final String serviceName;
  private final TierClassifier classifier;
  private final Map<SLATier, TierMetrics> metrics;
  private final MetricsSink sink;
  private final Clock clock;
  private final AtomicLong malformedSamples = new AtomicLong();

  public RequestRecorder(
      String serviceName,
      TierClassifier classifier,
      Map<SLATier, TierMetrics> metrics,
      MetricsSink sink,
      Clock clock) {
    this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records one completed request. Never throws.
   *
   * @param responseTimeSeconds observed latency in seconds
   * @param success whether the request met its functional contract
   * @param endpoint route the request was served by, used for logging and latency export only
   * @return the tier the request was counted in
   */
  public SLATier recordRequest(double responseTimeSeconds, boolean success, String endpoint) {
    String route = endpoint == null || endpoint.isBlank() ? UNKNOWN_ENDPOINT : endpoint;

    double sample = responseTimeSeconds;
    SLATier tier;
    if (Double.isNaN(responseTimeSeconds) || Double.isInfinite(responseTimeSeconds)) {
      malformedSamples.incrementAndGet();
      log.warn(
          "Unusable response time {} for {}, counting request in {} without a sample",
          responseTimeSeconds,
          route,
          SLATier.BRONZE.label());
      tier = SLATier.BRONZE;
      sample = Double.NaN;
    } else {
      if (responseTimeSeconds < 0.0) {
        malformedSamples.incrementAndGet();
        log.warn("Negative response time {} for {}, clamping to 0", responseTimeSeconds, route);
        sample = 0.0;
      }
      tier = classifier.determineTier(sample);
    }

    metrics.get(tier).record(sample, success, clock.instant());

    if (!Double.isNaN(sample)) {
      try {
        sink.observeResponseTime(serviceName, route, tier.label(), sample);
      } catch (RuntimeException e) {
        log.warn("Metrics sink rejected response time for {}: {}", route, e.getMessage());
      }
    }

    log.debug(
        "Recorded SLA request: tier={}, response_time={}, success={}, endpoint={}",
        tier.label(),
        sample,
        success,
        route);
    return tier;
  }

  public long malformedSampleCount() {
    return malformedSamples.get();
  }
}
