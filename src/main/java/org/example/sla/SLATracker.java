package org.example.sla;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.example.sla.config.SLAConfiguration;
import org.example.sla.config.TrackerSettings;
import org.example.sla.metrics.SLAMetricsSnapshot;
import org.example.sla.metrics.TierMetrics;
import org.example.sla.sink.MetricsSink;
import org.example.sla.status.StatusClassifier;
import org.example.sla.summary.SLAStatusReport;
import org.example.sla.summary.SLASummary;
import org.example.sla.summary.TierSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLA/SLI tracker for one service: classifies completed requests into tiers, recomputes
 * availability and error budget on a fixed interval, and serves copies of the result.
 *
 * <p>Create one instance at the composition root and hand it to whatever records requests and
 * whatever reads status. The recompute loop runs on a single daemon thread between {@link #start}
 * and {@link #stop}; recording and reads work whether or not the loop is running.
 *
 * <p>Lifecycle: {@code STOPPED -> RUNNING} via {@link #start()}, back via {@link #stop()} or when the
 * cancellation future passed to {@link #start(CompletableFuture)} completes. Both transitions are
 * idempotent and the tracker may be started again after a stop.
 */
public class SLATracker implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SLATracker.class);
  private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final TrackerSettings settings;
  private final Clock clock;
  private final Map<SLATier, TierMetrics> metrics;
  private final TierClassifier classifier;
  private final RequestRecorder recorder;
  private final MetricsCalculator calculator;
  private final AtomicLong completedPasses = new AtomicLong();

  private final Object lifecycleLock = new Object();
  // guarded by lifecycleLock
  private Run currentRun;

  public SLATracker(TrackerSettings settings, MetricsSink sink) {
    this(settings, sink, Clock.systemUTC());
  }

  public SLATracker(TrackerSettings settings, MetricsSink sink, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(sink, "sink");

    Instant now = clock.instant();
    EnumMap<SLATier, TierMetrics> tiers = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      tiers.put(tier, new TierMetrics(tier, now));
    }
    this.metrics = Collections.unmodifiableMap(tiers);
    this.classifier = TierClassifier.from(settings);
    this.recorder = new RequestRecorder(settings.getServiceName(), classifier, metrics, sink, clock);
    this.calculator = new MetricsCalculator(settings, metrics, sink);

    log.info(
        "SLA tracker created for service {} (update interval {})",
        settings.getServiceName(),
        settings.getUpdateInterval());
  }

  // === Lifecycle ===

  /** Starts the recompute loop. Returns {@code false} if it was already running. */
  public boolean start() {
    return start(null);
  }

  /**
   * Starts the recompute loop and stops it again as soon as {@code cancellation} completes, normally
   * or exceptionally.
   *
   * @return {@code false} if the loop was already running or the cancellation is already complete
   */
  public boolean start(CompletableFuture<?> cancellation) {
    synchronized (lifecycleLock) {
      if (currentRun != null) {
        log.warn("SLA tracker already running, ignoring start");
        return false;
      }
      if (cancellation != null && cancellation.isDone()) {
        log.warn("SLA tracker cancellation already signalled, not starting");
        return false;
      }

      long intervalMillis = settings.getUpdateInterval().toMillis();
      ScheduledExecutorService scheduler =
          Executors.newSingleThreadScheduledExecutor(
              new ThreadFactoryBuilder()
                  .setNameFormat("sla-tracker-" + settings.getServiceName() + "-%d")
                  .setDaemon(true)
                  .build());
      Run run = new Run(scheduler);
      run.task =
          scheduler.scheduleAtFixedRate(
              () -> runPass(run), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
      currentRun = run;

      log.info("Starting SLA tracker, update_interval={}", settings.getUpdateInterval());

      if (cancellation != null) {
        cancellation.whenComplete(
            (result, error) -> {
              log.info("SLA tracker cancellation signalled");
              stop(run);
            });
      }
      return true;
    }
  }

  /**
   * Stops the recompute loop. On return no pass is running and none will start, also for a caller
   * that raced another {@code stop} and lost. Returns {@code false} if this call did not perform the
   * stop.
   */
  public boolean stop() {
    Run run;
    synchronized (lifecycleLock) {
      run = currentRun;
    }
    if (run == null) {
      log.debug("SLA tracker not running, ignoring stop");
      return false;
    }
    return stop(run);
  }

  private boolean stop(Run run) {
    boolean owner;
    synchronized (lifecycleLock) {
      owner = currentRun == run;
      if (owner) {
        currentRun = null;
      }
    }
    if (owner) {
      log.info("Stopping SLA tracker");
      run.task.cancel(false);
    } else {
      log.debug("SLA tracker stop already in progress, waiting for it");
    }
    shutdownScheduler(run);
    return owner;
  }

  @Override
  public void close() {
    stop();
  }

  public TrackerState getState() {
    synchronized (lifecycleLock) {
      return currentRun != null ? TrackerState.RUNNING : TrackerState.STOPPED;
    }
  }

  public boolean isRunning() {
    return getState() == TrackerState.RUNNING;
  }

  private void runPass(Run run) {
    run.worker = Thread.currentThread();
    try {
      updateMetrics();
    } catch (RuntimeException e) {
      // an exception escaping here would cancel the schedule
      log.error("SLA metrics update failed", e);
    }
  }

  private void shutdownScheduler(Run run) {
    ScheduledExecutorService scheduler = run.scheduler;
    scheduler.shutdown();
    if (Thread.currentThread() == run.worker) {
      // stopped from inside a pass; the pass finishes on return
      return;
    }
    try {
      if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn(
            "SLA tracker scheduler did not terminate within {} seconds, forcing shutdown",
            SHUTDOWN_TIMEOUT_SECONDS);
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      log.warn("SLA tracker shutdown was interrupted, forcing immediate shutdown");
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  // === Recording ===

  /** Records one completed request. Never throws; see {@link RequestRecorder}. */
  public SLATier recordRequest(double responseTimeSeconds, boolean success, String endpoint) {
    return recorder.recordRequest(responseTimeSeconds, success, endpoint);
  }

  /** Runs one recompute pass immediately, independent of the schedule. */
  public void updateMetrics() {
    calculator.recompute();
    completedPasses.incrementAndGet();
  }

  // === Queries ===

  public Optional<SLAMetricsSnapshot> getMetrics(SLATier tier) {
    if (tier == null) return Optional.empty();
    return Optional.of(metrics.get(tier).snapshot());
  }

  public Map<SLATier, SLAMetricsSnapshot> getAllMetrics() {
    EnumMap<SLATier, SLAMetricsSnapshot> result = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      result.put(tier, metrics.get(tier).snapshot());
    }
    return Collections.unmodifiableMap(result);
  }

  public SLASummary getSummary() {
    return summarize(getAllMetrics());
  }

  /** All tiers, their summary and critical flags, built from a single read of each tier. */
  public SLAStatusReport getSLAStatus() {
    Map<SLATier, SLAMetricsSnapshot> snapshots = getAllMetrics();
    Map<String, SLAMetricsSnapshot> byLabel = new LinkedHashMap<>();
    Map<String, Boolean> critical = new LinkedHashMap<>();
    snapshots.forEach(
        (tier, snapshot) -> {
          byLabel.put(tier.label(), snapshot);
          critical.put(
              tier.label(),
              StatusClassifier.isErrorBudgetCritical(
                  snapshot.getErrorBudgetRemaining(), settings.forTier(tier)));
        });
    return SLAStatusReport.builder()
        .generatedAt(clock.instant())
        .tiers(Collections.unmodifiableMap(byLabel))
        .summary(summarize(snapshots))
        .critical(Collections.unmodifiableMap(critical))
        .build();
  }

  /**
   * Looks a tier up by its wire label.
   *
   * @throws IllegalArgumentException if {@code tierLabel} is not gold, silver or bronze
   */
  public SLAMetricsSnapshot getSLAStatusForTier(String tierLabel) {
    SLATier tier = SLATier.parse(tierLabel);
    return metrics.get(tier).snapshot();
  }

  public Map<SLATier, Boolean> isErrorBudgetCritical() {
    EnumMap<SLATier, Boolean> result = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      result.put(tier, isErrorBudgetCritical(tier));
    }
    return Collections.unmodifiableMap(result);
  }

  public boolean isErrorBudgetCritical(SLATier tier) {
    return StatusClassifier.isErrorBudgetCritical(
        metrics.get(tier).errorBudgetRemaining(), settings.forTier(tier));
  }

  public TrackerSettings getSettings() {
    return settings;
  }

  /** Classifier in use; its thresholds may be swapped at runtime. */
  public TierClassifier getClassifier() {
    return classifier;
  }

  public long getMalformedSampleCount() {
    return recorder.malformedSampleCount();
  }

  @VisibleForTesting
  long completedPasses() {
    return completedPasses.get();
  }

  private SLASummary summarize(Map<SLATier, SLAMetricsSnapshot> snapshots) {
    Map<String, TierSummary> tiers = new LinkedHashMap<>();
    Instant lastUpdated = Instant.EPOCH;
    for (SLATier tier : SLATier.values()) {
      SLAMetricsSnapshot snapshot = snapshots.get(tier);
      tiers.put(tier.label(), summarize(snapshot, settings.forTier(tier)));
      if (snapshot.getLastUpdate().isAfter(lastUpdated)) {
        lastUpdated = snapshot.getLastUpdate();
      }
    }
    return SLASummary.builder()
        .lastUpdated(lastUpdated)
        .tiers(Collections.unmodifiableMap(tiers))
        .build();
  }

  private static TierSummary summarize(SLAMetricsSnapshot snapshot, SLAConfiguration config) {
    return TierSummary.builder()
        .availability(
            TierSummary.Indicator.builder()
                .current(snapshot.getCurrentAvailability())
                .target(config.getAvailabilityTarget())
                .status(
                    StatusClassifier.availabilityStatus(
                        snapshot.getCurrentAvailability(), config.getAvailabilityTarget()))
                .build())
        .responseTime(
            TierSummary.Indicator.builder()
                .current(snapshot.getCurrentResponseTime())
                .target(config.getResponseTimeTarget())
                .status(
                    StatusClassifier.responseTimeStatus(
                        snapshot.getCurrentResponseTime(), config.getResponseTimeTarget()))
                .build())
        .errorBudget(
            TierSummary.ErrorBudget.builder()
                .remaining(snapshot.getErrorBudgetRemaining())
                .burnRate(snapshot.getErrorBudgetBurnRate())
                .status(
                    StatusClassifier.errorBudgetStatus(snapshot.getErrorBudgetRemaining(), config))
                .build())
        .requests(
            TierSummary.Requests.builder()
                .total(snapshot.getTotalRequests())
                .successful(snapshot.getSuccessfulRequests())
                .failed(snapshot.getFailedRequests())
                .build())
        .build();
  }

  /** One start-to-stop period of the recompute loop. */
  private static final class Run {
    final ScheduledExecutorService scheduler;
    volatile ScheduledFuture<?> task;
    volatile Thread worker;

    Run(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
    }
  }
}
