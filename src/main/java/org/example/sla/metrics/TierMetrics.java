package org.example.sla.metrics;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import org.example.sla.SLATier;

/**
 * Mutable metrics of a single tier. Each tier owns its own lock, so recording into one tier never
 * waits on another.
 *
 * <p>Raw counters and samples are written by the recording path; the derived ratios are written
 * by the periodic recompute. Readers only ever see copies.
 */
public final class TierMetrics {

  private final SLATier tier;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  // guarded by lock
  private final ResponseTimeWindow responseTimes;
  private long totalRequests;
  private long successfulRequests;
  private long failedRequests;
  private Instant lastUpdate;
  private double currentAvailability = 1.0;
  private double currentResponseTime = 0.0;
  private double errorBudgetRemaining = 1.0;
  private double errorBudgetBurnRate = 0.0;

  public TierMetrics(SLATier tier, Instant createdAt) {
    this(tier, createdAt, ResponseTimeWindow.DEFAULT_CAPACITY);
  }

  public TierMetrics(SLATier tier, Instant createdAt, int windowCapacity) {
    this.tier = tier;
    this.lastUpdate = createdAt;
    this.responseTimes = new ResponseTimeWindow(windowCapacity);
  }

  public SLATier tier() {
    return tier;
  }

  /**
   * Counts one request.
   *
   * @param responseTime sample to buffer, or {@code NaN} to count the request without a sample
   */
  public void record(double responseTime, boolean success, Instant now) {
    lock.writeLock().lock();
    try {
      totalRequests++;
      if (success) {
        successfulRequests++;
      } else {
        failedRequests++;
      }
      if (!Double.isNaN(responseTime)) {
        responseTimes.add(responseTime);
      }
      lastUpdate = now;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Copies what the recompute needs so the arithmetic can run without holding the lock. */
  public RawCounts capture() {
    lock.readLock().lock();
    try {
      return new RawCounts(
          totalRequests,
          successfulRequests,
          failedRequests,
          responseTimes.toArray(),
          currentAvailability);
    } finally {
      lock.readLock().unlock();
    }
  }

  public void applyDerived(DerivedMetrics derived) {
    lock.writeLock().lock();
    try {
      currentAvailability = derived.availability();
      currentResponseTime = derived.responseTime();
      errorBudgetRemaining = derived.errorBudgetRemaining();
      errorBudgetBurnRate = derived.burnRate();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public SLAMetricsSnapshot snapshot() {
    lock.readLock().lock();
    try {
      List<Double> samples =
          Arrays.stream(responseTimes.toArray()).boxed().collect(Collectors.toUnmodifiableList());
      return SLAMetricsSnapshot.builder()
          .tier(tier)
          .currentAvailability(currentAvailability)
          .currentResponseTime(currentResponseTime)
          .errorBudgetRemaining(errorBudgetRemaining)
          .errorBudgetBurnRate(errorBudgetBurnRate)
          .lastUpdate(lastUpdate)
          .totalRequests(totalRequests)
          .successfulRequests(successfulRequests)
          .failedRequests(failedRequests)
          .responseTimes(samples)
          .build();
    } finally {
      lock.readLock().unlock();
    }
  }

  public double errorBudgetRemaining() {
    lock.readLock().lock();
    try {
      return errorBudgetRemaining;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Counters and samples copied under the tier lock. */
  public record RawCounts(
      long totalRequests,
      long successfulRequests,
      long failedRequests,
      double[] responseTimes,
      double previousAvailability) {}

  /** Result of one recompute pass for a tier. */
  public record DerivedMetrics(
      double availability, double responseTime, double errorBudgetRemaining, double burnRate) {}
}
