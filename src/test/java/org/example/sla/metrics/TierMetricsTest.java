package org.example.sla.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import org.example.sla.SLATier;
import org.example.sla.metrics.TierMetrics.DerivedMetrics;
import org.example.sla.metrics.TierMetrics.RawCounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TierMetricsTest {

  private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  @DisplayName("Should start with full availability and budget")
  void shouldInitializeDefaults() {
    SLAMetricsSnapshot snapshot = new TierMetrics(SLATier.GOLD, CREATED).snapshot();

    assertEquals(SLATier.GOLD, snapshot.getTier());
    assertEquals(1.0, snapshot.getCurrentAvailability());
    assertEquals(1.0, snapshot.getErrorBudgetRemaining());
    assertEquals(0.0, snapshot.getErrorBudgetBurnRate());
    assertEquals(0, snapshot.getTotalRequests());
    assertEquals(CREATED, snapshot.getLastUpdate());
    assertTrue(snapshot.getResponseTimes().isEmpty());
  }

  @Test
  void shouldCountOutcomesAndSamples() {
    TierMetrics metrics = new TierMetrics(SLATier.SILVER, CREATED);
    Instant later = CREATED.plusSeconds(5);

    metrics.record(0.4, true, CREATED);
    metrics.record(0.6, false, later);

    SLAMetricsSnapshot snapshot = metrics.snapshot();
    assertEquals(2, snapshot.getTotalRequests());
    assertEquals(1, snapshot.getSuccessfulRequests());
    assertEquals(1, snapshot.getFailedRequests());
    assertEquals(later, snapshot.getLastUpdate());
    assertEquals(List.of(0.4, 0.6), snapshot.getResponseTimes());
  }

  @Test
  @DisplayName("Should count a request without buffering a NaN sample")
  void shouldSkipNaNSample() {
    TierMetrics metrics = new TierMetrics(SLATier.BRONZE, CREATED);

    metrics.record(Double.NaN, true, CREATED);

    RawCounts counts = metrics.capture();
    assertEquals(1, counts.totalRequests());
    assertEquals(0, counts.responseTimes().length);
  }

  @Test
  @DisplayName("Should hand out snapshots that cannot alter tracker state")
  void shouldReturnDeepCopies() {
    TierMetrics metrics = new TierMetrics(SLATier.GOLD, CREATED);
    metrics.record(0.1, true, CREATED);

    SLAMetricsSnapshot snapshot = metrics.snapshot();
    assertThrows(UnsupportedOperationException.class, () -> snapshot.getResponseTimes().add(9.9));

    RawCounts counts = metrics.capture();
    counts.responseTimes()[0] = 9.9;

    assertEquals(0.1, metrics.snapshot().getResponseTimes().get(0));
  }

  @Test
  void shouldApplyDerivedMetrics() {
    TierMetrics metrics = new TierMetrics(SLATier.GOLD, CREATED);

    metrics.applyDerived(new DerivedMetrics(0.97, 0.15, 0.4, 3.0));

    SLAMetricsSnapshot snapshot = metrics.snapshot();
    assertEquals(0.97, snapshot.getCurrentAvailability());
    assertEquals(0.15, snapshot.getCurrentResponseTime());
    assertEquals(0.4, snapshot.getErrorBudgetRemaining());
    assertEquals(0.4, metrics.errorBudgetRemaining());
    assertEquals(3.0, snapshot.getErrorBudgetBurnRate());
    assertEquals(0.97, metrics.capture().previousAvailability());
  }
}
