package org.example.sla.status;

import static org.junit.jupiter.api.Assertions.*;

import org.example.sla.SLATier;
import org.example.sla.config.SLAConfiguration;
import org.example.sla.config.TrackerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StatusClassifierTest {

  private final SLAConfiguration silver = TrackerSettings.defaultConfiguration(SLATier.SILVER);

  @ParameterizedTest(name = "availability {0} against 0.99 -> {1}")
  @CsvSource({
    "0.991, HEALTHY",
    "0.99, HEALTHY",
    "0.9855, WARNING",
    "0.9405, WARNING",
    "0.94, CRITICAL",
    "0.5, CRITICAL"
  })
  void shouldGradeAvailability(double current, HealthStatus expected) {
    assertEquals(expected, StatusClassifier.availabilityStatus(current, 0.99));
  }

  @ParameterizedTest(name = "response time {0}s against 0.2s -> {1}")
  @CsvSource({"0.1, HEALTHY", "0.2, HEALTHY", "0.25, WARNING", "0.3, WARNING", "0.31, CRITICAL"})
  void shouldGradeResponseTime(double current, HealthStatus expected) {
    assertEquals(expected, StatusClassifier.responseTimeStatus(current, 0.2));
  }

  @ParameterizedTest(name = "budget {0} remaining -> {1}")
  @CsvSource({"1.0, HEALTHY", "0.2, HEALTHY", "0.15, WARNING", "0.1, WARNING", "0.05, CRITICAL"})
  void shouldGradeErrorBudget(double remaining, HealthStatus expected) {
    assertEquals(expected, StatusClassifier.errorBudgetStatus(remaining, silver));
  }

  @Test
  @DisplayName("Should flag the budget as critical strictly below the critical threshold")
  void shouldFlagCriticalBudget() {
    assertTrue(StatusClassifier.isErrorBudgetCritical(0.05, silver));
    assertFalse(StatusClassifier.isErrorBudgetCritical(0.1, silver));
  }

  @Test
  void shouldExposeLowerCaseLabels() {
    assertEquals("healthy", HealthStatus.HEALTHY.label());
    assertEquals("warning", HealthStatus.WARNING.label());
    assertEquals("critical", HealthStatus.CRITICAL.label());
  }
}
