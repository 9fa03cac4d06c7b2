package org.example.sla;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.example.sla.config.SLAConfigurationException;
import org.example.sla.config.TrackerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TierClassifierTest {

  private final TierClassifier classifier = new TierClassifier(0.2, 1.0);

  @ParameterizedTest(name = "{0}s -> {1}")
  @CsvSource({
    "0.15, GOLD",
    "0.2, GOLD",
    "0.0, GOLD",
    "0.5, SILVER",
    "1.0, SILVER",
    "1.0000001, BRONZE",
    "1.5, BRONZE",
    "120, BRONZE"
  })
  void shouldClassifyByLatencyWithInclusiveBounds(double latency, SLATier expected) {
    assertEquals(expected, classifier.determineTier(latency));
  }

  @Test
  @DisplayName("Should take thresholds from gold and silver response time targets")
  void shouldBuildFromSettings() {
    TierClassifier fromSettings = TierClassifier.from(TrackerSettings.defaults());

    assertEquals(new TierClassifier.Thresholds(0.2, 1.0), fromSettings.thresholds());
  }

  @Test
  @DisplayName("Should apply new thresholds to subsequent classifications")
  void shouldUpdateThresholds() {
    classifier.updateThresholds(0.1, 0.3);

    assertEquals(SLATier.SILVER, classifier.determineTier(0.15));
    assertEquals(SLATier.BRONZE, classifier.determineTier(0.5));
  }

  @Test
  @DisplayName("Should reject thresholds where silver is faster than gold")
  void shouldRejectInvertedThresholds() {
    assertThrows(SLAConfigurationException.class, () -> classifier.updateThresholds(1.0, 0.5));
    assertThrows(SLAConfigurationException.class, () -> new TierClassifier(Double.NaN, 1.0));
    assertThrows(SLAConfigurationException.class, () -> new TierClassifier(-0.1, 1.0));

    // previous thresholds survive a rejected update
    assertEquals(new TierClassifier.Thresholds(0.2, 1.0), classifier.thresholds());
  }

  @Test
  @DisplayName("Should never observe a half-applied threshold update")
  void shouldSwapThresholdsAtomically() throws Exception {
    // 1.5s is bronze under (0.2, 1.0) and gold under (2.0, 3.0); only a torn
    // pair such as (0.2, 3.0) would make it silver.
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> readers = new ArrayList<>();
      for (int i = 0; i < 3; i++) {
        readers.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int n = 0; n < 50_000; n++) {
                    if (classifier.determineTier(1.5) == SLATier.SILVER) return false;
                  }
                  return true;
                }));
      }
      pool.submit(
          () -> {
            start.await();
            for (int n = 0; n < 500; n++) {
              classifier.updateThresholds(2.0, 3.0);
              classifier.updateThresholds(0.2, 1.0);
            }
            return null;
          });

      start.countDown();
      for (Future<Boolean> reader : readers) {
        assertTrue(reader.get(30, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void shouldResolveTierLabels() {
    assertEquals(SLATier.SILVER, SLATier.fromLabel(" Silver ").orElseThrow());
    assertTrue(SLATier.fromLabel("platinum").isEmpty());
    assertTrue(SLATier.fromLabel(null).isEmpty());

    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> SLATier.parse("platinum"));
    assertTrue(error.getMessage().contains("gold, silver, bronze"));
  }
}
