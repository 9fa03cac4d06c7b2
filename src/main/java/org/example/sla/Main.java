package org.example.sla;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import org.example.sla.config.TrackerSettings;
import org.example.sla.sink.LoggingMetricsSink;
import org.example.sla.util.JsonUtil;

/** Wires a tracker by hand, feeds it a synthetic workload and prints the resulting status. */
public class Main {
  public static void main(String[] args) throws JsonProcessingException, InterruptedException {
    var settingsJson =
        """
        {
          "serviceName": "orders-api",
          "updateInterval": "PT1S",
          "tiers": {
            "gold":   { "availabilityTarget": 0.995, "responseTimeTarget": 0.2 },
            "silver": { "availabilityTarget": 0.99,  "responseTimeTarget": 1.0 },
            "bronze": { "availabilityTarget": 0.98,  "responseTimeTarget": 2.0,
                        "errorBudgetPeriod": "P7D" }
          }
        }
        """;

    TrackerSettings settings = TrackerSettings.fromJson(settingsJson);
    CompletableFuture<Void> shutdown = new CompletableFuture<>();

    try (SLATracker tracker = new SLATracker(settings, new LoggingMetricsSink())) {
      tracker.start(shutdown);

      Random random = new Random(42);
      String[] endpoints = {"/orders", "/orders/{id}", "/health"};
      for (int i = 0; i < 5_000; i++) {
        double latency = Math.abs(random.nextGaussian() * 0.4 + 0.3);
        boolean success = random.nextDouble() > 0.012;
        tracker.recordRequest(latency, success, endpoints[i % endpoints.length]);
      }

      Thread.sleep(settings.getUpdateInterval().toMillis() + 500);
      shutdown.complete(null);

      System.out.println(JsonUtil.writePretty(tracker.getSLAStatus()));
      System.out.println("Error budget critical: " + tracker.isErrorBudgetCritical());
    }
  }
}
