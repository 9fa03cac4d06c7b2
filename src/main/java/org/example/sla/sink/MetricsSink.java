package org.example.sla.sink;

/**
 * Receives the derived SLA metrics once per tier per recompute, and optionally every recorded
 * response time. Implementations are called from the recompute thread and from request threads, so
 * they must be safe for concurrent use. Exceptions thrown by a sink are logged by the caller and
 * never reach request handling.
 */
public interface MetricsSink {

  void updateSLAMetrics(
      String service, String tier, double availability, double errorBudgetRemaining, double burnRate);

  /** Called for each recorded request with a usable latency. Ignored unless overridden. */
  default void observeResponseTime(String service, String endpoint, String tier, double seconds) {}

  MetricsSink NO_OP =
      new MetricsSink() {
        @Override
        public void updateSLAMetrics(
            String service,
            String tier,
            double availability,
            double errorBudgetRemaining,
            double burnRate) {}
      };
}
