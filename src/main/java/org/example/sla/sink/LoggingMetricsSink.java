package org.example.sla.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every tier update to the log. Default sink when no exporter is wired in. */
public class LoggingMetricsSink implements MetricsSink {

  private static final Logger log = LoggerFactory.getLogger(LoggingMetricsSink.class);

  @Override
  public void updateSLAMetrics(
      String service, String tier, double availability, double errorBudgetRemaining, double burnRate) {
    if (!log.isDebugEnabled()) return;
    log.debug(
        "SLA [{}/{}] availability={} errorBudgetRemaining={} burnRate={}",
        service,
        tier,
        String.format("%.4f", availability),
        String.format("%.4f", errorBudgetRemaining),
        String.format("%.2f", burnRate));
  }
}
