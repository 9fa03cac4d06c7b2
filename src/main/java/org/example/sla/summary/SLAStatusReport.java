package org.example.sla.summary;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import org.example.sla.metrics.SLAMetricsSnapshot;

/** Everything the status endpoint serves in one read: raw metrics, summary and critical flags. */
@Value
@Builder
public class SLAStatusReport {
  Instant generatedAt;
  Map<String, SLAMetricsSnapshot> tiers;
  SLASummary summary;
  Map<String, Boolean> critical;
}
