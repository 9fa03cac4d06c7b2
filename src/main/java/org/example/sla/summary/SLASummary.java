package org.example.sla.summary;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of all tiers keyed by tier label in gold, silver, bronze order. {@code lastUpdated} is the
 * most recent activity across tiers, so two summaries taken with no activity in between are equal.
 */
@Value
@Builder
public class SLASummary {
  Instant lastUpdated;
  Map<String, TierSummary> tiers;
}
