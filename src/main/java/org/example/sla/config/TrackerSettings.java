package org.example.sla.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.example.sla.SLATier;
import org.example.sla.util.JsonUtil;

/**
 * Everything a tracker needs at construction: the service name reported to the sink, the recompute
 * interval and one {@link SLAConfiguration} per tier.
 *
 * <p>Tier thresholds double as classification bounds, so silver's response time target may not be
 * faster than gold's.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TrackerSettings {

  public static final String DEFAULT_SERVICE_NAME = "sla-tracker";
  public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_ERROR_BUDGET_PERIOD = Duration.ofDays(30);
  /** The recompute loop is scheduled in whole milliseconds. */
  public static final Duration MIN_UPDATE_INTERVAL = Duration.ofMillis(1);

  private final String serviceName;
  private final Duration updateInterval;
  private final Map<SLATier, SLAConfiguration> tiers;

  public TrackerSettings(
      String serviceName, Duration updateInterval, Map<SLATier, SLAConfiguration> tiers) {
    if (serviceName == null || serviceName.isBlank()) {
      throw new SLAConfigurationException("serviceName must not be blank");
    }
    if (updateInterval == null || updateInterval.compareTo(MIN_UPDATE_INTERVAL) < 0) {
      throw new SLAConfigurationException(
          "updateInterval must be at least " + MIN_UPDATE_INTERVAL + ", got " + updateInterval);
    }
    if (tiers == null) {
      throw new SLAConfigurationException("tier configurations are required");
    }
    EnumMap<SLATier, SLAConfiguration> copy = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      SLAConfiguration config = tiers.get(tier);
      if (config == null) {
        throw new SLAConfigurationException("missing configuration for tier " + tier.label());
      }
      if (config.getTier() != tier) {
        throw new SLAConfigurationException(
            "configuration for " + config.getTier().label() + " registered under " + tier.label());
      }
      copy.put(tier, config);
    }
    if (copy.get(SLATier.SILVER).getResponseTimeTarget()
        < copy.get(SLATier.GOLD).getResponseTimeTarget()) {
      throw new SLAConfigurationException(
          "silver responseTimeTarget must not be below gold responseTimeTarget");
    }
    this.serviceName = serviceName;
    this.updateInterval = updateInterval;
    this.tiers = Collections.unmodifiableMap(copy);
  }

  public SLAConfiguration forTier(SLATier tier) {
    return tiers.get(tier);
  }

  public TrackerSettings withUpdateInterval(Duration interval) {
    return new TrackerSettings(serviceName, interval, tiers);
  }

  public TrackerSettings withTier(SLAConfiguration config) {
    EnumMap<SLATier, SLAConfiguration> copy = new EnumMap<>(tiers);
    copy.put(config.getTier(), config);
    return new TrackerSettings(serviceName, updateInterval, copy);
  }

  public static TrackerSettings defaults() {
    EnumMap<SLATier, SLAConfiguration> tiers = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      tiers.put(tier, defaultConfiguration(tier));
    }
    return new TrackerSettings(DEFAULT_SERVICE_NAME, DEFAULT_UPDATE_INTERVAL, tiers);
  }

  public static SLAConfiguration defaultConfiguration(SLATier tier) {
    var builder =
        SLAConfiguration.builder()
            .tier(tier)
            .errorBudgetPeriod(DEFAULT_ERROR_BUDGET_PERIOD)
            .alertThreshold(0.2)
            .criticalThreshold(0.1);
    return switch (tier) {
      case GOLD -> builder.availabilityTarget(0.995).responseTimeTarget(0.2).build();
      case SILVER -> builder.availabilityTarget(0.99).responseTimeTarget(1.0).build();
      case BRONZE -> builder.availabilityTarget(0.98).responseTimeTarget(2.0).build();
    };
  }

  /**
   * Parses settings from JSON. Absent fields keep their default value, so a document may override a
   * single threshold of a single tier.
   *
   * <pre>{@code
   * {"serviceName": "orders", "updateInterval": "PT15S",
   *  "tiers": {"gold": {"availabilityTarget": 0.999}}}
   * }</pre>
   */
  public static TrackerSettings fromJson(String json) {
    Document document;
    try {
      document = JsonUtil.read(json, Document.class);
    } catch (JsonProcessingException e) {
      throw new SLAConfigurationException("invalid SLA settings document: " + e.getOriginalMessage(), e);
    }
    if (document == null) {
      throw new SLAConfigurationException("empty SLA settings document");
    }

    EnumMap<SLATier, TierDocument> overrides = new EnumMap<>(SLATier.class);
    if (document.getTiers() != null) {
      document.getTiers().forEach((label, tierDocument) -> overrides.put(
          SLATier.fromLabel(label).orElseThrow(() -> new SLAConfigurationException(
              "unknown SLA tier '" + label + "' in settings document")),
          tierDocument));
    }
    EnumMap<SLATier, SLAConfiguration> tiers = new EnumMap<>(SLATier.class);
    for (SLATier tier : SLATier.values()) {
      tiers.put(tier, merge(defaultConfiguration(tier), overrides.get(tier)));
    }
    return new TrackerSettings(
        document.getServiceName() != null ? document.getServiceName() : DEFAULT_SERVICE_NAME,
        document.getUpdateInterval() != null ? document.getUpdateInterval() : DEFAULT_UPDATE_INTERVAL,
        tiers);
  }

  private static SLAConfiguration merge(SLAConfiguration base, TierDocument overrides) {
    if (overrides == null) return base;
    var builder = base.toBuilder();
    if (overrides.getAvailabilityTarget() != null) {
      builder.availabilityTarget(overrides.getAvailabilityTarget());
    }
    if (overrides.getResponseTimeTarget() != null) {
      builder.responseTimeTarget(overrides.getResponseTimeTarget());
    }
    if (overrides.getErrorBudgetPeriod() != null) {
      builder.errorBudgetPeriod(overrides.getErrorBudgetPeriod());
    }
    if (overrides.getAlertThreshold() != null) {
      builder.alertThreshold(overrides.getAlertThreshold());
    }
    if (overrides.getCriticalThreshold() != null) {
      builder.criticalThreshold(overrides.getCriticalThreshold());
    }
    return builder.build();
  }

  @Data
  @NoArgsConstructor
  static class Document {
    private String serviceName;
    private Duration updateInterval;
    private Map<String, TierDocument> tiers;
  }

  @Data
  @NoArgsConstructor
  static class TierDocument {
    private Double availabilityTarget;
    private Double responseTimeTarget;
    private Duration errorBudgetPeriod;
    private Double alertThreshold;
    private Double criticalThreshold;
  }
}
