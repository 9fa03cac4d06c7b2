package org.example.sla.sink;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.example.sla.SLATier;
import org.example.sla.config.TrackerSettings;

/**
 * Publishes SLA metrics as Micrometer meters.
 *
 * <ul>
 *   <li>{@code sla_availability_ratio{service,sla_tier}}
 *   <li>{@code sla_error_budget_ratio{service,sla_tier,period}}
 *   <li>{@code sla_error_budget_burn_rate{service,sla_tier,window}}
 *   <li>{@code sla_response_time{service,endpoint,sla_tier}} (timer)
 * </ul>
 *
 * The {@code period} tag is each tier's own error budget period and {@code window} is the update
 * interval. Gauges read from {@link AtomicDouble} holders registered once per label set.
 */
public class MicrometerMetricsSink implements MetricsSink {

  static final String AVAILABILITY = "sla_availability_ratio";
  static final String ERROR_BUDGET = "sla_error_budget_ratio";
  static final String BURN_RATE = "sla_error_budget_burn_rate";
  static final String RESPONSE_TIME = "sla_response_time";

  private final MeterRegistry registry;
  private final Map<String, String> periods;
  private final String window;
  private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

  public MicrometerMetricsSink(MeterRegistry registry, TrackerSettings settings) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(settings, "settings");
    Map<String, String> byLabel = new HashMap<>();
    for (SLATier tier : SLATier.values()) {
      byLabel.put(tier.label(), formatDuration(settings.forTier(tier).getErrorBudgetPeriod()));
    }
    this.periods = Map.copyOf(byLabel);
    this.window = formatDuration(settings.getUpdateInterval());
  }

  @Override
  public void updateSLAMetrics(
      String service, String tier, double availability, double errorBudgetRemaining, double burnRate) {
    gauge(AVAILABILITY, service, tier, "", "").set(availability);
    gauge(ERROR_BUDGET, service, tier, "period", periods.getOrDefault(tier, "unknown"))
        .set(errorBudgetRemaining);
    gauge(BURN_RATE, service, tier, "window", window).set(burnRate);
  }

  @Override
  public void observeResponseTime(String service, String endpoint, String tier, double seconds) {
    Timer.builder(RESPONSE_TIME)
        .description("SLA response time tracking")
        .tags("service", service, "endpoint", endpoint, "sla_tier", tier)
        .register(registry)
        .record(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
  }

  private AtomicDouble gauge(
      String name, String service, String tier, String extraTag, String extraValue) {
    String key = String.join("|", name, service, tier, extraTag, extraValue);
    return gauges.computeIfAbsent(
        key,
        k -> {
          AtomicDouble holder = new AtomicDouble();
          Gauge.Builder<AtomicDouble> builder =
              Gauge.builder(name, holder, AtomicDouble::get)
                  .tag("service", service)
                  .tag("sla_tier", tier);
          if (!extraTag.isEmpty()) {
            builder.tag(extraTag, extraValue);
          }
          builder.register(registry);
          return holder;
        });
  }

  static String formatDuration(Duration duration) {
    long millis = duration.toMillis();
    if (millis == 0) return "0s";
    if (millis % 86_400_000L == 0) return duration.toDays() + "d";
    if (millis % 3_600_000L == 0) return duration.toHours() + "h";
    if (millis % 60_000L == 0) return duration.toMinutes() + "m";
    if (millis % 1_000L == 0) return duration.toSeconds() + "s";
    return millis + "ms";
  }
}
