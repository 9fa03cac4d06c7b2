package org.example.sla;

import java.util.concurrent.atomic.AtomicReference;
import org.example.sla.config.SLAConfigurationException;
import org.example.sla.config.TrackerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an observed latency to the fastest tier whose response time target it meets. Bounds are
 * inclusive: a request that takes exactly the gold target is gold.
 *
 * <p>Thresholds are held as one immutable pair behind an {@link AtomicReference}, so a classification
 * racing with {@link #updateThresholds} sees either the old pair or the new one, never a mix.
 */
public class TierClassifier {

  private static final Logger log = LoggerFactory.getLogger(TierClassifier.class);

  public record Thresholds(double goldSeconds, double silverSeconds) {
    public Thresholds {
      if (!(goldSeconds >= 0.0) || Double.isInfinite(goldSeconds)) {
        throw new SLAConfigurationException("gold threshold must be finite and >= 0, got " + goldSeconds);
      }
      if (!(silverSeconds >= goldSeconds) || Double.isInfinite(silverSeconds)) {
        throw new SLAConfigurationException(
            "silver threshold must be finite and >= gold (" + goldSeconds + "), got " + silverSeconds);
      }
    }
  }

  private final AtomicReference<Thresholds> thresholds;

  public TierClassifier(double goldSeconds, double silverSeconds) {
    this.thresholds = new AtomicReference<>(new Thresholds(goldSeconds, silverSeconds));
  }

  public static TierClassifier from(TrackerSettings settings) {
    return new TierClassifier(
        settings.forTier(SLATier.GOLD).getResponseTimeTarget(),
        settings.forTier(SLATier.SILVER).getResponseTimeTarget());
  }

  public SLATier determineTier(double responseTimeSeconds) {
    Thresholds current = thresholds.get();
    if (responseTimeSeconds <= current.goldSeconds()) {
      return SLATier.GOLD;
    } else if (responseTimeSeconds <= current.silverSeconds()) {
      return SLATier.SILVER;
    }
    return SLATier.BRONZE;
  }

  /** Swaps both bounds at once. Requests already recorded keep the tier they were given. */
  public void updateThresholds(double goldSeconds, double silverSeconds) {
    Thresholds previous = thresholds.getAndSet(new Thresholds(goldSeconds, silverSeconds));
    log.info(
        "Tier thresholds changed: gold {}s -> {}s, silver {}s -> {}s",
        previous.goldSeconds(),
        goldSeconds,
        previous.silverSeconds(),
        silverSeconds);
  }

  public Thresholds thresholds() {
    return thresholds.get();
  }
}
