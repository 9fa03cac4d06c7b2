package org.example.sla;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** Service level agreement tiers, ordered fastest first. */
public enum SLATier {
  GOLD("gold"),
  SILVER("silver"),
  BRONZE("bronze");

  private final String label;

  SLATier(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public static Optional<SLATier> fromLabel(String label) {
    if (label == null) return Optional.empty();
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.label.equals(normalized)).findFirst();
  }

  @JsonCreator
  public static SLATier parse(String label) {
    return fromLabel(label)
        .orElseThrow(() -> new IllegalArgumentException(
            "Invalid SLA tier '" + label + "'. Must be one of: " + labels()));
  }

  static String labels() {
    return Arrays.stream(values()).map(SLATier::label).collect(Collectors.joining(", "));
  }
}
