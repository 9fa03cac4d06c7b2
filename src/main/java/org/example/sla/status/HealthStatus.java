package org.example.sla.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
  HEALTHY("healthy"),
  WARNING("warning"),
  CRITICAL("critical");

  private final String label;

  HealthStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
