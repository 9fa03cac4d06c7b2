package org.example.sla.config;

/** Thrown when an SLA target or tracker setting is out of range. */
public class SLAConfigurationException extends IllegalArgumentException {

  public SLAConfigurationException(String message) {
    super(message);
  }

  public SLAConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
