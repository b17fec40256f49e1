package com.mk.fx.qa.llm.load.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One liveness probe result.
 *
 * @param timestamp when the probe completed
 * @param healthy whether the endpoint answered with a 2xx status
 * @param httpStatus HTTP status, null when no response was received
 * @param detail bounded response text or error message
 */
public record HealthSample(Instant timestamp, boolean healthy, Integer httpStatus, String detail) {

  public static final int MAX_DETAIL_CHARS = 200;

  /** {@code healthy}, {@code unhealthy} for an HTTP failure or {@code error} without response. */
  @JsonProperty("status")
  public String statusLabel() {
    if (healthy) {
      return "healthy";
    }
    return httpStatus != null ? "unhealthy" : "error";
  }
}
