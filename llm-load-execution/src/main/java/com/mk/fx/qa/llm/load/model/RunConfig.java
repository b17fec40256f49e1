package com.mk.fx.qa.llm.load.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mk.fx.qa.llm.load.exceptions.RunConfigValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable parameters of one load run. Validated on construction; an invalid combination raises
 * {@link RunConfigValidationException} before any task is started.
 *
 * @param endpoint base URL of the OpenAI-compatible API
 * @param apiKey optional bearer credential, never logged or persisted
 * @param model model identifier sent with each request
 * @param concurrency number of simulated users
 * @param durationSeconds length of the test window
 * @param maxContextTokens upper bound used to size prompts
 * @param requestTimeoutSeconds timeout applied to each attempt
 * @param maxRetries retries allowed per logical request after the first attempt
 * @param verifyTls whether TLS certificates are verified
 */
public record RunConfig(
    String endpoint,
    @JsonIgnore String apiKey,
    String model,
    int concurrency,
    int durationSeconds,
    int maxContextTokens,
    int requestTimeoutSeconds,
    int maxRetries,
    boolean verifyTls) {

  public static final int MAX_CONCURRENCY = 1000;
  public static final int MAX_RETRIES_LIMIT = 10;

  public RunConfig {
    List<String> violations = new ArrayList<>();
    if (endpoint == null || endpoint.isBlank()) {
      violations.add("endpoint must be provided");
    } else if (!isHttpUrl(endpoint.trim())) {
      violations.add("endpoint must be an absolute http(s) URL");
    }
    if (model == null || model.isBlank()) {
      violations.add("model must be provided");
    }
    if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
      violations.add("concurrency must be between 1 and " + MAX_CONCURRENCY);
    }
    if (durationSeconds < 1) {
      violations.add("durationSeconds must be >= 1");
    }
    if (maxContextTokens < 1) {
      violations.add("maxContextTokens must be >= 1");
    }
    if (requestTimeoutSeconds < 1) {
      violations.add("requestTimeoutSeconds must be >= 1");
    }
    if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
      violations.add("maxRetries must be between 0 and " + MAX_RETRIES_LIMIT);
    }
    if (!violations.isEmpty()) {
      throw new RunConfigValidationException(violations);
    }
    endpoint = endpoint.trim();
    model = model.trim();
  }

  private static boolean isHttpUrl(String value) {
    try {
      var uri = new URI(value);
      var scheme = uri.getScheme();
      return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
          && uri.getHost() != null;
    } catch (URISyntaxException e) {
      return false;
    }
  }

  public Duration duration() {
    return Duration.ofSeconds(durationSeconds);
  }

  public boolean hasCredential() {
    return apiKey != null && !apiKey.isBlank();
  }

  @Override
  public String toString() {
    return "RunConfig[endpoint="
        + endpoint
        + ", apiKey="
        + (hasCredential() ? "****" : "none")
        + ", model="
        + model
        + ", concurrency="
        + concurrency
        + ", durationSeconds="
        + durationSeconds
        + ", maxContextTokens="
        + maxContextTokens
        + ", requestTimeoutSeconds="
        + requestTimeoutSeconds
        + ", maxRetries="
        + maxRetries
        + ", verifyTls="
        + verifyTls
        + "]";
  }
}
