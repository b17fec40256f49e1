package com.mk.fx.qa.llm.load.model;

import java.time.Instant;

/**
 * The single immutable record produced for one logical request, however many attempts it took.
 *
 * @param userId simulated user that issued the request
 * @param workloadType workload tag, e.g. {@code MCP_file_search}
 * @param contextLength target context size in tokens
 * @param status terminal status
 * @param elapsedMs duration of the final attempt only
 * @param tokensSent estimated prompt tokens
 * @param tokensReceived completion tokens reported by the server, 0 on failure
 * @param responseContent response excerpt, null on failure
 * @param error bounded error message, null on success
 * @param timestamp completion time
 * @param retryCount retries used, never more than the configured maximum
 */
public record RequestOutcome(
    int userId,
    String workloadType,
    int contextLength,
    OutcomeStatus status,
    long elapsedMs,
    int tokensSent,
    int tokensReceived,
    String responseContent,
    String error,
    Instant timestamp,
    int retryCount) {

  public static final int MAX_RESPONSE_CHARS = 1000;
  public static final int MAX_ERROR_CHARS = 200;

  public boolean isSuccess() {
    return status.isSuccess();
  }

  public boolean wasRetried() {
    return retryCount > 0;
  }

  public double elapsedSeconds() {
    return elapsedMs / 1000.0;
  }
}
