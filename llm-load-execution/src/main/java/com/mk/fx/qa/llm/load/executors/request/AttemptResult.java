package com.mk.fx.qa.llm.load.executors.request;

import com.mk.fx.qa.llm.load.client.ChatCompletion;
import com.mk.fx.qa.llm.load.client.ChatResponseData;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import com.mk.fx.qa.llm.load.utils.LoadUtils;

/**
 * Result of one attempt, before the retry decision.
 *
 * @param kind classification driving retry and backoff
 * @param httpStatus response status, null when no response arrived
 * @param elapsedMs duration of this attempt
 * @param completion parsed body on success, {@link ChatCompletion#EMPTY} otherwise
 * @param error bounded error message, null on success
 */
public record AttemptResult(
    AttemptKind kind, Integer httpStatus, long elapsedMs, ChatCompletion completion, String error) {

  static final String TIMEOUT_MESSAGE = "Request timeout";

  /**
   * Classifies a response. A 4xx is terminal only on the first attempt; after a retry it continues
   * the chain like a server error.
   */
  public static AttemptResult fromResponse(
      ChatResponseData response, long elapsedMs, boolean firstAttempt) {
    var status = response.getStatusCode();
    if (response.isSuccessful()) {
      return new AttemptResult(
          AttemptKind.SUCCESS, status, elapsedMs, ChatCompletion.parse(response.getBody()), null);
    }
    var kind =
        response.isClientError() && firstAttempt
            ? AttemptKind.CLIENT_ERROR
            : AttemptKind.SERVER_ERROR;
    return new AttemptResult(
        kind, status, elapsedMs, ChatCompletion.EMPTY, httpError(status, response.getBody()));
  }

  public static AttemptResult timeout(long elapsedMs) {
    return new AttemptResult(
        AttemptKind.TIMEOUT, null, elapsedMs, ChatCompletion.EMPTY, TIMEOUT_MESSAGE);
  }

  public static AttemptResult transportError(long elapsedMs, String message) {
    return new AttemptResult(
        AttemptKind.TRANSPORT_ERROR,
        null,
        elapsedMs,
        ChatCompletion.EMPTY,
        LoadUtils.truncate(
            message == null ? "Unknown transport error" : message, RequestOutcome.MAX_ERROR_CHARS));
  }

  static String httpError(int status, String body) {
    var excerpt = LoadUtils.truncate(body == null ? "" : body, RequestOutcome.MAX_ERROR_CHARS);
    return "HTTP " + status + ": " + excerpt;
  }
}
