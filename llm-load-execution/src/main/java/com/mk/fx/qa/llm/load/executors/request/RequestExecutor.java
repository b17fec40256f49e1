package com.mk.fx.qa.llm.load.executors.request;

import com.mk.fx.qa.llm.load.client.ChatCompletionRequest;
import com.mk.fx.qa.llm.load.client.LlmHttpClient;
import com.mk.fx.qa.llm.load.client.LlmTimeoutException;
import com.mk.fx.qa.llm.load.client.LlmTransportException;
import com.mk.fx.qa.llm.load.executors.LoadRunParameters;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import com.mk.fx.qa.llm.load.model.RunConfig;
import com.mk.fx.qa.llm.load.prompts.TokenEstimator;
import com.mk.fx.qa.llm.load.report.RunConsole;
import com.mk.fx.qa.llm.load.utils.LoadUtils;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one logical request into exactly one {@link RequestOutcome}.
 *
 * <p>Attempts never throw. Each attempt is classified into an {@link AttemptResult} and a
 * resilience4j {@link Retry} decides on the result alone whether to try again: server errors,
 * timeouts and transport errors are retried up to {@code maxRetries} times, a 4xx on the first
 * attempt is final. Backoff is computed by {@link BackoffIntervalFunction} and waited out before the
 * next attempt in slices, so a stop request ends the chain with the last result instead of sleeping
 * through the remaining backoff.
 *
 * <p>The shared {@link ResultStore} in-flight gauge is raised for the whole retry chain, including
 * backoff waits, and always lowered again.
 */
@Slf4j
public class RequestExecutor {

  public static final int WORKLOAD_MAX_TOKENS = 500;
  public static final double WORKLOAD_TEMPERATURE = 0.7;

  private final LlmHttpClient client;
  private final String model;
  private final int maxRetries;
  private final ResultStore store;
  private final RunConsole console;
  private final BackoffIntervalFunction backoff;
  private final BooleanSupplier stopRequested;
  private final Retry retry;

  public RequestExecutor(
      String runId,
      LlmHttpClient client,
      RunConfig config,
      LoadRunParameters parameters,
      ResultStore store,
      RunConsole console,
      BooleanSupplier stopRequested) {
    this.client = client;
    this.model = config.model();
    this.maxRetries = config.maxRetries();
    this.store = store;
    this.console = console;
    this.backoff =
        new BackoffIntervalFunction(parameters.backoffUnit(), parameters.fixedBackoff());
    this.stopRequested = stopRequested;
    this.retry =
        Retry.of(
            "llm-run-" + runId,
            RetryConfig.<AttemptResult>custom()
                .maxAttempts(maxRetries + 1)
                .retryOnResult(this::shouldRetry)
                .retryOnException(throwable -> false)
                // backoff is awaited in nextAttempt
                .intervalBiFunction((attempt, either) -> 0L)
                .failAfterMaxAttempts(false)
                .build());
  }

  /**
   * Sends the prompt until it succeeds, fails terminally or runs out of retries.
   *
   * @param userId issuing user, used in console lines
   * @param prompt prompt text
   * @param workloadType workload tag recorded on the outcome
   * @param contextLength target size the prompt was built for
   * @return the outcome; never null
   */
  public RequestOutcome execute(int userId, String prompt, String workloadType, int contextLength) {
    store.requestStarted();
    try {
      var request =
          ChatCompletionRequest.userPrompt(
              model, prompt, WORKLOAD_MAX_TOKENS, WORKLOAD_TEMPERATURE);
      var attempts = new AtomicInteger();
      var previous = new AtomicReference<AttemptResult>();
      AttemptResult last =
          retry.executeSupplier(() -> nextAttempt(userId, request, attempts, previous));
      return toOutcome(userId, workloadType, contextLength, prompt, last, attempts.get() - 1);
    } finally {
      store.requestFinished();
    }
  }

  private AttemptResult nextAttempt(
      int userId,
      ChatCompletionRequest request,
      AtomicInteger attempts,
      AtomicReference<AttemptResult> previous) {
    var last = previous.get();
    if (last != null && !awaitBackoff(attempts.get(), last)) {
      return last;
    }
    var result = attempt(userId, request, attempts.incrementAndGet());
    previous.set(result);
    return result;
  }

  /** Returns false when the wait was cut short by a stop request or an interrupt. */
  private boolean awaitBackoff(int failedAttempt, AttemptResult failed) {
    var delay = Duration.ofMillis(backoff.apply(failedAttempt, Either.right(failed)));
    try {
      LoadUtils.sleepWithCancellation(delay, stopRequested);
      return true;
    } catch (InterruptedException e) {
      if (!stopRequested.getAsBoolean()) {
        Thread.currentThread().interrupt();
      }
      return false;
    }
  }

  private AttemptResult attempt(int userId, ChatCompletionRequest request, int attemptNumber) {
    var start = System.nanoTime();
    AttemptResult result;
    try {
      var response = client.send(request);
      result = AttemptResult.fromResponse(response, elapsedMs(start), attemptNumber == 1);
    } catch (LlmTimeoutException e) {
      result = AttemptResult.timeout(elapsedMs(start));
    } catch (LlmTransportException e) {
      result = AttemptResult.transportError(elapsedMs(start), e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = AttemptResult.transportError(elapsedMs(start), "Interrupted while awaiting response");
    } catch (RuntimeException e) {
      log.warn("User {} attempt {} failed unexpectedly: {}", userId, attemptNumber, e.toString());
      result = AttemptResult.transportError(elapsedMs(start), e.toString());
    }

    if (result.kind().isRetryable()
        && attemptNumber <= maxRetries
        && !stopRequested.getAsBoolean()) {
      console.println(
          String.format(
              "  [Retry %d/%d] User %03d: %s",
              attemptNumber, maxRetries, userId, LoadUtils.singleLine(result.error())));
    }
    return result;
  }

  private boolean shouldRetry(AttemptResult result) {
    return result.kind().isRetryable()
        && !stopRequested.getAsBoolean()
        && !Thread.currentThread().isInterrupted();
  }

  private static RequestOutcome toOutcome(
      int userId,
      String workloadType,
      int contextLength,
      String prompt,
      AttemptResult last,
      int retryCount) {
    var success = last.kind() == AttemptKind.SUCCESS;
    return new RequestOutcome(
        userId,
        workloadType,
        contextLength,
        last.kind().terminalStatus(),
        last.elapsedMs(),
        TokenEstimator.estimate(prompt),
        success ? last.completion().completionTokens() : 0,
        success
            ? LoadUtils.truncate(last.completion().content(), RequestOutcome.MAX_RESPONSE_CHARS)
            : null,
        success ? null : last.error(),
        Instant.now(),
        retryCount);
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
