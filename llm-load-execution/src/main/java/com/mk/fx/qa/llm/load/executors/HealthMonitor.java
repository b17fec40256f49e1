package com.mk.fx.qa.llm.load.executors;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.llm.load.client.ChatCompletion;
import com.mk.fx.qa.llm.load.client.ChatCompletionRequest;
import com.mk.fx.qa.llm.load.client.LlmHttpClient;
import com.mk.fx.qa.llm.load.client.LlmClientException;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.HealthSample;
import com.mk.fx.qa.llm.load.report.RunConsole;
import com.mk.fx.qa.llm.load.utils.LoadUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Probes the endpoint with a tiny completion on a fixed-rate schedule during the test window and
 * owns the run's endpoint-alive flag. Probes are never retried.
 *
 * <p>Schedule: probes fire at {@code start + delay + k * interval}, where {@code start} is the start
 * of the test window, for as long as that instant is not after the deadline. A slow probe delays
 * the next one but the schedule does not drift.
 */
@Slf4j
public class HealthMonitor {

  public static final String PROBE_PROMPT = "Reply with OK if you can read this.";
  public static final int PROBE_MAX_TOKENS = 10;
  public static final double PROBE_TEMPERATURE = 0.0;

  private final String runId;
  private final LlmHttpClient client;
  private final String model;
  private final ResultStore store;
  private final RunConsole console;
  private final Duration startupDelay;
  private final Duration interval;
  private final Duration probeTimeout;
  private final AtomicBoolean endpointAlive = new AtomicBoolean(true);

  public HealthMonitor(
      String runId,
      LlmHttpClient client,
      String model,
      ResultStore store,
      RunConsole console,
      LoadRunParameters parameters) {
    this.runId = runId;
    this.client = client;
    this.model = model;
    this.store = store;
    this.console = console;
    this.startupDelay = parameters.healthStartupDelay();
    this.interval = parameters.healthInterval();
    this.probeTimeout = parameters.probeTimeout();
  }

  public boolean isEndpointAlive() {
    return endpointAlive.get();
  }

  /**
   * Runs the monitoring loop until the deadline or a stop request.
   *
   * @return number of samples recorded
   */
  public int monitor(RunDeadline deadline, BooleanSupplier stopRequested) {
    var intervalNanos = interval.toNanos();
    var anchor = deadline.startNanos() + startupDelay.toNanos();
    var samples = 0;
    try {
      for (long k = 0; ; k++) {
        var fireAt = anchor + k * intervalNanos;
        // a slot falling exactly on the deadline still fires
        if (fireAt - deadline.deadlineNanos() > 0 || stopRequested.getAsBoolean()) {
          break;
        }
        LoadUtils.sleepWithCancellation(
            Duration.ofNanos(Math.max(0, fireAt - System.nanoTime())), stopRequested);
        var sample = check();
        store.append(sample);
        samples++;
        console.println(
            String.format(
                "[HEALTH CHECK %s] Endpoint is %s (Elapsed: %ds, Active requests: %d)",
                sample.healthy() ? "✓" : "✗",
                sample.healthy() ? "ALIVE" : "DOWN",
                deadline.elapsed().toSeconds(),
                store.inFlight()));
        if (!sample.healthy()) {
          console.println(
              "WARNING: Endpoint health check failed! Continuing test to gather failure data...");
        }
      }
    } catch (InterruptedException interrupted) {
      if (!stopRequested.getAsBoolean()) {
        Thread.currentThread().interrupt();
      }
      log.debug("Run {} health monitor stopped after {} samples", runId, samples);
    }
    log.info("Run {} health monitor finished with {} samples", runId, samples);
    return samples;
  }

  /** Sends one probe, updates the alive flag and returns the sample without recording it. */
  public HealthSample check() {
    var sample = probe();
    var wasAlive = endpointAlive.getAndSet(sample.healthy());
    if (wasAlive && !sample.healthy()) {
      log.warn("Run {} endpoint became unhealthy: {}", runId, sample.detail());
    } else if (!wasAlive && sample.healthy()) {
      log.info("Run {} endpoint recovered", runId);
    }
    return sample;
  }

  @VisibleForTesting
  HealthSample probe() {
    var request =
        ChatCompletionRequest.userPrompt(model, PROBE_PROMPT, PROBE_MAX_TOKENS, PROBE_TEMPERATURE);
    try {
      var response = client.send(request, probeTimeout);
      if (response.isSuccessful()) {
        var content = ChatCompletion.parse(response.getBody()).content();
        return new HealthSample(
            Instant.now(), true, response.getStatusCode(), bounded(content));
      }
      return new HealthSample(
          Instant.now(),
          false,
          response.getStatusCode(),
          bounded("HTTP " + response.getStatusCode() + ": " + response.getBody()));
    } catch (LlmClientException e) {
      return new HealthSample(Instant.now(), false, null, bounded(e.getMessage()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new HealthSample(Instant.now(), false, null, "Interrupted while probing");
    }
  }

  private static String bounded(String text) {
    return LoadUtils.truncate(text == null ? "" : text, HealthSample.MAX_DETAIL_CHARS);
  }
}
