package com.mk.fx.qa.llm.load.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.llm.load.client.LlmHttpClient;
import com.mk.fx.qa.llm.load.exceptions.RunSetupException;
import com.mk.fx.qa.llm.load.executors.request.RequestExecutor;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.RunConfig;
import com.mk.fx.qa.llm.load.prompts.PromptProvider;
import com.mk.fx.qa.llm.load.report.RunConsole;
import com.mk.fx.qa.llm.load.service.stratigies.ThinkTimeStrategy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one load run: a closed model of {@code concurrency} users issuing requests back to
 * back, with think time, for a fixed duration, plus a health monitor.
 *
 * <p>Threading: one fixed pool of {@code concurrency + 1} daemon threads per run, one per user
 * session and one for the monitor. All tasks share a single HTTP client. The call returns once
 * every task has finished; a stop request is honoured cooperatively and in-flight requests are
 * allowed to complete.
 */
@Slf4j
public final class LoadRunner {

  private final String runId;
  private final RunConfig config;
  private final LoadRunParameters parameters;
  private final PromptProvider prompts;
  private final ResultStore store;
  private final RunConsole console;

  private volatile HealthMonitor monitor;
  private volatile Instant startedAt;
  private volatile boolean initialHealthy = true;

  public LoadRunner(
      String runId,
      RunConfig config,
      LoadRunParameters parameters,
      PromptProvider prompts,
      ResultStore store,
      RunConsole console) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.config = Objects.requireNonNull(config, "config");
    this.parameters = Objects.requireNonNull(parameters, "parameters");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.store = Objects.requireNonNull(store, "store");
    this.console = Objects.requireNonNull(console, "console");
  }

  /**
   * Runs the test window to completion.
   *
   * @param stopRequested supplier checked for cooperative stop
   * @return how the run ended
   * @throws RunSetupException if the HTTP client cannot be created
   * @throws InterruptedException if the calling thread is interrupted while waiting for users
   */
  public LoadRunResult run(BooleanSupplier stopRequested) throws InterruptedException {
    Objects.requireNonNull(stopRequested, "stopRequested");
    printBanner();

    try (var client = createClient()) {
      var healthMonitor =
          new HealthMonitor(runId, client, config.model(), store, console, parameters);
      this.monitor = healthMonitor;

      console.println("Performing initial health check...");
      var initial = healthMonitor.check();
      initialHealthy = initial.healthy();
      if (initial.healthy()) {
        console.println("✓ Endpoint is healthy");
      } else {
        console.println("✗ Endpoint health check failed: " + initial.detail());
        console.println("Continuing with load test anyway...");
      }
      console.println("");

      var deadline = RunDeadline.startingNow(config.duration());
      startedAt = deadline.startedAt();
      log.info(
          "Run {} starting {} users for {}s against {}",
          runId,
          config.concurrency(),
          config.durationSeconds(),
          config.endpoint());

      var completedUsers = executeSessions(client, healthMonitor, deadline, stopRequested);
      var stopped = stopRequested.getAsBoolean();
      log.info(
          "Run {} finished ({}), {} of {} users completed, {} outcomes",
          runId,
          stopped ? "stopped" : "deadline reached",
          completedUsers,
          config.concurrency(),
          store.outcomeCount());
      return new LoadRunResult(
          startedAt,
          Instant.now(),
          config.concurrency(),
          completedUsers,
          stopped,
          initialHealthy,
          healthMonitor.isEndpointAlive());
    }
  }

  private int executeSessions(
      LlmHttpClient client,
      HealthMonitor healthMonitor,
      RunDeadline deadline,
      BooleanSupplier stopRequested)
      throws InterruptedException {
    var threadIndex = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          var index = threadIndex.getAndIncrement();
          // the monitor is submitted first
          thread.setName(
              "llm-load-" + runId + (index == 0 ? "-health" : "-user-" + (index - 1)));
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(config.concurrency() + 1, threadFactory);
    List<Future<?>> futures = new ArrayList<>();
    var requestExecutor =
        new RequestExecutor(runId, client, config, parameters, store, console, stopRequested);
    var jitter = ThinkTimeStrategy.upTo(parameters.initialJitterMax());
    var thinkTime = ThinkTimeStrategy.uniform(parameters.thinkTimeMin(), parameters.thinkTimeMax());

    try {
      futures.add(executor.submit(() -> healthMonitor.monitor(deadline, stopRequested)));
      for (int userId = 0; userId < config.concurrency(); userId++) {
        futures.add(
            executor.submit(
                new UserSession(
                    runId,
                    userId,
                    config.maxContextTokens(),
                    prompts,
                    requestExecutor,
                    store,
                    console,
                    jitter,
                    thinkTime,
                    deadline,
                    stopRequested)));
      }
      return waitForUsers(futures);
    } finally {
      executor.shutdownNow();
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Run {} worker threads did not terminate within 30s", runId);
      }
    }
  }

  /** Waits for every task; returns how many user sessions ended normally. */
  private int waitForUsers(List<Future<?>> futures) throws InterruptedException {
    var completed = 0;
    for (int i = 0; i < futures.size(); i++) {
      try {
        futures.get(i).get();
        if (i > 0) {
          completed++;
        }
      } catch (ExecutionException ex) {
        log.error("Run {} task failed: {}", runId, ex.getCause().getMessage(), ex.getCause());
      } catch (CancellationException ignored) {
        log.debug("Run {} future cancelled", runId);
      }
    }
    return completed;
  }

  private LlmHttpClient createClient() {
    try {
      return new LlmHttpClient(
          config.endpoint(),
          config.apiKey(),
          config.requestTimeoutSeconds(),
          config.verifyTls());
    } catch (RuntimeException ex) {
      throw new RunSetupException("Unable to create HTTP client: " + ex.getMessage(), ex);
    }
  }

  private void printBanner() {
    console.println("Starting load test against " + config.endpoint());
    console.println("Model: " + config.model());
    console.println("Concurrent users: " + config.concurrency());
    console.println("Test duration: " + config.durationSeconds() + "s");
    console.println("Max context: " + config.maxContextTokens() + " tokens");
    console.println("Request timeout: " + config.requestTimeoutSeconds() + "s");
    console.println("Max retries: " + config.maxRetries());
    console.println("TLS verification: " + (config.verifyTls() ? "enabled" : "disabled"));
    console.println("");
  }

  /** Start of the test window, null until the initial health check has finished. */
  public Instant startedAt() {
    return startedAt;
  }

  public boolean isInitialHealthy() {
    return initialHealthy;
  }

  /** Current liveness as last observed by the health monitor. */
  public boolean isEndpointAlive() {
    var current = monitor;
    return current == null || current.isEndpointAlive();
  }
}
