package com.mk.fx.qa.llm.load.executors;

import com.mk.fx.qa.llm.load.executors.request.RequestExecutor;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import com.mk.fx.qa.llm.load.prompts.PromptProvider;
import com.mk.fx.qa.llm.load.prompts.WorkloadSelector;
import com.mk.fx.qa.llm.load.report.RunConsole;
import com.mk.fx.qa.llm.load.service.stratigies.ThinkTimeStrategy;
import com.mk.fx.qa.llm.load.utils.LoadUtils;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * One simulated user: waits a random jitter, then loops pick workload, build prompt, execute,
 * record, think, until the deadline passes or the run is stopped. A request already in flight is
 * allowed to finish and is recorded.
 */
@Slf4j
public class UserSession implements Runnable {

  private static final int RESPONSE_PREVIEW_CHARS = 80;

  private final String runId;
  private final int userId;
  private final int maxContextTokens;
  private final PromptProvider prompts;
  private final RequestExecutor executor;
  private final ResultStore store;
  private final RunConsole console;
  private final ThinkTimeStrategy initialJitter;
  private final ThinkTimeStrategy thinkTime;
  private final RunDeadline deadline;
  private final BooleanSupplier stopRequested;
  private int completedRequests;

  public UserSession(
      String runId,
      int userId,
      int maxContextTokens,
      PromptProvider prompts,
      RequestExecutor executor,
      ResultStore store,
      RunConsole console,
      ThinkTimeStrategy initialJitter,
      ThinkTimeStrategy thinkTime,
      RunDeadline deadline,
      BooleanSupplier stopRequested) {
    this.runId = runId;
    this.userId = userId;
    this.maxContextTokens = maxContextTokens;
    this.prompts = prompts;
    this.executor = executor;
    this.store = store;
    this.console = console;
    this.initialJitter = initialJitter;
    this.thinkTime = thinkTime;
    this.deadline = deadline;
    this.stopRequested = stopRequested;
  }

  @Override
  public void run() {
    log.debug("Run {} user {} started", runId, userId);
    try {
      initialJitter.pause(deadline, stopRequested);
      while (!shouldStop()) {
        runIteration(ThreadLocalRandom.current());
        thinkTime.pause(deadline, stopRequested);
      }
      log.debug("Run {} user {} finished after {} requests", runId, userId, completedRequests);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug(
          "Run {} user {} interrupted after {} requests", runId, userId, completedRequests);
    } catch (RuntimeException ex) {
      log.error(
          "Run {} user {} failed after {} requests: {} - stopping this user",
          runId,
          userId,
          completedRequests,
          ex.getMessage(),
          ex);
    }
  }

  /** Executes and records one request. */
  RequestOutcome runIteration(Random random) {
    var template = WorkloadSelector.pick(random);
    var target =
        WorkloadSelector.targetTokens(
            template, maxContextTokens, WorkloadSelector.nextVariation(random));
    var prompt = prompts.createPrompt(template, target);
    var outcome = executor.execute(userId, prompt, template.workloadType(), target);
    store.append(outcome);
    completedRequests++;
    console.println(progressLine(outcome));
    return outcome;
  }

  private boolean shouldStop() {
    return deadline.isExpired()
        || stopRequested.getAsBoolean()
        || Thread.currentThread().isInterrupted();
  }

  int completedRequests() {
    return completedRequests;
  }

  /**
   * {@code [User 003] MCP_file_search | Context: 1K tokens | Status: success | Time: 1.23s |
   * Response: ...}
   */
  static String progressLine(RequestOutcome outcome) {
    var line = new StringBuilder();
    line.append(String.format("[User %03d] %s", outcome.userId(), outcome.workloadType()));
    line.append(String.format(" | Context: %dK tokens", outcome.contextLength() / 1000));
    line.append(" | Status: ").append(outcome.status());
    if (outcome.wasRetried()) {
      line.append(" (retry ").append(outcome.retryCount()).append(')');
    }
    line.append(String.format(Locale.ROOT, " | Time: %.2fs", outcome.elapsedSeconds()));
    if (outcome.isSuccess()) {
      var preview =
          LoadUtils.singleLine(
              LoadUtils.truncate(outcome.responseContent(), RESPONSE_PREVIEW_CHARS));
      line.append(" | Response: ").append(preview).append("...");
    } else if (outcome.error() != null) {
      line.append(" | Error: ")
          .append(LoadUtils.singleLine(LoadUtils.truncate(outcome.error(), RESPONSE_PREVIEW_CHARS)));
    }
    return line.toString();
  }
}
