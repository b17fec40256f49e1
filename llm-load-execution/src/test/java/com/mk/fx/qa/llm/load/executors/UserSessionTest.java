package com.mk.fx.qa.llm.load.executors;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.llm.load.client.LlmHttpClient;
import com.mk.fx.qa.llm.load.executors.request.RequestExecutor;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.OutcomeStatus;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import com.mk.fx.qa.llm.load.model.RunConfig;
import com.mk.fx.qa.llm.load.prompts.PaddingPromptProvider;
import com.mk.fx.qa.llm.load.prompts.PromptTemplate;
import com.mk.fx.qa.llm.load.report.RunConsole;
import com.mk.fx.qa.llm.load.service.stratigies.ThinkTimeStrategy;
import com.mk.fx.qa.llm.load.support.FakeLlmEndpoint;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UserSessionTest {

  private static final int MAX_CONTEXT = 1000;

  private FakeLlmEndpoint endpoint;
  private LlmHttpClient client;
  private ResultStore store;
  private RunConsole console;

  @BeforeEach
  void setUp() throws Exception {
    endpoint = FakeLlmEndpoint.start();
    client = new LlmHttpClient(endpoint.baseUrl(), "", 5, false);
    store = new ResultStore();
    console = new RunConsole("test", 1000);
  }

  @AfterEach
  void tearDown() {
    client.close();
    endpoint.close();
  }

  private UserSession session(
      ThinkTimeStrategy jitter, RunDeadline deadline, BooleanSupplier stopRequested) {
    var config =
        new RunConfig(endpoint.baseUrl(), "", "test-model", 1, 1, MAX_CONTEXT, 5, 0, false);
    var executor =
        new RequestExecutor(
            "test", client, config, LoadRunParameters.defaults(), store, console, () -> false);
    return new UserSession(
        "test",
        3,
        MAX_CONTEXT,
        new PaddingPromptProvider(),
        executor,
        store,
        console,
        jitter,
        ThinkTimeStrategy.none(),
        deadline,
        stopRequested);
  }

  @Test
  void run_loopsUntilDeadline() {
    var deadline = RunDeadline.startingNow(Duration.ofMillis(500));
    var session = session(ThinkTimeStrategy.none(), deadline, () -> false);

    session.run();

    assertThat(deadline.isExpired()).isTrue();
    assertThat(session.completedRequests()).isPositive();
    assertThat(store.outcomeCount()).isEqualTo(session.completedRequests());
    assertThat(endpoint.requestCount()).isEqualTo(session.completedRequests());
    assertThat(store.outcomes()).allMatch(RequestOutcome::isSuccess);
    assertThat(store.inFlight()).isZero();
  }

  @Test
  void run_sendsNothingWhenStoppedBeforeStart() {
    var session =
        session(
            ThinkTimeStrategy.none(), RunDeadline.startingNow(Duration.ofSeconds(5)), () -> true);

    session.run();

    assertThat(session.completedRequests()).isZero();
    assertThat(endpoint.requestCount()).isZero();
  }

  @Test
  void run_stopDuringJitterEndsSession() {
    var jitter = ThinkTimeStrategy.uniform(Duration.ofSeconds(3), Duration.ofSeconds(3));
    var stop = new AtomicBoolean();
    var session = session(jitter, RunDeadline.startingNow(Duration.ofSeconds(10)), stop::get);

    var worker = new Thread(session);
    worker.start();
    stop.set(true);

    var start = System.nanoTime();
    assertThat(join(worker)).isTrue();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    assertThat(endpoint.requestCount()).isZero();
  }

  @Test
  void runIteration_recordsOutcomeWithinContextBounds() {
    var session =
        session(
            ThinkTimeStrategy.none(), RunDeadline.startingNow(Duration.ofSeconds(5)), () -> false);
    var random = new Random(42);
    Set<String> knownTypes =
        Arrays.stream(PromptTemplate.values())
            .map(PromptTemplate::workloadType)
            .collect(Collectors.toSet());

    for (int i = 0; i < 10; i++) {
      var outcome = session.runIteration(random);
      assertThat(outcome.userId()).isEqualTo(3);
      assertThat(knownTypes).contains(outcome.workloadType());
      assertThat(outcome.contextLength()).isBetween(209, 800);
    }

    assertThat(store.outcomeCount()).isEqualTo(10);
    assertThat(console.linesFrom(0).lines()).allMatch(line -> line.startsWith("[User 003] "));
  }

  @Test
  void progressLine_success() {
    var outcome =
        new RequestOutcome(
            3,
            "MCP_file_search",
            1800,
            OutcomeStatus.SUCCESS,
            1234,
            450,
            12,
            "line one\nline two",
            null,
            Instant.now(),
            0);

    assertThat(UserSession.progressLine(outcome))
        .isEqualTo(
            "[User 003] MCP_file_search | Context: 1K tokens | Status: success | Time: 1.23s"
                + " | Response: line one line two...");
  }

  @Test
  void progressLine_failureAfterRetries() {
    var outcome =
        new RequestOutcome(
            12,
            "Agentic_planning_task",
            42000,
            OutcomeStatus.TIMEOUT_EXHAUSTED,
            60000,
            10000,
            0,
            null,
            "Request timeout",
            Instant.now(),
            2);

    assertThat(UserSession.progressLine(outcome))
        .isEqualTo(
            "[User 012] Agentic_planning_task | Context: 42K tokens | Status: timeout_exhausted"
                + " (retry 2) | Time: 60.00s | Error: Request timeout");
  }

  private static boolean join(Thread thread) {
    try {
      thread.join(5_000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return !thread.isAlive();
  }
}
