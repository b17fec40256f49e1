package com.mk.fx.qa.llm.load.service;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.exceptions.RunRejectedException;
import com.mk.fx.qa.llm.load.exceptions.RunSetupException;
import com.mk.fx.qa.llm.load.model.RunConfig;
import com.mk.fx.qa.llm.load.model.RunRecord;
import com.mk.fx.qa.llm.load.model.RunStatus;
import com.mk.fx.qa.llm.load.processors.LoadRunProcessor;
import com.mk.fx.qa.llm.load.service.LoadRunService.StopResult.StopState;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadRunServiceTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private LoadRunProcessor processor;
  private LoadRunService service;
  private final CountDownLatch release = new CountDownLatch(1);

  private static RunConfig config() {
    return new RunConfig("http://localhost:4000", "", "model", 2, 10, 1000, 5, 1, false);
  }

  private static LoadRunCfg cfg(int maxConcurrentRuns) {
    var cfg = new LoadRunCfg();
    cfg.setMaxConcurrentRuns(maxConcurrentRuns);
    cfg.setConsoleBufferLines(100);
    return cfg;
  }

  @BeforeEach
  void setUp() {
    processor = mock(LoadRunProcessor.class);
    service = new LoadRunService(cfg(1), processor);
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    service.shutdown();
  }

  /** Processor that blocks until released or stopped. */
  private void blockingProcessor() throws Exception {
    doAnswer(
            inv -> {
              RunRecord record = inv.getArgument(0);
              while (!record.isStopRequested() && !release.await(10, TimeUnit.MILLISECONDS)) {
                // waiting for the test to release or stop the run
              }
              return null;
            })
        .when(processor)
        .execute(any());
  }

  private RunStatus awaitTerminal(UUID runId) {
    await()
        .atMost(TIMEOUT)
        .until(() -> service.getRunStatus(runId).orElseThrow().status().isTerminal());
    await().atMost(TIMEOUT).until(() -> service.getActiveRunCount() == 0);
    return service.getRunStatus(runId).orElseThrow().status();
  }

  @Test
  void start_runsToCompletion() throws Exception {
    blockingProcessor();

    var record = service.start(config());
    assertEquals(RunStatus.RUNNING, record.getStatus());
    assertEquals(1, service.getActiveRunCount());
    assertTrue(service.getReport(record.getRunId()).isEmpty());

    release.countDown();

    assertEquals(RunStatus.COMPLETED, awaitTerminal(record.getRunId()));
    var status = service.getRunStatus(record.getRunId()).orElseThrow();
    assertNotNull(status.startedAt());
    assertNotNull(status.completedAt());
    assertEquals(2, status.concurrency());
  }

  @Test
  void start_rejectedWhileRunInProgress() throws Exception {
    blockingProcessor();
    var first = service.start(config());

    var ex = assertThrows(RunRejectedException.class, () -> service.start(config()));
    assertTrue(ex.getMessage().contains("already in progress"));
    assertEquals(1, service.getAllRuns().size());

    release.countDown();
    awaitTerminal(first.getRunId());

    var second = service.start(config());
    assertNotNull(second.getRunId());
  }

  @Test
  void stop_requestsStopAndRunEndsStopped() throws Exception {
    blockingProcessor();
    var record = service.start(config());

    var result = service.stop(record.getRunId());
    assertEquals(StopState.STOP_REQUESTED, result.getState());

    assertEquals(RunStatus.STOPPED, awaitTerminal(record.getRunId()));

    var again = service.stop(record.getRunId());
    assertEquals(StopState.ALREADY_FINISHED, again.getState());
    assertEquals(RunStatus.STOPPED, again.getRunStatus());
  }

  @Test
  void stop_unknownRun() {
    assertEquals(StopState.NOT_FOUND, service.stop(UUID.randomUUID()).getState());
    assertTrue(service.getRunStatus(UUID.randomUUID()).isEmpty());
    assertTrue(service.getOutput(UUID.randomUUID(), 0).isEmpty());
    assertTrue(service.getReport(UUID.randomUUID()).isEmpty());
  }

  @Test
  void start_setupFailureIsThrownBeforeRegistering() throws Exception {
    doThrow(new RunSetupException("Results directory is not writable: /nope", null))
        .when(processor)
        .prepare();

    var ex = assertThrows(RunSetupException.class, () -> service.start(config()));

    assertEquals("Results directory is not writable: /nope", ex.getMessage());
    assertTrue(service.getAllRuns().isEmpty());
    assertEquals(0, service.getActiveRunCount());
    verify(processor, never()).execute(any());
  }

  @Test
  void failedRun_isMarkedFailedWithMessage() throws Exception {
    doThrow(new RunSetupException("Results directory is not writable: /nope", null))
        .when(processor)
        .execute(any());

    var record = service.start(config());

    assertEquals(RunStatus.FAILED, awaitTerminal(record.getRunId()));
    var status = service.getRunStatus(record.getRunId()).orElseThrow();
    assertEquals("Results directory is not writable: /nope", status.errorMessage());
    var output = service.getOutput(record.getRunId(), 0).orElseThrow();
    assertTrue(output.lines().contains("Run failed: Results directory is not writable: /nope"));
  }

  @Test
  void getOutput_returnsConsoleChunk() throws Exception {
    doAnswer(
            inv -> {
              RunRecord record = inv.getArgument(0);
              record.getConsole().println("first");
              record.getConsole().println("second");
              return null;
            })
        .when(processor)
        .execute(any());

    var record = service.start(config());
    awaitTerminal(record.getRunId());

    var output = service.getOutput(record.getRunId(), 1).orElseThrow();
    assertEquals(1, output.from());
    assertEquals(2, output.nextOffset());
    assertEquals("second", output.lines().get(0));
  }

  @Test
  void getAllRuns_newestFirst() throws Exception {
    service.shutdown();
    service = new LoadRunService(cfg(2), processor);
    blockingProcessor();

    var older = service.start(config());
    TimeUnit.MILLISECONDS.sleep(5);
    var newer = service.start(config());

    var runs = service.getAllRuns();
    assertEquals(2, runs.size());
    assertEquals(newer.getRunId(), runs.get(0).runId());
    assertEquals(older.getRunId(), runs.get(1).runId());
  }

  @Test
  void shutdown_stopsRunsAndRejectsNewOnes() throws Exception {
    blockingProcessor();
    var record = service.start(config());

    service.shutdown();

    assertEquals(RunStatus.STOPPED, awaitTerminal(record.getRunId()));
    assertThrows(RunRejectedException.class, () -> service.start(config()));
    assertFalse(service.getRunStatus(record.getRunId()).isEmpty());
  }
}
