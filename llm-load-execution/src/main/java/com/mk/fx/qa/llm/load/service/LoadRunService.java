package com.mk.fx.qa.llm.load.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunOutputResponse;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.llm.load.exceptions.RunRejectedException;
import com.mk.fx.qa.llm.load.exceptions.RunSetupException;
import com.mk.fx.qa.llm.load.metrics.AggregateReport;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.RunConfig;
import com.mk.fx.qa.llm.load.model.RunRecord;
import com.mk.fx.qa.llm.load.model.RunStatus;
import com.mk.fx.qa.llm.load.processors.LoadRunProcessor;
import com.mk.fx.qa.llm.load.report.RunConsole;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Starts, tracks and stops load runs.
 *
 * <p>Each accepted run executes on its own worker thread; at most {@code maxConcurrentRuns} run
 * at once and further submissions are rejected rather than queued. Stopping is cooperative: the
 * run's stop flag is raised, sessions end at their next sleep or iteration boundary and the
 * report is still produced.
 *
 * <p>Thread-safety: run records live in a {@link ConcurrentHashMap}; counters are atomics. Read
 * methods return snapshots without external synchronization.
 */
@Slf4j
@Service
public class LoadRunService {

  private final LoadRunCfg properties;
  private final LoadRunProcessor processor;
  private final ThreadPoolExecutor executor;
  private final Map<UUID, RunRecord> runRecords;
  private final AtomicBoolean acceptingRuns;
  private final AtomicInteger activeRunCount;

  public LoadRunService(LoadRunCfg properties, LoadRunProcessor processor) {
    this.properties = properties;
    this.processor = processor;
    this.executor = createExecutor(properties.getMaxConcurrentRuns());
    this.runRecords = new ConcurrentHashMap<>();
    this.acceptingRuns = new AtomicBoolean(true);
    this.activeRunCount = new AtomicInteger();
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "LoadRunService initialised with maxConcurrentRuns={} resultsDir={}",
        properties.getMaxConcurrentRuns(),
        properties.getResultsDir());
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("llm-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Run executor is shut down");
        });
    return pool;
  }

  /**
   * Accepts a validated configuration and starts the run asynchronously.
   *
   * @return the record of the new run, status RUNNING
   * @throws RunRejectedException when the service is shutting down or the run limit is reached
   * @throws RunSetupException when the results directory cannot be used; nothing is registered
   */
  public RunRecord start(RunConfig config) {
    Objects.requireNonNull(config, "Run config must not be null");
    if (!acceptingRuns.get()) {
      throw new RunRejectedException("Service not accepting new runs");
    }
    var limit = properties.getMaxConcurrentRuns();
    if (activeRunCount.incrementAndGet() > limit) {
      activeRunCount.decrementAndGet();
      throw new RunRejectedException(
          "A load run is already in progress (limit " + limit + " concurrent run(s))");
    }
    try {
      processor.prepare();
    } catch (RunSetupException ex) {
      activeRunCount.decrementAndGet();
      log.warn("Run rejected, setup failed: {}", ex.getMessage());
      throw ex;
    }

    var runId = UUID.randomUUID();
    var record =
        new RunRecord(
            runId,
            config,
            new ResultStore(),
            new RunConsole(runId.toString(), properties.getConsoleBufferLines()),
            Instant.now());
    runRecords.put(runId, record);

    try {
      executor.submit(() -> executeRun(record));
    } catch (RejectedExecutionException ex) {
      activeRunCount.decrementAndGet();
      runRecords.remove(runId);
      log.warn("Run {} rejected: {}", runId, ex.getMessage());
      throw new RunRejectedException(ex.getMessage());
    }
    log.info("Run {} submitted: {}", runId, config);
    return record;
  }

  private void executeRun(RunRecord record) {
    var runId = record.getRunId();
    try {
      record.markStarted(Instant.now());
      log.info("Run {} started", runId);
      processor.execute(record);
      record.markFinished(Instant.now());
      log.info("Run {} {}", runId, record.getStatus().name().toLowerCase());
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      record.requestStop();
      record.markFinished(Instant.now());
      log.info("Run {} interrupted", runId);
    } catch (Exception ex) {
      record.markFailed(Instant.now(), ex.getMessage());
      record.getConsole().println("Run failed: " + ex.getMessage());
      log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      activeRunCount.decrementAndGet();
    }
  }

  /**
   * Requests a cooperative stop.
   *
   * @param runId id of the run to stop
   * @return whether the stop was requested, or why not
   */
  public StopResult stop(UUID runId) {
    var record = runRecords.get(runId);
    if (record == null) {
      return StopResult.notFound();
    }
    if (!record.requestStop()) {
      return StopResult.alreadyFinished(record.getStatus());
    }
    log.info("Run {} stop requested", runId);
    return StopResult.stopRequested(record.getStatus());
  }

  public Optional<RunStatusResponse> getRunStatus(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId)).map(this::toStatusResponse);
  }

  /** All known runs, most recently submitted first. */
  public List<RunStatusResponse> getAllRuns() {
    return runRecords.values().stream()
        .sorted(Comparator.comparing(RunRecord::getSubmittedAt).reversed())
        .map(this::toStatusResponse)
        .collect(Collectors.toList());
  }

  public Optional<RunOutputResponse> getOutput(UUID runId, long from) {
    return Optional.ofNullable(runRecords.get(runId))
        .map(
            record -> {
              var chunk = record.getConsole().linesFrom(from);
              return new RunOutputResponse(runId, chunk.from(), chunk.nextOffset(), chunk.lines());
            });
  }

  /** The final report; empty while the run is in progress or when the run is unknown. */
  public Optional<AggregateReport> getReport(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId))
        .filter(record -> record.getStatus().isTerminal())
        .flatMap(RunRecord::getReport);
  }

  public int getActiveRunCount() {
    return activeRunCount.get();
  }

  /**
   * Initiates a graceful shutdown: stops accepting runs, asks running ones to stop and shuts the
   * executor down. Reports of stopped runs are still written.
   */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      runRecords.values().forEach(RunRecord::requestStop);
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  private RunStatusResponse toStatusResponse(RunRecord record) {
    var config = record.getConfig();
    var store = record.getStore();
    return new RunStatusResponse(
        record.getRunId(),
        record.getStatus(),
        config.endpoint(),
        config.model(),
        config.concurrency(),
        config.durationSeconds(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getElapsed().toSeconds(),
        store.outcomeCount(),
        store.inFlight(),
        store.healthSampleCount(),
        record.isEndpointAlive(),
        record.getResultsFile().map(path -> path.toAbsolutePath().toString()).orElse(null),
        record.getErrorMessage().orElse(null));
  }

  /** Describes the outcome of a stop request. */
  @Getter
  public static class StopResult {
    public enum StopState {
      STOP_REQUESTED,
      NOT_FOUND,
      ALREADY_FINISHED
    }

    private final StopState state;
    private final RunStatus runStatus;

    private StopResult(StopState state, RunStatus runStatus) {
      this.state = state;
      this.runStatus = runStatus;
    }

    public static StopResult stopRequested(RunStatus status) {
      return new StopResult(StopState.STOP_REQUESTED, status);
    }

    public static StopResult notFound() {
      return new StopResult(StopState.NOT_FOUND, null);
    }

    public static StopResult alreadyFinished(RunStatus status) {
      return new StopResult(StopState.ALREADY_FINISHED, status);
    }
  }
}
