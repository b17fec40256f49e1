package com.mk.fx.qa.llm.load.model;

import com.mk.fx.qa.llm.load.executors.LoadRunner;
import com.mk.fx.qa.llm.load.metrics.AggregateReport;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.report.RunConsole;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

/**
 * Mutable bookkeeping of one run inside the service: lifecycle, stop flag and the per-run store,
 * console and final artefacts. State transitions are synchronized, reads are lock-free.
 */
public class RunRecord {

  @Getter private final UUID runId;
  @Getter private final RunConfig config;
  @Getter private final ResultStore store;
  @Getter private final RunConsole console;
  @Getter private final Instant submittedAt;

  private final AtomicBoolean stopRequested = new AtomicBoolean(false);

  @Getter private volatile RunStatus status = RunStatus.RUNNING;
  private volatile Instant startedAt;
  private volatile Instant completedAt;
  private volatile String errorMessage;
  private volatile LoadRunner runner;
  private volatile AggregateReport report;
  private volatile Path resultsFile;

  public RunRecord(
      UUID runId, RunConfig config, ResultStore store, RunConsole console, Instant submittedAt) {
    this.runId = runId;
    this.config = config;
    this.store = store;
    this.console = console;
    this.submittedAt = submittedAt;
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  /** Flags the run to stop. Returns false when the run has already finished. */
  public synchronized boolean requestStop() {
    if (status.isTerminal()) {
      return false;
    }
    stopRequested.set(true);
    return true;
  }

  public synchronized void markStarted(Instant at) {
    this.startedAt = at;
  }

  public void attach(LoadRunner loadRunner) {
    this.runner = loadRunner;
  }

  public void attachResults(AggregateReport aggregateReport, Path file) {
    this.report = aggregateReport;
    this.resultsFile = file;
  }

  /** Ends the run as STOPPED when a stop was requested, COMPLETED otherwise. */
  public synchronized void markFinished(Instant at) {
    if (status.isTerminal()) {
      return;
    }
    this.completedAt = at;
    this.status = stopRequested.get() ? RunStatus.STOPPED : RunStatus.COMPLETED;
  }

  public synchronized void markFailed(Instant at, String message) {
    if (status.isTerminal()) {
      return;
    }
    this.completedAt = at;
    this.errorMessage = message;
    this.status = RunStatus.FAILED;
  }

  public Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public Optional<AggregateReport> getReport() {
    return Optional.ofNullable(report);
  }

  public Optional<Path> getResultsFile() {
    return Optional.ofNullable(resultsFile);
  }

  /** Liveness as last observed; true before the first probe. */
  public boolean isEndpointAlive() {
    var current = runner;
    return current == null || current.isEndpointAlive();
  }

  /** Time since the test window opened, or since submission before that; frozen when finished. */
  public Duration getElapsed() {
    var current = runner;
    Instant from =
        current != null && current.startedAt() != null ? current.startedAt() : submittedAt;
    Instant to = completedAt != null ? completedAt : Instant.now();
    return from.isAfter(to) ? Duration.ZERO : Duration.between(from, to);
  }
}
