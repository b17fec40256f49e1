package com.mk.fx.qa.llm.load.dto.controllerresponse;

import com.mk.fx.qa.llm.load.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Current state of a run. Counters are live while the run is in progress.
 *
 * @param elapsedSeconds seconds since the run started, frozen once it has finished
 * @param inFlight logical requests currently awaiting a final outcome
 * @param resultsFile path of the persisted results, null until written
 */
public record RunStatusResponse(
    UUID runId,
    RunStatus status,
    String endpoint,
    String model,
    int concurrency,
    int durationSeconds,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    long elapsedSeconds,
    int outcomes,
    int inFlight,
    int healthChecks,
    boolean endpointAlive,
    String resultsFile,
    String errorMessage) {}
