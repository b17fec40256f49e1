package com.mk.fx.qa.llm.load.executors;

import java.time.Instant;

/** How a run's execution phase ended. */
public record LoadRunResult(
    Instant startedAt,
    Instant finishedAt,
    int totalUsers,
    int completedUsers,
    boolean stopped,
    boolean initialHealthy,
    boolean endpointAlive) {}
