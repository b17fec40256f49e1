package com.mk.fx.qa.llm.load.executors;

import java.time.Duration;
import java.time.Instant;

/** Monotonic start and end of a run's test window. */
public final class RunDeadline {

  private final Instant startedAt;
  private final long startNanos;
  private final long deadlineNanos;

  private RunDeadline(Instant startedAt, long startNanos, Duration duration) {
    this.startedAt = startedAt;
    this.startNanos = startNanos;
    this.deadlineNanos = startNanos + duration.toNanos();
  }

  public static RunDeadline startingNow(Duration duration) {
    return new RunDeadline(Instant.now(), System.nanoTime(), duration);
  }

  public Instant startedAt() {
    return startedAt;
  }

  public long startNanos() {
    return startNanos;
  }

  public long deadlineNanos() {
    return deadlineNanos;
  }

  public boolean isExpired() {
    return System.nanoTime() >= deadlineNanos;
  }

  public Duration remaining() {
    return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
  }

  public Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
