package com.mk.fx.qa.llm.load.executors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;

/**
 * Engine timings that are not part of a run configuration: session pacing, health monitor
 * schedule and retry backoff.
 */
public record LoadRunParameters(
    Duration initialJitterMax,
    Duration thinkTimeMin,
    Duration thinkTimeMax,
    Duration healthStartupDelay,
    Duration healthInterval,
    Duration probeTimeout,
    Duration backoffUnit,
    Duration fixedBackoff) {

  public LoadRunParameters {
    requireNonNull(initialJitterMax, "initialJitterMax");
    requireNonNull(thinkTimeMin, "thinkTimeMin");
    requireNonNull(thinkTimeMax, "thinkTimeMax");
    requireNonNull(healthStartupDelay, "healthStartupDelay");
    requireNonNull(healthInterval, "healthInterval");
    requireNonNull(probeTimeout, "probeTimeout");
    requireNonNull(backoffUnit, "backoffUnit");
    requireNonNull(fixedBackoff, "fixedBackoff");
    checkArgument(!initialJitterMax.isNegative(), "initialJitterMax must not be negative");
    checkArgument(!thinkTimeMin.isNegative(), "thinkTimeMin must not be negative");
    checkArgument(
        thinkTimeMax.compareTo(thinkTimeMin) >= 0, "thinkTimeMax must not be below thinkTimeMin");
    checkArgument(!healthStartupDelay.isNegative(), "healthStartupDelay must not be negative");
    checkArgument(
        !healthInterval.isNegative() && !healthInterval.isZero(), "healthInterval must be positive");
    checkArgument(
        !probeTimeout.isNegative() && !probeTimeout.isZero(), "probeTimeout must be positive");
    checkArgument(!backoffUnit.isNegative(), "backoffUnit must not be negative");
    checkArgument(!fixedBackoff.isNegative(), "fixedBackoff must not be negative");
  }

  /** Timings used when nothing is configured. */
  public static LoadRunParameters defaults() {
    return new LoadRunParameters(
        Duration.ofSeconds(5),
        Duration.ofSeconds(2),
        Duration.ofSeconds(8),
        Duration.ofSeconds(2),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        Duration.ofSeconds(1),
        Duration.ofSeconds(1));
  }
}
