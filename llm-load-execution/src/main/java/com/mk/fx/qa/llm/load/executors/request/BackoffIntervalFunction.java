package com.mk.fx.qa.llm.load.executors.request;

import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.functions.Either;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Wait before the next attempt: exponential ({@code unit * 2^(attempt-1)}) after a server error,
 * a fixed delay after a timeout or transport error.
 */
@Slf4j
public class BackoffIntervalFunction implements IntervalBiFunction<AttemptResult> {

  private final long unitMillis;
  private final long fixedMillis;

  public BackoffIntervalFunction(Duration unit, Duration fixed) {
    this.unitMillis = unit.toMillis();
    this.fixedMillis = fixed.toMillis();
  }

  @Override
  public Long apply(Integer attemptNumber, Either<Throwable, AttemptResult> either) {
    long delay;
    if (either.isRight() && either.get().kind() == AttemptKind.SERVER_ERROR) {
      delay = unitMillis * (1L << Math.min(30, Math.max(0, attemptNumber - 1)));
    } else {
      delay = fixedMillis;
    }
    log.debug("Attempt #{}: next retry in {}ms", attemptNumber, delay);
    return delay;
  }
}
