package com.mk.fx.qa.llm.load.service.stratigies;

import com.mk.fx.qa.llm.load.executors.RunDeadline;
import com.mk.fx.qa.llm.load.utils.LoadUtils;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * Random pause drawn uniformly from {@code [min, max]} milliseconds. Used both for the initial
 * session jitter and for the think time between requests of one user.
 */
public class ThinkTimeStrategy {

  private final long min;
  private final long max;

  private ThinkTimeStrategy(long min, long max) {
    this.min = min;
    this.max = max;
  }

  public static ThinkTimeStrategy uniform(Duration min, Duration max) {
    var lower = Math.max(0, LoadUtils.toDuration(min).toMillis());
    var upper = Math.max(lower, LoadUtils.toDuration(max).toMillis());
    return new ThinkTimeStrategy(lower, upper);
  }

  public static ThinkTimeStrategy upTo(Duration max) {
    return uniform(Duration.ZERO, max);
  }

  public static ThinkTimeStrategy none() {
    return new ThinkTimeStrategy(0, 0);
  }

  public boolean isEnabled() {
    return max > 0;
  }

  /**
   * Sleeps for the next random delay, never past the run deadline.
   *
   * @throws InterruptedException when the run is stopped or the thread interrupted while waiting
   */
  public void pause(RunDeadline deadline, BooleanSupplier cancelled) throws InterruptedException {
    if (!isEnabled()) {
      return;
    }
    var delay = Math.min(nextDelayMillis(), deadline.remaining().toMillis());
    if (delay > 0) {
      LoadUtils.sleepWithCancellation(Duration.ofMillis(delay), cancelled);
    }
  }

  long nextDelayMillis() {
    if (max == min) {
      return min;
    }
    return ThreadLocalRandom.current().nextLong(min, max + 1);
  }
}
