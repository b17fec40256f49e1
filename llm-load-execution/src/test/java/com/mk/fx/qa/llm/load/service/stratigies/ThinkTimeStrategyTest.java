package com.mk.fx.qa.llm.load.service.stratigies;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mk.fx.qa.llm.load.executors.RunDeadline;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ThinkTimeStrategyTest {

  @Test
  void uniform_drawsWithinBounds() {
    var strategy = ThinkTimeStrategy.uniform(Duration.ofSeconds(2), Duration.ofSeconds(8));

    for (int i = 0; i < 1000; i++) {
      var delay = strategy.nextDelayMillis();
      assertTrue(delay >= 2000 && delay <= 8000, "delay out of range: " + delay);
    }
  }

  @Test
  void uniform_withEqualBoundsIsConstant() {
    assertEquals(
        1500L,
        ThinkTimeStrategy.uniform(Duration.ofMillis(1500), Duration.ofMillis(1500))
            .nextDelayMillis());
  }

  @Test
  void uniform_clampsInvertedBounds() {
    var strategy = ThinkTimeStrategy.uniform(Duration.ofSeconds(3), Duration.ofSeconds(1));

    assertEquals(3000L, strategy.nextDelayMillis());
  }

  @Test
  void none_isDisabled() {
    assertFalse(ThinkTimeStrategy.none().isEnabled());
    assertFalse(ThinkTimeStrategy.upTo(Duration.ZERO).isEnabled());
    assertTrue(ThinkTimeStrategy.upTo(Duration.ofSeconds(5)).isEnabled());
  }

  @Test
  void pause_isCappedAtDeadline() throws InterruptedException {
    var strategy = ThinkTimeStrategy.uniform(Duration.ofSeconds(5), Duration.ofSeconds(5));
    var deadline = RunDeadline.startingNow(Duration.ofMillis(200));

    var start = System.nanoTime();
    strategy.pause(deadline, () -> false);
    var elapsed = Duration.ofNanos(System.nanoTime() - start);

    assertTrue(elapsed.compareTo(Duration.ofSeconds(2)) < 0, "paused for " + elapsed);
  }

  @Test
  void pause_throwsWhenCancelled() {
    var strategy = ThinkTimeStrategy.uniform(Duration.ofSeconds(5), Duration.ofSeconds(5));
    var deadline = RunDeadline.startingNow(Duration.ofSeconds(30));

    var ex = assertThrows(InterruptedException.class, () -> strategy.pause(deadline, () -> true));
    assertEquals("Cancelled during sleep", ex.getMessage());
  }
}
