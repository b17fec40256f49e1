package com.mk.fx.qa.llm.load.metrics;

import com.mk.fx.qa.llm.load.model.HealthSample;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only, thread-safe store of everything a run observes: request outcomes, health samples
 * and the number of requests currently in flight.
 *
 * <p>Appends from user sessions and the health monitor never block each other. Snapshots are
 * copies; nothing is removed while a run is alive.
 */
public class ResultStore {

  private final Queue<RequestOutcome> outcomes = new ConcurrentLinkedQueue<>();
  private final Queue<HealthSample> healthSamples = new ConcurrentLinkedQueue<>();
  private final AtomicInteger outcomeCount = new AtomicInteger();
  private final AtomicInteger healthSampleCount = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();

  public void append(RequestOutcome outcome) {
    outcomes.add(Objects.requireNonNull(outcome, "outcome"));
    outcomeCount.incrementAndGet();
  }

  public void append(HealthSample sample) {
    healthSamples.add(Objects.requireNonNull(sample, "sample"));
    healthSampleCount.incrementAndGet();
  }

  public void requestStarted() {
    inFlight.incrementAndGet();
  }

  public void requestFinished() {
    inFlight.decrementAndGet();
  }

  /** Logical requests currently between first attempt and final outcome. */
  public int inFlight() {
    return inFlight.get();
  }

  public int outcomeCount() {
    return outcomeCount.get();
  }

  public int healthSampleCount() {
    return healthSampleCount.get();
  }

  public List<RequestOutcome> outcomes() {
    return List.copyOf(outcomes);
  }

  public List<HealthSample> healthSamples() {
    return List.copyOf(healthSamples);
  }
}
