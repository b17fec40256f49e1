package com.mk.fx.qa.llm.load.metrics;

import com.mk.fx.qa.llm.load.model.HealthSample;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Statistics of a finished run, derived once from the result store. Latencies are in seconds.
 *
 * @param statusCounts count per outcome status, keyed by wire name, every status present
 * @param latency statistics over successful requests, null when there were none
 */
public record AggregateReport(
    Instant startedAt,
    Instant finishedAt,
    double durationSeconds,
    int totalRequests,
    Map<String, Long> statusCounts,
    long successful,
    long retried,
    LatencyStats latency,
    TokenStats tokens,
    List<WorkloadBreakdown> breakdown,
    List<ErrorCount> topErrors,
    Throughput throughput,
    HealthSummary health,
    List<ResponseSample> responseSamples) {

  public long failed() {
    return totalRequests - successful;
  }

  public long count(String status) {
    return statusCounts.getOrDefault(status, 0L);
  }

  /** p95 and p99 are null with fewer than two values. */
  public record LatencyStats(
      double minSeconds,
      double maxSeconds,
      double meanSeconds,
      double medianSeconds,
      Double p95Seconds,
      Double p99Seconds) {}

  public record TokenStats(
      double averageSent, double averageReceived, long totalSent, long totalReceived) {}

  public record WorkloadBreakdown(
      String workloadType, long count, long successful, Double meanLatencySeconds) {}

  public record ErrorCount(String message, long count) {}

  public record Throughput(double requestsPerSecond, double successfulPerSecond) {}

  /** @param timeline every sample when there are at most 20, otherwise empty */
  public record HealthSummary(
      boolean initialHealthy,
      int totalChecks,
      int healthyChecks,
      int unhealthyChecks,
      boolean endpointAlive,
      List<HealthSample> timeline) {}

  public record ResponseSample(
      int userId, String workloadType, Instant timestamp, String response) {}
}
