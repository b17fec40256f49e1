package com.mk.fx.qa.llm.load.metrics;

import com.mk.fx.qa.llm.load.model.HealthSample;
import com.mk.fx.qa.llm.load.model.OutcomeStatus;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import com.mk.fx.qa.llm.load.utils.LoadUtils;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes the {@link AggregateReport} of a run. Pure: the same snapshot always yields an equal
 * report and the inputs are never modified.
 */
public final class AggregateReportBuilder {

  static final int TOP_ERRORS = 10;
  static final int ERROR_MESSAGE_CHARS = 100;
  static final String UNKNOWN_ERROR = "Unknown";
  static final int MAX_RESPONSE_SAMPLES = 50;
  static final int RESPONSE_SAMPLE_CHARS = 500;
  static final int TIMELINE_LIMIT = 20;

  public AggregateReport build(
      List<RequestOutcome> outcomes,
      List<HealthSample> healthSamples,
      Instant startedAt,
      Instant finishedAt,
      boolean initialHealthy,
      boolean endpointAlive) {

    // timing
    var durationSec =
        startedAt == null || finishedAt == null
            ? 0.0
            : Math.max(0.0, Duration.between(startedAt, finishedAt).toMillis() / 1000.0);

    // status counts
    Map<String, Long> statusCounts = new LinkedHashMap<>();
    for (OutcomeStatus status : OutcomeStatus.values()) {
      statusCounts.put(status.wireName(), 0L);
    }
    for (RequestOutcome outcome : outcomes) {
      statusCounts.merge(outcome.status().wireName(), 1L, Long::sum);
    }

    List<RequestOutcome> successes =
        outcomes.stream().filter(RequestOutcome::isSuccess).collect(Collectors.toList());
    var retried = outcomes.stream().filter(RequestOutcome::wasRetried).count();

    var throughput =
        durationSec <= 0
            ? new AggregateReport.Throughput(0.0, 0.0)
            : new AggregateReport.Throughput(
                outcomes.size() / durationSec, successes.size() / durationSec);

    return new AggregateReport(
        startedAt,
        finishedAt,
        durationSec,
        outcomes.size(),
        Collections.unmodifiableMap(statusCounts),
        successes.size(),
        retried,
        latency(successes),
        tokens(successes),
        breakdown(outcomes),
        topErrors(outcomes),
        throughput,
        health(healthSamples, initialHealthy, endpointAlive),
        responseSamples(successes));
  }

  private AggregateReport.LatencyStats latency(List<RequestOutcome> successes) {
    if (successes.isEmpty()) {
      return null;
    }
    List<Long> sorted =
        successes.stream().map(RequestOutcome::elapsedMs).sorted().collect(Collectors.toList());
    var multiple = sorted.size() > 1;
    return new AggregateReport.LatencyStats(
        seconds(sorted.get(0)),
        seconds(sorted.get(sorted.size() - 1)),
        Percentiles.mean(sorted) / 1000.0,
        Percentiles.median(sorted) / 1000.0,
        multiple ? seconds(Percentiles.at(sorted, 0.95)) : null,
        multiple ? seconds(Percentiles.at(sorted, 0.99)) : null);
  }

  private AggregateReport.TokenStats tokens(List<RequestOutcome> successes) {
    long sent = 0;
    long received = 0;
    for (RequestOutcome outcome : successes) {
      sent += outcome.tokensSent();
      received += outcome.tokensReceived();
    }
    var n = successes.size();
    return new AggregateReport.TokenStats(
        n == 0 ? 0.0 : (double) sent / n, n == 0 ? 0.0 : (double) received / n, sent, received);
  }

  private List<AggregateReport.WorkloadBreakdown> breakdown(List<RequestOutcome> outcomes) {
    Map<String, List<RequestOutcome>> byType =
        outcomes.stream()
            .collect(
                Collectors.groupingBy(
                    RequestOutcome::workloadType, TreeMap::new, Collectors.toList()));
    List<AggregateReport.WorkloadBreakdown> result = new ArrayList<>();
    byType.forEach(
        (type, entries) -> {
          List<Long> latencies =
              entries.stream()
                  .filter(RequestOutcome::isSuccess)
                  .map(RequestOutcome::elapsedMs)
                  .collect(Collectors.toList());
          result.add(
              new AggregateReport.WorkloadBreakdown(
                  type,
                  entries.size(),
                  latencies.size(),
                  latencies.isEmpty() ? null : Percentiles.mean(latencies) / 1000.0));
        });
    return List.copyOf(result);
  }

  private List<AggregateReport.ErrorCount> topErrors(List<RequestOutcome> outcomes) {
    // insertion order keeps first occurrence for ties, the sort below is stable
    Map<String, Long> counts = new LinkedHashMap<>();
    for (RequestOutcome outcome : outcomes) {
      if (outcome.isSuccess()) {
        continue;
      }
      var message =
          outcome.error() == null
              ? UNKNOWN_ERROR
              : LoadUtils.truncate(outcome.error(), ERROR_MESSAGE_CHARS);
      counts.merge(message, 1L, Long::sum);
    }
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
        .limit(TOP_ERRORS)
        .map(e -> new AggregateReport.ErrorCount(e.getKey(), e.getValue()))
        .collect(Collectors.toUnmodifiableList());
  }

  private AggregateReport.HealthSummary health(
      List<HealthSample> samples, boolean initialHealthy, boolean endpointAlive) {
    var healthy = (int) samples.stream().filter(HealthSample::healthy).count();
    return new AggregateReport.HealthSummary(
        initialHealthy,
        samples.size(),
        healthy,
        samples.size() - healthy,
        endpointAlive,
        samples.size() <= TIMELINE_LIMIT ? List.copyOf(samples) : List.of());
  }

  private List<AggregateReport.ResponseSample> responseSamples(List<RequestOutcome> successes) {
    return successes.stream()
        .sorted(Comparator.comparing(RequestOutcome::timestamp))
        .limit(MAX_RESPONSE_SAMPLES)
        .map(
            o ->
                new AggregateReport.ResponseSample(
                    o.userId(),
                    o.workloadType(),
                    o.timestamp(),
                    LoadUtils.truncate(o.responseContent(), RESPONSE_SAMPLE_CHARS)))
        .collect(Collectors.toUnmodifiableList());
  }

  private static double seconds(long millis) {
    return millis / 1000.0;
  }
}
