package com.mk.fx.qa.llm.load.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.mk.fx.qa.llm.load.metrics.AggregateReport;
import com.mk.fx.qa.llm.load.model.HealthSample;
import com.mk.fx.qa.llm.load.model.OutcomeStatus;
import com.mk.fx.qa.llm.load.model.RequestOutcome;
import com.mk.fx.qa.llm.load.model.RunConfig;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** The persisted record of a run. Field names are snake case; the credential is never written. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RunResultsDocument(
    String runId,
    ConfigSection config,
    SummarySection summary,
    List<HealthCheckEntry> healthChecks,
    List<ResponseSampleEntry> responseSamples,
    List<ResultEntry> results) {

  /**
   * Assembles the document. Health checks are written in full, whatever the timeline limit of the
   * text report.
   */
  public static RunResultsDocument from(
      String runId,
      RunConfig config,
      AggregateReport report,
      List<RequestOutcome> outcomes,
      List<HealthSample> healthSamples) {
    var health = report.health();
    var summary =
        new SummarySection(
            report.totalRequests(),
            report.successful(),
            report.failed(),
            report.count(OutcomeStatus.CLIENT_ERROR.wireName()),
            report.count(OutcomeStatus.SERVER_ERROR_EXHAUSTED.wireName()),
            report.count(OutcomeStatus.TIMEOUT_EXHAUSTED.wireName()),
            report.count(OutcomeStatus.TRANSPORT_ERROR_EXHAUSTED.wireName()),
            report.retried(),
            report.durationSeconds(),
            report.startedAt(),
            report.finishedAt(),
            report.statusCounts(),
            new EndpointHealth(
                health.initialHealthy(),
                health.totalChecks(),
                health.healthyChecks(),
                health.unhealthyChecks(),
                health.endpointAlive() ? "alive" : "down"));
    return new RunResultsDocument(
        runId,
        ConfigSection.from(config),
        summary,
        healthSamples.stream().map(HealthCheckEntry::from).collect(Collectors.toList()),
        report.responseSamples().stream()
            .map(
                s ->
                    new ResponseSampleEntry(
                        s.userId(), s.workloadType(), s.timestamp(), s.response()))
            .collect(Collectors.toList()),
        outcomes.stream().map(ResultEntry::from).collect(Collectors.toList()));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ConfigSection(
      String endpoint,
      String model,
      int concurrentUsers,
      int testDurationSeconds,
      int maxContextTokens,
      int requestTimeoutSeconds,
      int maxRetries,
      boolean verifyTls,
      boolean credentialConfigured) {

    static ConfigSection from(RunConfig config) {
      return new ConfigSection(
          config.endpoint(),
          config.model(),
          config.concurrency(),
          config.durationSeconds(),
          config.maxContextTokens(),
          config.requestTimeoutSeconds(),
          config.maxRetries(),
          config.verifyTls(),
          config.hasCredential());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SummarySection(
      int totalRequests,
      long successful,
      long failed,
      long clientErrors,
      long serverErrors,
      long timeouts,
      long transportErrors,
      long retried,
      double testDuration,
      Instant startedAt,
      Instant finishedAt,
      Map<String, Long> statusCounts,
      EndpointHealth endpointHealth) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EndpointHealth(
      boolean initialHealthy,
      int totalChecks,
      int healthyChecks,
      int unhealthyChecks,
      String finalStatus) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public record HealthCheckEntry(
      Instant timestamp, String status, Integer httpStatus, String detail) {

    static HealthCheckEntry from(HealthSample sample) {
      return new HealthCheckEntry(
          sample.timestamp(), sample.statusLabel(), sample.httpStatus(), sample.detail());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public record ResponseSampleEntry(
      int userId, String requestType, Instant timestamp, String response) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.ALWAYS)
  public record ResultEntry(
      int userId,
      String requestType,
      int contextLength,
      String status,
      double responseTime,
      int tokensSent,
      int tokensReceived,
      String responseContent,
      String error,
      Instant timestamp,
      int retryCount) {

    static ResultEntry from(RequestOutcome outcome) {
      return new ResultEntry(
          outcome.userId(),
          outcome.workloadType(),
          outcome.contextLength(),
          outcome.status().wireName(),
          outcome.elapsedSeconds(),
          outcome.tokensSent(),
          outcome.tokensReceived(),
          outcome.responseContent(),
          outcome.error(),
          outcome.timestamp(),
          outcome.retryCount());
    }
  }
}
