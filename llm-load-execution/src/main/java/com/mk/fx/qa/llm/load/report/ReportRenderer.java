package com.mk.fx.qa.llm.load.report;

import com.mk.fx.qa.llm.load.metrics.AggregateReport;
import com.mk.fx.qa.llm.load.model.HealthSample;
import com.mk.fx.qa.llm.load.model.OutcomeStatus;
import com.mk.fx.qa.llm.load.utils.LoadUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Renders an {@link AggregateReport} as the human-readable end-of-run text. */
public final class ReportRenderer {

  private static final String RULE = "=".repeat(80);
  private static final int SAMPLE_PREVIEW_COUNT = 5;
  private static final int SAMPLE_PREVIEW_CHARS = 200;

  public List<String> render(AggregateReport report) {
    List<String> lines = new ArrayList<>();
    lines.add("");
    lines.add(RULE);
    lines.add("Load Test Results");
    lines.add(RULE);
    lines.add("");

    var total = report.totalRequests();
    lines.add("Total Requests: " + total);
    if (total == 0) {
      lines.add("No requests completed!");
    } else {
      renderOutcomes(report, lines);
    }

    renderHealth(report.health(), lines);
    renderSamples(report.responseSamples(), lines);
    lines.add("");
    lines.add(RULE);
    return lines;
  }

  private void renderOutcomes(AggregateReport report, List<String> lines) {
    var total = report.totalRequests();
    lines.add(countLine("Successful", report.successful(), total));
    lines.add(
        countLine(
            "Client errors (4xx)", report.count(OutcomeStatus.CLIENT_ERROR.wireName()), total));
    lines.add(
        countLine(
            "Server errors (retries exhausted)",
            report.count(OutcomeStatus.SERVER_ERROR_EXHAUSTED.wireName()),
            total));
    lines.add(
        countLine(
            "Timeouts (retries exhausted)",
            report.count(OutcomeStatus.TIMEOUT_EXHAUSTED.wireName()),
            total));
    lines.add(
        countLine(
            "Transport errors (retries exhausted)",
            report.count(OutcomeStatus.TRANSPORT_ERROR_EXHAUSTED.wireName()),
            total));
    lines.add(countLine("Requests that needed retries", report.retried(), total));

    var latency = report.latency();
    if (latency != null) {
      lines.add("");
      lines.add("Response Time Statistics (successful requests):");
      lines.add(format("  Min: %.2fs", latency.minSeconds()));
      lines.add(format("  Max: %.2fs", latency.maxSeconds()));
      lines.add(format("  Mean: %.2fs", latency.meanSeconds()));
      lines.add(format("  Median: %.2fs", latency.medianSeconds()));
      if (latency.p95Seconds() != null) {
        lines.add(format("  P95: %.2fs", latency.p95Seconds()));
        lines.add(format("  P99: %.2fs", latency.p99Seconds()));
      }

      var tokens = report.tokens();
      lines.add("");
      lines.add("Token Statistics:");
      lines.add(format("  Avg tokens sent: %.0f", tokens.averageSent()));
      lines.add(format("  Avg tokens received: %.0f", tokens.averageReceived()));
      lines.add(format("  Total tokens sent: %,d", tokens.totalSent()));
      lines.add(format("  Total tokens received: %,d", tokens.totalReceived()));
    }

    lines.add("");
    lines.add("Breakdown by Request Type:");
    for (AggregateReport.WorkloadBreakdown entry : report.breakdown()) {
      var line =
          format(
              "  %s: %d requests, %d successful",
              entry.workloadType(),
              entry.count(),
              entry.successful());
      if (entry.meanLatencySeconds() != null) {
        line += format(", avg %.2fs", entry.meanLatencySeconds());
      }
      lines.add(line);
    }

    if (!report.topErrors().isEmpty()) {
      lines.add("");
      lines.add("Error Details:");
      for (AggregateReport.ErrorCount error : report.topErrors()) {
        lines.add(format("  [%dx] %s", error.count(), LoadUtils.singleLine(error.message())));
      }
    }

    lines.add("");
    lines.add("Throughput:");
    lines.add(format("  Test duration: %.2fs", report.durationSeconds()));
    lines.add(format("  Requests per second: %.2f", report.throughput().requestsPerSecond()));
    lines.add(
        format("  Successful requests per second: %.2f", report.throughput().successfulPerSecond()));
  }

  private void renderHealth(AggregateReport.HealthSummary health, List<String> lines) {
    lines.add("");
    lines.add("Endpoint Health Monitoring:");
    lines.add("  Initial health check: " + (health.initialHealthy() ? "healthy" : "failed"));
    lines.add("  Total health checks: " + health.totalChecks());
    if (health.totalChecks() > 0) {
      lines.add(
          format(
              "  Healthy checks: %d (%.1f%%)",
              health.healthyChecks(), percent(health.healthyChecks(), health.totalChecks())));
      lines.add("  Unhealthy checks: " + health.unhealthyChecks());
    }
    lines.add("  Final status: " + (health.endpointAlive() ? "ALIVE" : "DOWN"));
    if (!health.timeline().isEmpty()) {
      lines.add("  Health check timeline:");
      for (HealthSample sample : health.timeline()) {
        lines.add(
            format(
                "    %s %s%s",
                sample.timestamp(),
                sample.healthy() ? "✓" : "✗",
                sample.healthy() ? "" : " " + LoadUtils.singleLine(sample.detail())));
      }
    }
  }

  private void renderSamples(List<AggregateReport.ResponseSample> samples, List<String> lines) {
    if (samples.isEmpty()) {
      return;
    }
    lines.add("");
    lines.add("Sample Responses (first " + Math.min(SAMPLE_PREVIEW_COUNT, samples.size()) + "):");
    samples.stream()
        .limit(SAMPLE_PREVIEW_COUNT)
        .forEach(
            sample ->
                lines.add(
                    format(
                        "  [User %03d] %s: %s",
                        sample.userId(),
                        sample.workloadType(),
                        LoadUtils.singleLine(
                            LoadUtils.truncate(sample.response(), SAMPLE_PREVIEW_CHARS)))));
  }

  private static String countLine(String label, long count, int total) {
    return format("%s: %d (%.1f%%)", label, count, percent(count, total));
  }

  private static double percent(long part, long total) {
    return total == 0 ? 0.0 : part * 100.0 / total;
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
