package com.mk.fx.qa.llm.load.processors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.executors.LoadRunResult;
import com.mk.fx.qa.llm.load.executors.LoadRunner;
import com.mk.fx.qa.llm.load.metrics.AggregateReportBuilder;
import com.mk.fx.qa.llm.load.model.RunRecord;
import com.mk.fx.qa.llm.load.prompts.PromptProvider;
import com.mk.fx.qa.llm.load.report.ReportRenderer;
import com.mk.fx.qa.llm.load.report.RunResultsDocument;
import com.mk.fx.qa.llm.load.report.RunResultsWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Executes one run end to end: prepares the results directory, drives the {@link LoadRunner} and
 * always reports afterwards. The report is built from whatever the run recorded, also when it was
 * stopped early or failed.
 */
@Slf4j
@Component
public class LoadRunProcessor {

    private final LoadRunCfg properties;
    private final PromptProvider promptProvider;
    private final ObjectMapper objectMapper;

    public LoadRunProcessor(
            LoadRunCfg properties, PromptProvider promptProvider, ObjectMapper objectMapper) {
        this.properties = properties;
        this.promptProvider = promptProvider;
        this.objectMapper = objectMapper;
    }

    /**
     * Checks that results can be persisted, without starting anything. Called on submission so an
     * unusable results directory is reported to the caller instead of failing the run later.
     *
     * @throws com.mk.fx.qa.llm.load.exceptions.RunSetupException if the directory cannot be used
     */
    public void prepare() {
        resultsWriter().prepare();
    }

    /**
     * Runs the load test described by {@code record} on the calling thread.
     *
     * @throws com.mk.fx.qa.llm.load.exceptions.RunSetupException if the run cannot be set up; no
     *     request has been sent in that case
     * @throws InterruptedException if the calling thread is interrupted
     */
    public LoadRunResult execute(RunRecord record) throws InterruptedException {
        Objects.requireNonNull(record, "Run record must not be null");
        var runId = record.getRunId().toString();
        var writer = resultsWriter();
        writer.prepare();

        var runner =
                new LoadRunner(
                        runId,
                        record.getConfig(),
                        properties.toParameters(),
                        promptProvider,
                        record.getStore(),
                        record.getConsole());
        record.attach(runner);

        try {
            return runner.run(record::isStopRequested);
        } finally {
            report(record, runner, writer);
        }
    }

    private RunResultsWriter resultsWriter() {
        return new RunResultsWriter(Path.of(properties.getResultsDir()), objectMapper);
    }

    private void report(RunRecord record, LoadRunner runner, RunResultsWriter writer) {
        var store = record.getStore();
        var outcomes = store.outcomes();
        var healthSamples = store.healthSamples();
        var startedAt = runner.startedAt() != null ? runner.startedAt() : record.getSubmittedAt();

        var report =
                new AggregateReportBuilder()
                        .build(
                                outcomes,
                                healthSamples,
                                startedAt,
                                Instant.now(),
                                runner.isInitialHealthy(),
                                runner.isEndpointAlive());
        record.getConsole().printAll(new ReportRenderer().render(report));

        Path file = null;
        try {
            var document =
                    RunResultsDocument.from(
                            record.getRunId().toString(),
                            record.getConfig(),
                            report,
                            outcomes,
                            healthSamples);
            file = writer.write(document, startedAt);
            record.getConsole().println("Detailed results saved to: " + file.toAbsolutePath());
        } catch (IOException e) {
            log.error("Run {} failed to write results: {}", record.getRunId(), e.getMessage(), e);
            record.getConsole().println("Failed to save results: " + e.getMessage());
        }
        record.attachResults(report, file);
    }
}
