package com.mk.fx.qa.llm.load.processors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.cfg.ObjectMapperConfig;
import com.mk.fx.qa.llm.load.exceptions.RunSetupException;
import com.mk.fx.qa.llm.load.metrics.ResultStore;
import com.mk.fx.qa.llm.load.model.RunConfig;
import com.mk.fx.qa.llm.load.model.RunRecord;
import com.mk.fx.qa.llm.load.prompts.PaddingPromptProvider;
import com.mk.fx.qa.llm.load.report.RunConsole;
import com.mk.fx.qa.llm.load.support.FakeLlmEndpoint;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoadRunProcessorTest {

  @TempDir Path tempDir;

  private FakeLlmEndpoint endpoint;
  private final ObjectMapper mapper = new ObjectMapperConfig().objectMapper();

  @BeforeEach
  void setUp() throws Exception {
    endpoint = FakeLlmEndpoint.start();
  }

  @AfterEach
  void tearDown() {
    endpoint.close();
  }

  private LoadRunCfg properties(Path resultsDir) {
    var cfg = new LoadRunCfg();
    cfg.setResultsDir(resultsDir.toString());
    cfg.getSession().setInitialJitterMax(Duration.ofMillis(50));
    cfg.getSession().setThinkTimeMin(Duration.ofMillis(50));
    cfg.getSession().setThinkTimeMax(Duration.ofMillis(100));
    cfg.getHealth().setStartupDelay(Duration.ofMillis(100));
    cfg.getHealth().setInterval(Duration.ofMillis(400));
    cfg.getHealth().setProbeTimeout(Duration.ofSeconds(2));
    cfg.getRetry().setBackoffUnit(Duration.ofMillis(10));
    cfg.getRetry().setFixedBackoff(Duration.ofMillis(10));
    return cfg;
  }

  private RunRecord record() {
    var config =
        new RunConfig(endpoint.baseUrl(), "secret", "test-model", 2, 1, 1000, 5, 1, false);
    var runId = UUID.randomUUID();
    return new RunRecord(
        runId, config, new ResultStore(), new RunConsole(runId.toString(), 10_000), Instant.now());
  }

  @Test
  void execute_runsReportsAndPersists() throws Exception {
    var resultsDir = tempDir.resolve("results");
    var processor =
        new LoadRunProcessor(properties(resultsDir), new PaddingPromptProvider(), mapper);
    var record = record();

    var result = processor.execute(record);

    assertThat(result.stopped()).isFalse();
    assertThat(record.getReport()).isPresent();
    var report = record.getReport().get();
    assertThat(report.totalRequests()).isEqualTo(record.getStore().outcomeCount());
    assertThat(report.successful()).isEqualTo(report.totalRequests());
    assertThat(report.health().initialHealthy()).isTrue();
    assertThat(report.health().totalChecks()).isEqualTo(3);

    assertThat(record.getResultsFile()).isPresent();
    var file = record.getResultsFile().get();
    assertThat(file.getParent()).isEqualTo(resultsDir);
    assertThat(file.getFileName().toString())
        .startsWith("load_test_results_")
        .endsWith("_" + record.getRunId().toString().substring(0, 8) + ".json");
    var json = mapper.readTree(Files.readString(file));
    assertThat(json.path("results").size()).isEqualTo(report.totalRequests());
    assertThat(json.path("health_checks").size()).isEqualTo(3);
    assertThat(Files.readString(file)).doesNotContain("secret");

    var lines = record.getConsole().linesFrom(0).lines();
    assertThat(lines).contains("Load Test Results");
    assertThat(lines).anyMatch(line -> line.startsWith("Detailed results saved to: "));
  }

  @Test
  void execute_stoppedRunIsStillReported() throws Exception {
    var processor =
        new LoadRunProcessor(properties(tempDir), new PaddingPromptProvider(), mapper);
    var record = record();
    record.requestStop();

    var result = processor.execute(record);

    assertThat(result.stopped()).isTrue();
    assertThat(record.getReport()).isPresent();
    assertThat(record.getResultsFile()).isPresent();
  }

  @Test
  void prepare_createsResultsDirAndRejectsUnusableOne() throws Exception {
    var resultsDir = tempDir.resolve("nested").resolve("results");
    new LoadRunProcessor(properties(resultsDir), new PaddingPromptProvider(), mapper).prepare();
    assertThat(resultsDir).isDirectory();

    var blocker = Files.createFile(tempDir.resolve("not-a-dir"));
    var processor =
        new LoadRunProcessor(properties(blocker), new PaddingPromptProvider(), mapper);
    assertThrows(RunSetupException.class, processor::prepare);
    assertThat(endpoint.requestCount()).isZero();
  }

  @Test
  void execute_failsBeforeSendingWhenResultsDirUnusable() throws Exception {
    var blocker = Files.createFile(tempDir.resolve("blocker"));
    var processor =
        new LoadRunProcessor(properties(blocker), new PaddingPromptProvider(), mapper);
    var record = record();

    assertThrows(RunSetupException.class, () -> processor.execute(record));

    assertThat(endpoint.requestCount()).isZero();
    assertThat(record.getReport()).isEmpty();
  }
}
