package com.mk.fx.qa.llm.load.resource;

import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunConfigRequest;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunDefaultsResponse;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunStopResponse;
import com.mk.fx.qa.llm.load.dto.controllerresponse.RunSubmissionResponse;
import com.mk.fx.qa.llm.load.service.LoadRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Load Runs",
    description = "Endpoints for starting, monitoring and stopping LLM load runs")
@RestController
@RequestMapping("/api/runs")
@Validated
@RequiredArgsConstructor
public class LoadRunController {

  private final LoadRunService loadRunService;
  private final LoadRunCfg properties;
  private final RunConfigMapper runConfigMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Run submission
  // -----------------------------------------------------
  @Operation(
      summary = "Start a load run",
      description =
          "Validates the configuration, filling missing fields from the defaults, and starts the"
              + " run asynchronously.")
  @PostMapping
  public ResponseEntity<RunSubmissionResponse> startRun(
      @Valid @RequestBody(required = false) RunConfigRequest request) {
    var config = runConfigMapper.merge(request, properties.getDefaults());
    var record = loadRunService.start(config);
    log.info(
        "Run {} accepted ({} users, {}s)",
        record.getRunId(),
        config.concurrency(),
        config.durationSeconds());
    return responseFactory.accepted(
        new RunSubmissionResponse(record.getRunId(), record.getStatus(), "Run started"));
  }

  @Operation(
      summary = "Run defaults",
      description = "Returns the configured defaults, credential masked.")
  @GetMapping("/defaults")
  public ResponseEntity<RunDefaultsResponse> getDefaults() {
    return ResponseEntity.ok(runConfigMapper.toDefaultsResponse(properties.getDefaults()));
  }

  // -----------------------------------------------------
  // Run status and control
  // -----------------------------------------------------
  @Operation(summary = "List runs", description = "Lists all runs, most recent first.")
  @GetMapping
  public ResponseEntity<List<RunStatusResponse>> getRuns() {
    return ResponseEntity.ok(loadRunService.getAllRuns());
  }

  @Operation(summary = "Get run status", description = "Returns status and live counters of a run.")
  @GetMapping("/{runId}")
  public ResponseEntity<?> getRunStatus(@PathVariable UUID runId) {
    return loadRunService
        .getRunStatus(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Run {} not found", runId);
              return responseFactory.notFound("Run not found: " + runId);
            });
  }

  @Operation(
      summary = "Run output",
      description = "Returns console lines from the given offset and the offset to poll next.")
  @GetMapping("/{runId}/output")
  public ResponseEntity<?> getRunOutput(
      @PathVariable UUID runId, @RequestParam(defaultValue = "0") long from) {
    return loadRunService
        .getOutput(runId, from)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> responseFactory.notFound("Run not found: " + runId));
  }

  @Operation(summary = "Run report", description = "Returns the final report of a finished run.")
  @GetMapping("/{runId}/report")
  public ResponseEntity<?> getRunReport(@PathVariable UUID runId) {
    return loadRunService
        .getReport(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Report not available for run {}", runId);
              return responseFactory.notFound("Report not available for run: " + runId);
            });
  }

  @Operation(summary = "Stop run", description = "Requests a cooperative stop of a running run.")
  @DeleteMapping("/{runId}")
  public ResponseEntity<?> stopRun(@PathVariable UUID runId) {
    var result = loadRunService.stop(runId);
    log.info("Stop requested for {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.notFound("Run not found: " + runId);
      case ALREADY_FINISHED -> responseFactory.error(
          HttpStatus.CONFLICT,
          "Conflict",
          "Run already finished with status " + result.getRunStatus());
      case STOP_REQUESTED -> ResponseEntity.ok(
          new RunStopResponse(runId, result.getRunStatus(), "Stop requested"));
    };
  }
}
