package com.mk.fx.qa.llm.load.dto.controllerresponse;

import com.mk.fx.qa.llm.load.model.RunStatus;
import java.util.UUID;

/** Response to a run submission: the run handle and its status at submission time. */
public record RunSubmissionResponse(UUID runId, RunStatus status, String message) {}
