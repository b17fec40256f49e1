package com.mk.fx.qa.llm.load.dto.controllerresponse;

import com.mk.fx.qa.llm.load.model.RunStatus;
import java.util.UUID;

/** Response to a stop request. */
public record RunStopResponse(UUID runId, RunStatus status, String message) {}
