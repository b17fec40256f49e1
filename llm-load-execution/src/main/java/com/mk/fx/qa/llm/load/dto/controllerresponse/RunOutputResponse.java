package com.mk.fx.qa.llm.load.dto.controllerresponse;

import java.util.List;
import java.util.UUID;

/**
 * A slice of the run's console output.
 *
 * @param from offset of the first returned line
 * @param nextOffset offset to pass as {@code from} on the next poll
 */
public record RunOutputResponse(UUID runId, long from, long nextOffset, List<String> lines) {}
