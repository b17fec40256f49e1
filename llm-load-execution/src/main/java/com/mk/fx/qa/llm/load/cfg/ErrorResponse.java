package com.mk.fx.qa.llm.load.cfg;

/**
 * Represents an error response with an error title and additional details.
 *
 * @param error short error title, e.g. {@code Invalid Configuration}
 * @param details human-readable explanation
 */
public record ErrorResponse(String error, String details) {}
