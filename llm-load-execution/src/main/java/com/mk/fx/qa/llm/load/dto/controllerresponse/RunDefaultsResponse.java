package com.mk.fx.qa.llm.load.dto.controllerresponse;

/** Configured run defaults. The credential is masked. */
public record RunDefaultsResponse(
    String endpoint,
    String apiKey,
    String model,
    int concurrency,
    int durationSeconds,
    int maxContextTokens,
    int requestTimeoutSeconds,
    int maxRetries,
    boolean verifyTls) {}
