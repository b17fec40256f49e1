package com.mk.fx.qa.llm.load.dto.controllerresponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Request to start a load run. Every field is optional; missing ones are taken from the configured
 * defaults.
 */
@Data
public class RunConfigRequest {

    @Pattern(regexp = "^https?://.+", message = "must be an absolute http(s) URL")
    private String endpoint;

    private String apiKey;

    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String model;

    @Min(1)
    @Max(1000)
    private Integer concurrency;

    @Min(1)
    private Integer durationSeconds;

    @Min(1)
    private Integer maxContextTokens;

    @Min(1)
    private Integer requestTimeoutSeconds;

    @Min(0)
    @Max(10)
    private Integer maxRetries;

    private Boolean verifyTls;
}
