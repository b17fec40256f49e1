package com.mk.fx.qa.llm.load.cfg;

import com.mk.fx.qa.llm.load.executors.LoadRunParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load.llm")
public class LoadRunCfg {

  /** Directory receiving one JSON results file per run. */
  @NotBlank private String resultsDir = "results";

  @Min(1)
  @Max(16)
  private int maxConcurrentRuns = 1;

  @Positive private int consoleBufferLines = 5000;

  @Valid @NotNull private Defaults defaults = new Defaults();

  @Valid @NotNull private Session session = new Session();

  @Valid @NotNull private Health health = new Health();

  @Valid @NotNull private Retry retry = new Retry();

  /** Values used for every run configuration field a request leaves out. */
  @Data
  public static class Defaults {
    private String endpoint = "http://localhost:4000";
    private String apiKey = "";
    private String model = "llama-scout-17b";
    private int concurrency = 60;
    private int durationSeconds = 300;
    private int maxContextTokens = 6000;
    private int requestTimeoutSeconds = 60;
    private int maxRetries = 2;
    private boolean verifyTls = false;
  }

  @Data
  public static class Session {
    @NotNull private Duration initialJitterMax = Duration.ofSeconds(5);
    @NotNull private Duration thinkTimeMin = Duration.ofSeconds(2);
    @NotNull private Duration thinkTimeMax = Duration.ofSeconds(8);
  }

  @Data
  public static class Health {
    @NotNull private Duration startupDelay = Duration.ofSeconds(2);
    @NotNull private Duration interval = Duration.ofSeconds(30);
    @NotNull private Duration probeTimeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Retry {
    /** Unit of the exponential backoff after a server error. */
    @NotNull private Duration backoffUnit = Duration.ofSeconds(1);
    /** Delay after a timeout or transport error. */
    @NotNull private Duration fixedBackoff = Duration.ofSeconds(1);
  }

  public LoadRunParameters toParameters() {
    return new LoadRunParameters(
        session.getInitialJitterMax(),
        session.getThinkTimeMin(),
        session.getThinkTimeMax(),
        health.getStartupDelay(),
        health.getInterval(),
        health.getProbeTimeout(),
        retry.getBackoffUnit(),
        retry.getFixedBackoff());
  }
}
