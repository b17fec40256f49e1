package com.mk.fx.qa.llm.load;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.llm.load.cfg.LoadRunCfg;
import com.mk.fx.qa.llm.load.service.LoadRunService;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"load.llm.health.interval=45s", "load.llm.defaults.api-key="})
class LlmLoadApplicationTest {

  @Autowired LoadRunCfg properties;
  @Autowired LoadRunService loadRunService;

  @Test
  void contextLoads_andBindsRunProperties() {
    assertThat(properties.getMaxConcurrentRuns()).isEqualTo(1);
    assertThat(properties.getDefaults().getModel()).isEqualTo("llama-scout-17b");
    assertThat(properties.getDefaults().getEndpoint()).isEqualTo("http://localhost:4000");
    assertThat(properties.toParameters().healthInterval()).isEqualTo(Duration.ofSeconds(45));
    assertThat(properties.toParameters().thinkTimeMax()).isEqualTo(Duration.ofSeconds(8));
    assertThat(loadRunService.getActiveRunCount()).isZero();
  }
}
