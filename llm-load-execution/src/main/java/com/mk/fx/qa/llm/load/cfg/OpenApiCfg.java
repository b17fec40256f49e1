package com.mk.fx.qa.llm.load.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("LLM Load Runner API")
                .description(
                    "Starts, monitors and stops load runs against OpenAI-compatible chat"
                        + " completion endpoints."));
  }
}
