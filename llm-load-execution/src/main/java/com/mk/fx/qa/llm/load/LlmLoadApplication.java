package com.mk.fx.qa.llm.load;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LlmLoadApplication {

  public static void main(String[] args) {
    SpringApplication.run(LlmLoadApplication.class, args);
  }
}
