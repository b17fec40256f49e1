package com.mk.fx.qa.llm.load.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponseData {
  private int statusCode;
  private String body;
  private long responseTimeMs;

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }
}
