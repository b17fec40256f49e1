package com.mk.fx.qa.llm.load.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of a {@code POST /v1/chat/completions} request. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionRequest {
  private String model;
  private List<ChatMessage> messages;

  @JsonProperty("max_tokens")
  private int maxTokens;

  private double temperature;

  /** Builds the single user-message request shape used for both workload and probes. */
  public static ChatCompletionRequest userPrompt(
      String model, String prompt, int maxTokens, double temperature) {
    return new ChatCompletionRequest(model, List.of(ChatMessage.user(prompt)), maxTokens, temperature);
  }
}
