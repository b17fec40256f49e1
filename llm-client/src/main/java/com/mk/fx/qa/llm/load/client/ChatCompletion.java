package com.mk.fx.qa.llm.load.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

/**
 * The parts of a chat completion response the load runner reads.
 *
 * @param content text of {@code choices[0].message.content}, empty when absent
 * @param completionTokens value of {@code usage.completion_tokens}, 0 when absent
 */
@Slf4j
public record ChatCompletion(String content, int completionTokens) {

  public static final ChatCompletion EMPTY = new ChatCompletion("", 0);

  /**
   * Parses a response body. Missing fields and non-JSON bodies are tolerated and yield empty
   * content and zero tokens rather than an error.
   */
  public static ChatCompletion parse(String body) {
    if (body == null || body.isBlank()) {
      return EMPTY;
    }
    JsonNode root;
    try {
      root = JsonUtil.mapper().readTree(body);
    } catch (JsonProcessingException e) {
      log.debug("Completion body is not JSON: {}", e.getOriginalMessage());
      return EMPTY;
    }
    JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
    String content = contentNode.isTextual() ? contentNode.textValue() : "";
    int tokens = root.path("usage").path("completion_tokens").asInt(0);
    return new ChatCompletion(content, tokens);
  }
}
