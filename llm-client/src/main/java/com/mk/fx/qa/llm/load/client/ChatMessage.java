package com.mk.fx.qa.llm.load.client;

/**
 * A single chat message.
 *
 * @param role message author role, e.g. {@code user}
 * @param content message text
 */
public record ChatMessage(String role, String content) {

  public static ChatMessage user(String content) {
    return new ChatMessage("user", content);
  }
}
