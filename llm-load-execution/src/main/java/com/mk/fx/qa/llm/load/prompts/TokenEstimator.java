package com.mk.fx.qa.llm.load.prompts;

/** Rough token estimate of about four characters per token. Not a tokenizer. */
public final class TokenEstimator {

  public static final int CHARS_PER_TOKEN = 4;

  private TokenEstimator() {
    // Utility class, no instantiation
  }

  public static int estimate(String text) {
    return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
  }
}
