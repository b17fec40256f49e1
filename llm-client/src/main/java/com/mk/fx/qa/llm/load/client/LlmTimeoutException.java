package com.mk.fx.qa.llm.load.client;

/** No response arrived within the per-request timeout. */
public class LlmTimeoutException extends LlmClientException {

  public LlmTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
