package com.mk.fx.qa.llm.load.client;

/** Base type for failures to obtain any HTTP response from the completion endpoint. */
public abstract class LlmClientException extends RuntimeException {

  protected LlmClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
