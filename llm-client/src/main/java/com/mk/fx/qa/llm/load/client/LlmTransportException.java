package com.mk.fx.qa.llm.load.client;

/** Connection, DNS, TLS or other I/O failure while talking to the endpoint. */
public class LlmTransportException extends LlmClientException {

  public LlmTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
