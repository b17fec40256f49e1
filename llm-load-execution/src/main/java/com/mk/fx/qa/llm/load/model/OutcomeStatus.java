package com.mk.fx.qa.llm.load.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal status of one logical request. */
public enum OutcomeStatus {
  SUCCESS("success"),
  CLIENT_ERROR("client_error"),
  SERVER_ERROR_EXHAUSTED("server_error_exhausted"),
  TIMEOUT_EXHAUSTED("timeout_exhausted"),
  TRANSPORT_ERROR_EXHAUSTED("transport_error_exhausted");

  private final String wireName;

  OutcomeStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isSuccess() {
    return this == SUCCESS;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
