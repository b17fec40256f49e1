package com.mk.fx.qa.llm.load.executors.request;

import com.mk.fx.qa.llm.load.model.OutcomeStatus;

/** Classification of a single HTTP attempt. */
public enum AttemptKind {
  SUCCESS(false, OutcomeStatus.SUCCESS),
  CLIENT_ERROR(false, OutcomeStatus.CLIENT_ERROR),
  SERVER_ERROR(true, OutcomeStatus.SERVER_ERROR_EXHAUSTED),
  TIMEOUT(true, OutcomeStatus.TIMEOUT_EXHAUSTED),
  TRANSPORT_ERROR(true, OutcomeStatus.TRANSPORT_ERROR_EXHAUSTED);

  private final boolean retryable;
  private final OutcomeStatus terminalStatus;

  AttemptKind(boolean retryable, OutcomeStatus terminalStatus) {
    this.retryable = retryable;
    this.terminalStatus = terminalStatus;
  }

  public boolean isRetryable() {
    return retryable;
  }

  /** Status reported when this kind is the final attempt of a request. */
  public OutcomeStatus terminalStatus() {
    return terminalStatus;
  }
}
