package com.mk.fx.qa.llm.load.exceptions;

/** Unrecoverable failure while preparing a run, raised before any session starts. */
public class RunSetupException extends RuntimeException {

  public RunSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
