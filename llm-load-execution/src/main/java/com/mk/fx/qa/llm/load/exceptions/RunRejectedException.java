package com.mk.fx.qa.llm.load.exceptions;

/** A run could not be accepted, e.g. because the concurrent run limit is reached. */
public class RunRejectedException extends RuntimeException {

  public RunRejectedException(String message) {
    super(message);
  }
}
