package com.mk.fx.qa.llm.load.model;

public enum RunStatus {
  RUNNING,
  COMPLETED,
  STOPPED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
