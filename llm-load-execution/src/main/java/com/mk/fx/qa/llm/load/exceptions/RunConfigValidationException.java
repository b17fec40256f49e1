package com.mk.fx.qa.llm.load.exceptions;

import java.util.List;
import lombok.Getter;

/** Malformed run configuration. Fatal: the run is never started. */
@Getter
public class RunConfigValidationException extends RuntimeException {

  private final List<String> violations;

  public RunConfigValidationException(List<String> violations) {
    super("Invalid run configuration: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }
}
