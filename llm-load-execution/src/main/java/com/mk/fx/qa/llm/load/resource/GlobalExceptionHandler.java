package com.mk.fx.qa.llm.load.resource;

import com.mk.fx.qa.llm.load.cfg.ErrorResponse;
import com.mk.fx.qa.llm.load.exceptions.RunConfigValidationException;
import com.mk.fx.qa.llm.load.exceptions.RunRejectedException;
import com.mk.fx.qa.llm.load.exceptions.RunSetupException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(RunConfigValidationException.class)
  public ResponseEntity<ErrorResponse> handleInvalidConfig(RunConfigValidationException ex) {
    log.warn("Rejected run configuration: {}", ex.getViolations());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Invalid Configuration", String.join("; ", ex.getViolations())));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
    var details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    log.warn("Invalid run request: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Configuration", details));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    log.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Invalid Argument", "Invalid value for " + ex.getName()));
  }

  @ExceptionHandler(RunRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejected(RunRejectedException ex) {
    log.warn("Run rejected: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse("Run Rejected", ex.getMessage()));
  }

  @ExceptionHandler(RunSetupException.class)
  public ResponseEntity<ErrorResponse> handleSetup(RunSetupException ex) {
    log.error("Run setup failed: {}", ex.getMessage(), ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Run Setup Failed", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }
}
