package com.mk.fx.qa.llm.load.resource;

import com.mk.fx.qa.llm.load.cfg.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, message));
  }

  public ResponseEntity<ErrorResponse> notFound(String message) {
    return error(HttpStatus.NOT_FOUND, "Not Found", message);
  }

  public <T> ResponseEntity<T> accepted(T body) {
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
  }
}
