package com.coshare.api.error;

import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class SharedAccountExceptionHandler {

  @ExceptionHandler(SharedAccountException.class)
  public ResponseEntity<Map<String, Object>> handleRejected(SharedAccountException ex) {
    return ResponseEntity.status(statusOf(ex.kind())).body(Map.of(
        "status", "error",
        "reason", ex.reason(),
        "message", ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }

  static HttpStatus statusOf(FailureKind kind) {
    return switch (kind) {
      case NOT_FOUND, NO_CAPABILITY -> HttpStatus.NOT_FOUND;
      case NOT_ADMIN, WRONG_TARGET -> HttpStatus.FORBIDDEN;
      case ALREADY_INITIALIZED, ALREADY_EXISTS, ALREADY_LISTED, NOT_LISTED, ALREADY_HOLDING_CAPABILITY ->
          HttpStatus.CONFLICT;
      case NOT_INITIALIZED -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }
}
