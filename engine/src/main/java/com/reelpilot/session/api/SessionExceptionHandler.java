package com.reelpilot.session.api;

import com.reelpilot.session.service.ActiveSessionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SessionExceptionHandler {

  @ExceptionHandler(ActiveSessionException.class)
  public ResponseEntity<Map<String, String>> handleActiveSession(ActiveSessionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_session", "message", ex.getMessage()));
  }
}
