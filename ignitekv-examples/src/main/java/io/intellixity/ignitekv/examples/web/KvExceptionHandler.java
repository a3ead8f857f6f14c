package io.intellixity.ignitekv.examples.web;

import io.intellixity.ignitekv.store.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class KvExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(KvExceptionHandler.class);

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, String>> notFound(NotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e);
  }

  @ExceptionHandler({ValueTooLargeException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
    return error(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler({BackendException.class, NotInitializedException.class})
  public ResponseEntity<Map<String, String>> unavailable(KvStoreException e) {
    log.warn("ignitekv.examples store unavailable: {}", e.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, e);
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    return ResponseEntity.status(status).body(Map.of("error", e.getClass().getSimpleName(), "message", message));
  }
}
