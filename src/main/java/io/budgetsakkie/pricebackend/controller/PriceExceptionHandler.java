package io.budgetsakkie.pricebackend.controller;

import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.budgetsakkie.pricebackend.controller")
public class PriceExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PriceExceptionHandler.class);

  @ExceptionHandler(PriceRequestException.class)
  public ResponseEntity<Map<String, Object>> onInvalidRequest(PriceRequestException e) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getError());
    body.put("message", e.getMessage());
    if (e.getExample() != null) body.put("example", e.getExample());
    body.put("timestamp", Instant.now().toEpochMilli());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    ServerWebInputException.class
  })
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Invalid parameter");
    body.put("message", e.getMessage() == null ? "Invalid request" : e.getMessage());
    body.put("timestamp", Instant.now().toEpochMilli());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("price comparison failed", e);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Failed to fetch price comparison");
    body.put("message", e.getMessage() == null ? "Internal server error" : e.getMessage());
    body.put("timestamp", Instant.now().toEpochMilli());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }
}
