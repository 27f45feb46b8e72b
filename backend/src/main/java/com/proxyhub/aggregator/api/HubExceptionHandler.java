package com.proxyhub.aggregator.api;

import com.proxyhub.aggregator.service.SubscriptionFetchException;
import com.proxyhub.aggregator.service.SubscriptionNotFoundException;
import com.proxyhub.aggregator.service.SubscriptionParseException;
import com.proxyhub.aggregator.service.SubscriptionValidationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HubExceptionHandler {

  @ExceptionHandler(SubscriptionValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(SubscriptionValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "validation_error", "message", ex.getMessage()));
  }

  @ExceptionHandler(SubscriptionNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(SubscriptionNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(SubscriptionParseException.class)
  public ResponseEntity<Map<String, String>> handleParse(SubscriptionParseException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "parse_error", "message", ex.getMessage()));
  }

  @ExceptionHandler(SubscriptionFetchException.class)
  public ResponseEntity<Map<String, String>> handleFetch(SubscriptionFetchException ex) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", "fetch_error");
    body.put("message", ex.getMessage());
    if (ex.reasonCode() != null) {
      body.put("reasonCode", ex.reasonCode());
    }
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }
}
