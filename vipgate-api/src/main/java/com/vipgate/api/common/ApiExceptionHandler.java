package com.vipgate.api.common;

import com.vipgate.api.config.TelegramProperties;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final String supportContact;

  public ApiExceptionHandler(TelegramProperties telegram) {
    this.supportContact = telegram.supportContact();
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "bad_request",
        "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
        "status", "error",
        "reason", "not_found",
        "message", ex.getMessage() == null ? "not_found" : ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }

  /**
   * A concurrent writer (webhook or sweep) changed the record first. The caller re-reads and retries.
   */
  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<Map<String, Object>> conflict(ObjectOptimisticLockingFailureException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
        "status", "error",
        "reason", "concurrent_update",
        "message", "record changed, reload and retry",
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler({
      HttpMessageNotReadableException.class,
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<Map<String, Object>> malformed(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "malformed_request",
        "message", "request body or parameters could not be read",
        "ts", Instant.now().toString()
    ));
  }

  /**
   * Last resort. Framework errors keep their own status; anything else is a 500 that points the
   * caller to support instead of leaking internals.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
    HttpStatusCode status = HttpStatus.INTERNAL_SERVER_ERROR;
    if (ex instanceof ErrorResponse er) {
      status = er.getStatusCode();
    } else {
      log.error("Unhandled API error", ex);
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", status.is5xxServerError() ? "internal_error" : "request_failed");
    body.put("message", status.is5xxServerError()
        ? "Something went wrong. Please try again later" + (supportContact == null ? "." : " or contact " + supportContact + ".")
        : "request_failed");
    body.put("ts", Instant.now().toString());
    return ResponseEntity.status(status).body(body);
  }
}
