package com.harness.boardapi.controller;

import com.harness.boardapi.model.ErrorResponse;
import com.harness.boardapi.service.ProjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps deliberate request errors, database failures included, to JSON responses. Unexpected
 * failures are not handled here; they propagate to the crash recovery filter.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ProjectNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(ProjectNotFoundException e) {
    log.warn("Project not found. id={}", e.getProjectId());
    return respond(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
    return respond(HttpStatus.BAD_REQUEST, "Invalid ID");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return respond(HttpStatus.BAD_REQUEST, "Invalid JSON: " + e.getMostSpecificCause().getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
    String message = e.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .findFirst()
        .orElse("Invalid request body");
    return respond(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<ErrorResponse> handleDatabaseError(NestedRuntimeException e) {
    String detail = e.getMostSpecificCause().getMessage();
    log.error("Database error. cause={}", detail, e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database error: " + detail);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
  }

  private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(status.getReasonPhrase(), message));
  }
}
