package com.github.spud.intake.interfaces.rest;

import com.github.spud.intake.domain.conversation.ThreadNotFoundException;
import com.github.spud.intake.domain.dispatch.ToolLoopExceededException;
import com.github.spud.intake.domain.dispatch.TurnTimeoutException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String RETRY_MESSAGE = "I'm sorry, I couldn't complete that request right now."
    + " Please try again in a moment.";

  @Data
  @Builder
  public static class ErrorResponse {
    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(ThreadNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleThreadNotFound(ThreadNotFoundException e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("THREAD_NOT_FOUND")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
  }

  @ExceptionHandler(ToolLoopExceededException.class)
  public ResponseEntity<ErrorResponse> handleToolLoopExceeded(ToolLoopExceededException e) {
    log.warn("Turn aborted: {}", e.getMessage());
    return unavailable("TOOL_LOOP_EXCEEDED");
  }

  @ExceptionHandler(TurnTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTurnTimeout(TurnTimeoutException e) {
    log.warn("Turn aborted: {}", e.getMessage());
    return unavailable("TURN_TIMEOUT");
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }

    ErrorResponse error = ErrorResponse.builder()
        .code("VALIDATION_ERROR")
        .message("Request validation failed")
        .timestamp(OffsetDateTime.now())
        .details(Map.of("fieldErrors", fieldErrors))
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
  public ResponseEntity<ErrorResponse> handleBadInput(Exception e) {
    ErrorResponse error = ErrorResponse.builder()
        .code("INVALID_ARGUMENT")
        .message(e.getMessage())
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    ErrorResponse error = ErrorResponse.builder()
        .code("INTERNAL_ERROR")
        .message("An unexpected error occurred. Please try again later.")
        .timestamp(OffsetDateTime.now())
        .details(Map.of("exception", e.getClass().getSimpleName()))
        .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }

  private ResponseEntity<ErrorResponse> unavailable(String code) {
    ErrorResponse error = ErrorResponse.builder()
        .code(code)
        .message(RETRY_MESSAGE)
        .timestamp(OffsetDateTime.now())
        .build();
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
  }
}
