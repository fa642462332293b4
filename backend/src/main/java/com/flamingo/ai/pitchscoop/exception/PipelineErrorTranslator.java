package com.flamingo.ai.pitchscoop.exception;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps exceptions raised inside the pipeline to {@link ApiError}s. Only the user message and the
 * error code cross the boundary; the exception itself is logged under the error id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineErrorTranslator {

  static final String GENERIC_MESSAGE = "An unexpected error occurred. Please try again later.";

  static final String INVALID_REQUEST_MESSAGE =
      "The request contained an invalid value. Please check it and try again.";

  private final MeterRegistry meterRegistry;

  public ApiError translate(String operation, Throwable throwable) {
    Throwable ex = unwrap(throwable);
    String errorId = generateErrorId();

    if (ex instanceof PitchScoopException pse) {
      ErrorKind kind = pse.getKind();
      incrementErrorCounter(kind);
      logFailure(errorId, operation, pse);
      return build(errorId, operation, kind, pse.getUserMessage());
    }

    if (ex instanceof IllegalArgumentException) {
      incrementErrorCounter(ErrorKind.VALIDATION_ERROR);
      log.warn("Validation error [{}] in {}: {}", errorId, operation, ex.getMessage(), ex);
      return build(errorId, operation, ErrorKind.VALIDATION_ERROR, INVALID_REQUEST_MESSAGE);
    }

    incrementErrorCounter(ErrorKind.INTERNAL_ERROR);
    log.error("Unexpected error [{}] in {}: {}", errorId, operation, ex.getMessage(), ex);
    return build(errorId, operation, ErrorKind.INTERNAL_ERROR, GENERIC_MESSAGE);
  }

  private void logFailure(String errorId, String operation, PitchScoopException ex) {
    switch (ex.getKind()) {
      case NOT_FOUND, INVALID_TRANSITION, ALREADY_SCORING, VALIDATION_ERROR, INDEX_EMPTY ->
          log.warn("{} [{}] in {}: {}", ex.getKind(), errorId, operation, ex.getMessage());
      default ->
          log.error("{} [{}] in {}: {}", ex.getKind(), errorId, operation, ex.getMessage(), ex);
    }
  }

  private ApiError build(String errorId, String operation, ErrorKind kind, String message) {
    return ApiError.builder()
        .errorId(errorId)
        .kind(kind)
        .code(kind.getCode())
        .message(message)
        .operation(operation)
        .timestamp(Instant.now())
        .build();
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private void incrementErrorCounter(ErrorKind kind) {
    meterRegistry
        .counter("pipeline_errors_total", "error_type", kind.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
