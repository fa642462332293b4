package com.flamingo.ai.pitchscoop.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured error returned across the pipeline boundary. */
@Getter
@Builder
public class ApiError {

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Error kind, for callers that branch on the failure. */
  private final ErrorKind kind;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Pipeline operation that failed. */
  private final String operation;
}
