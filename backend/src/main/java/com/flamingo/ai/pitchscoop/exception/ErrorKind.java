package com.flamingo.ai.pitchscoop.exception;

/** Error kinds surfaced by the pipeline. Each maps to a stable {@link ApiError} code. */
public enum ErrorKind {
  /** Illegal state machine call. Always a caller bug, never retried. */
  INVALID_TRANSITION("SESSION_002"),

  /** Entity absent in the tenant. */
  NOT_FOUND("ENTITY_001"),

  /** Transient storage failure, already retried with backoff by the store. */
  STORAGE_UNAVAILABLE("STORAGE_001"),

  /** Concurrent scoring conflict for the same session. Caller should retry later. */
  ALREADY_SCORING("SCORING_001"),

  /** External analysis capability failed and no fallback produced a result. */
  ANALYSIS_CAPABILITY_ERROR("LLM_001"),

  /** Retrieval index has no documents. Internal signal to skip the RAG tier. */
  INDEX_EMPTY("SEARCH_001"),

  /** Speech-to-text provider failure. */
  TRANSCRIPTION_ERROR("STT_001"),

  /** Invalid input such as a blank team name or a malformed segment. */
  VALIDATION_ERROR("VALIDATION_001"),

  INTERNAL_ERROR("INTERNAL_001");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
