package com.flamingo.ai.pitchscoop.exception;

/** Exception thrown when the external analysis (LLM or embedding) capability fails. */
public class AnalysisCapabilityException extends PitchScoopException {

  private static final String USER_MESSAGE =
      "AI analysis is temporarily unavailable. Please try again later.";

  public AnalysisCapabilityException(String message) {
    super(ErrorKind.ANALYSIS_CAPABILITY_ERROR, message, USER_MESSAGE);
  }

  public AnalysisCapabilityException(String message, Throwable cause) {
    super(ErrorKind.ANALYSIS_CAPABILITY_ERROR, message, USER_MESSAGE, cause);
  }
}
