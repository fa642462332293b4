package com.flamingo.ai.pitchscoop.exception;

/**
 * Base class for every failure the pipeline reports. Carries an {@link ErrorKind} and a message
 * that is safe to show to callers; the exception message itself stays in the logs.
 */
public class PitchScoopException extends RuntimeException {

  private final ErrorKind kind;
  private final String userMessage;

  public PitchScoopException(ErrorKind kind, String message, String userMessage) {
    super(message);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  public PitchScoopException(
      ErrorKind kind, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
