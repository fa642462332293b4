package com.flamingo.ai.pitchscoop.exception;

/** Exception thrown when a session is already being scored and the policy rejects joiners. */
public class AlreadyScoringException extends PitchScoopException {

  private final String sessionId;

  public AlreadyScoringException(String tenantId, String sessionId) {
    super(
        ErrorKind.ALREADY_SCORING,
        String.format("Session %s in tenant %s is already being scored", sessionId, tenantId),
        "This pitch is already being scored. Please retry shortly.");
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
