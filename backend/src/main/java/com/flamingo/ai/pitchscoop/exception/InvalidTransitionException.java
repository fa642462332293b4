package com.flamingo.ai.pitchscoop.exception;

import com.flamingo.ai.pitchscoop.domain.enums.SessionStatus;

/** Exception thrown when a session operation is not legal from its current state. */
public class InvalidTransitionException extends PitchScoopException {

  private final String sessionId;
  private final SessionStatus from;
  private final String operation;

  public InvalidTransitionException(String sessionId, SessionStatus from, String operation) {
    super(
        ErrorKind.INVALID_TRANSITION,
        String.format("Cannot %s session %s from status %s", operation, sessionId, from),
        String.format("Session cannot %s while %s", operation, from.getValue()));
    this.sessionId = sessionId;
    this.from = from;
    this.operation = operation;
  }

  public String getSessionId() {
    return sessionId;
  }

  public SessionStatus getFrom() {
    return from;
  }

  public String getOperation() {
    return operation;
  }
}
