package com.flamingo.ai.pitchscoop.exception;

/** Exception thrown when a recording session is not found in a tenant. */
public class SessionNotFoundException extends EntityNotFoundException {

  public SessionNotFoundException(String tenantId, String sessionId) {
    super(tenantId, "session", sessionId);
  }

  public String getSessionId() {
    return getEntityId();
  }
}
