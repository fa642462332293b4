package com.flamingo.ai.pitchscoop.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

/** Lifecycle status of a recording session. */
public enum SessionStatus {
  /** Session persisted, transcription channel not yet obtained. */
  INITIALIZING("initializing"),

  /** Transcription channel open, waiting for the team to start. */
  READY_TO_RECORD("ready_to_record"),

  /** Audio is being captured and segments are arriving. */
  RECORDING("recording"),

  /** Recording stopped, transcript being finalized. */
  PROCESSING("processing"),

  /** Transcript frozen. Terminal. */
  COMPLETED("completed"),

  /** Terminal failure, any partial transcript is kept. */
  ERROR("error");

  private final String value;

  SessionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  /** Returns the statuses reachable from this one in a single transition. */
  public Set<SessionStatus> successors() {
    return switch (this) {
      case INITIALIZING -> EnumSet.of(READY_TO_RECORD, ERROR);
      case READY_TO_RECORD -> EnumSet.of(RECORDING, ERROR);
      case RECORDING -> EnumSet.of(PROCESSING, ERROR);
      case PROCESSING -> EnumSet.of(COMPLETED, ERROR);
      case COMPLETED, ERROR -> EnumSet.noneOf(SessionStatus.class);
    };
  }

  public boolean canTransitionTo(SessionStatus target) {
    return successors().contains(target);
  }

  @JsonCreator
  public static SessionStatus fromValue(String value) {
    for (SessionStatus status : values()) {
      if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown session status: " + value);
  }
}
