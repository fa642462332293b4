package com.flamingo.ai.pitchscoop.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of text held by the retrieval index. */
public enum DocumentType {
  /** Judging criteria and scoring guidance for the event. */
  RUBRIC("rubric"),

  /** Finalized transcript of a recorded pitch. */
  TRANSCRIPT("transcript"),

  /** Background information about a competing team. */
  TEAM_PROFILE("team_profile");

  private final String value;

  DocumentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static DocumentType fromValue(String value) {
    for (DocumentType type : values()) {
      if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown document type: " + value);
  }
}
