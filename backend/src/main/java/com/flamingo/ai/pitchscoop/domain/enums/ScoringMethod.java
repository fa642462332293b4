package com.flamingo.ai.pitchscoop.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Scoring tier that produced a score record. */
public enum ScoringMethod {
  RAG_ENHANCED("rag_enhanced"),
  STRUCTURED_LLM("structured_llm"),
  HEURISTIC("heuristic");

  private final String value;

  ScoringMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ScoringMethod fromValue(String value) {
    for (ScoringMethod method : values()) {
      if (method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown scoring method: " + value);
  }
}
