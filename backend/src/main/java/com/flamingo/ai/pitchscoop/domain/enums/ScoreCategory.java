package com.flamingo.ai.pitchscoop.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Judging categories. Each is scored out of {@link #MAX_SCORE}. */
public enum ScoreCategory {
  /** Unique value proposition and vertical-specific agent design. */
  IDEA("idea", "Idea"),

  /** Novel tool use and technical sophistication. */
  TECHNICAL("technical", "Technical Implementation"),

  /** Integration of three or more sponsor tools for agentic behaviour. */
  TOOLS("tools", "Tool Use"),

  /** Clear three-minute demo with impact demonstration. */
  PRESENTATION("presentation", "Presentation");

  public static final double MAX_SCORE = 25.0;

  private final String key;
  private final String displayName;

  ScoreCategory(String key, String displayName) {
    this.key = key;
    this.displayName = displayName;
  }

  @JsonValue
  public String getKey() {
    return key;
  }

  public String getDisplayName() {
    return displayName;
  }

  /** Maximum attainable total across all categories. */
  public static double maxTotal() {
    return MAX_SCORE * values().length;
  }

  @JsonCreator
  public static ScoreCategory fromKey(String key) {
    for (ScoreCategory category : values()) {
      if (category.key.equalsIgnoreCase(key) || category.name().equalsIgnoreCase(key)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown score category: " + key);
  }
}
