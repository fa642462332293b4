package com.flamingo.ai.pitchscoop.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Leaderboard band derived from a total score. */
public enum PerformanceTier {
  EXCELLENT("excellent", 85),
  VERY_GOOD("very_good", 70),
  GOOD("good", 55),
  NEEDS_IMPROVEMENT("needs_improvement", 0);

  private final String value;
  private final double threshold;

  PerformanceTier(String value, double threshold) {
    this.value = value;
    this.threshold = threshold;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public double getThreshold() {
    return threshold;
  }

  public static PerformanceTier fromScore(double totalScore) {
    for (PerformanceTier tier : values()) {
      if (totalScore >= tier.threshold) {
        return tier;
      }
    }
    return NEEDS_IMPROVEMENT;
  }
}
