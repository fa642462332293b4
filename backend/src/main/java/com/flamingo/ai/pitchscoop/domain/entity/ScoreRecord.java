package com.flamingo.ai.pitchscoop.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Scoring result for one session. At most one exists per session and tenant; re-scoring replaces
 * it.
 *
 * <p>Category scores are fixed at construction and the total is always their sum, whatever a
 * stored overall section says.
 */
@Getter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoreRecord {

  @Setter private String tenantId;

  @Setter private String sessionId;

  @Setter private String teamName;

  @Setter private String title;

  private CategoryScore idea;

  private CategoryScore technical;

  private CategoryScore tools;

  private CategoryScore presentation;

  private OverallAssessment overall;

  @Setter private ScoringMethod methodUsed;

  @Setter private Instant scoredAt;

  @Setter private String judgeId;

  @Setter @Builder.Default private List<String> scoringContextRefs = List.of();

  public CategoryScore category(ScoreCategory category) {
    return switch (category) {
      case IDEA -> idea;
      case TECHNICAL -> technical;
      case TOOLS -> tools;
      case PRESENTATION -> presentation;
    };
  }

  public double scoreOf(ScoreCategory category) {
    CategoryScore cs = category(category);
    return cs == null ? 0.0 : cs.getScore();
  }

  public double totalScore() {
    double total = 0.0;
    for (ScoreCategory category : ScoreCategory.values()) {
      total += scoreOf(category);
    }
    return total;
  }

  public OverallAssessment getOverall() {
    if (overall == null) {
      return null;
    }
    return new OverallAssessment(
        totalScore(), overall.getFeedback(), overall.getStrengths(), overall.getImprovements());
  }

  /**
   * Builds a record whose overall total is the sum of the given category scores.
   *
   * @param categories one entry per {@link ScoreCategory}
   */
  public static ScoreRecord of(
      Map<ScoreCategory, CategoryScore> categories,
      String feedback,
      List<String> strengths,
      List<String> improvements) {
    double total = 0.0;
    for (ScoreCategory category : ScoreCategory.values()) {
      CategoryScore cs = categories.get(category);
      if (cs == null) {
        throw new IllegalArgumentException("Missing score for category " + category.getKey());
      }
      total += cs.getScore();
    }
    return ScoreRecord.builder()
        .idea(categories.get(ScoreCategory.IDEA))
        .technical(categories.get(ScoreCategory.TECHNICAL))
        .tools(categories.get(ScoreCategory.TOOLS))
        .presentation(categories.get(ScoreCategory.PRESENTATION))
        .overall(
            OverallAssessment.builder()
                .totalScore(total)
                .feedback(feedback == null ? "" : feedback)
                .strengths(strengths == null ? List.of() : List.copyOf(strengths))
                .improvements(improvements == null ? List.of() : List.copyOf(improvements))
                .build())
        .build();
  }
}
