package com.flamingo.ai.pitchscoop.service.analysis;

import com.flamingo.ai.pitchscoop.domain.entity.CategoryScore;
import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import java.util.List;
import java.util.Map;

/**
 * Validated category scores produced by a scoring tier, not yet bound to a session.
 *
 * @param categories one entry per {@link ScoreCategory}, each within {@code [0, maxScore]}
 */
public record ScoreDraft(
    Map<ScoreCategory, CategoryScore> categories,
    String overallFeedback,
    List<String> strengths,
    List<String> improvements) {

  public ScoreDraft {
    categories = Map.copyOf(categories);
    strengths = strengths == null ? List.of() : List.copyOf(strengths);
    improvements = improvements == null ? List.of() : List.copyOf(improvements);
    overallFeedback = overallFeedback == null ? "" : overallFeedback;
  }

  public double totalScore() {
    return categories.values().stream().mapToDouble(CategoryScore::getScore).sum();
  }

  /** Record with the total derived from the categories; session fields are left for the caller. */
  public ScoreRecord toRecord() {
    return ScoreRecord.of(categories, overallFeedback, strengths, improvements);
  }
}
