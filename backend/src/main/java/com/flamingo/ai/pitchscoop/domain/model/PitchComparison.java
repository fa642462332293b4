package com.flamingo.ai.pitchscoop.domain.model;

import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import java.util.List;
import java.util.Map;

/**
 * Side-by-side view of several scored pitches of one tenant.
 *
 * @param standings compared sessions ranked among themselves by total score
 * @param leaders strongest session per compared category
 * @param scoreSpread highest minus lowest total among the compared sessions
 * @param competitionLevel tier of the average total
 * @param missingSessionIds requested sessions that have no score yet
 */
public record PitchComparison(
    String tenantId,
    List<RankEntry> standings,
    Map<ScoreCategory, CategoryLeader> leaders,
    double scoreSpread,
    PerformanceTier competitionLevel,
    List<String> missingSessionIds) {

  public PitchComparison {
    standings = List.copyOf(standings);
    leaders = Map.copyOf(leaders);
    missingSessionIds = List.copyOf(missingSessionIds);
  }

  /**
   * @param marginOverNext lead over the runner-up in the category, {@code 0} on a tie
   */
  public record CategoryLeader(
      ScoreCategory category,
      String sessionId,
      String teamName,
      double score,
      double marginOverNext) {}
}
