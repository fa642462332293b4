package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.CategoryScore;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.service.analysis.ScoreDraft;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Last tier: deterministic scores computed locally from word count, speaking rate and keyword
 * presence. Never calls out and never fails; every category lands in {@code [0, 25]}.
 */
@Component
@ConditionalOnProperty(
    prefix = "pitchscoop.scoring",
    name = "heuristic-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class HeuristicScoringTier implements ScoringTier {

  static final List<String> IDEA_TERMS =
      List.of(
          "problem", "solution", "customer", "users", "market", "unique", "innovative",
          "opportunity");

  static final List<String> TECHNICAL_TERMS =
      List.of(
          "architecture", "api", "model", "database", "pipeline", "embedding", "vector",
          "agent", "scalable", "latency", "real-time");

  static final List<String> DELIVERY_TERMS =
      List.of("demo", "impact", "results", "live", "show you");

  /** Allowed deviation from the target speaking rate before the pace bonus shrinks. */
  static final double PACE_TOLERANCE = 0.20;

  private final PitchScoopProperties properties;

  @Override
  public ScoringMethod method() {
    return ScoringMethod.HEURISTIC;
  }

  @Override
  public int order() {
    return 100;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  @Override
  public TierResult score(ScoringContext context) {
    TranscriptStatistics stats = TranscriptStatistics.of(context.transcript());
    PitchScoopProperties.Scoring config = properties.getScoring();

    int ideaHits = stats.countMentions(IDEA_TERMS);
    int technicalHits = stats.countMentions(TECHNICAL_TERMS);
    int toolHits = stats.countMentions(config.getSponsorTools());
    int deliveryHits = stats.countMentions(DELIVERY_TERMS);
    boolean onPace = isOnPace(stats.wordsPerMinute(), config.getTargetWordsPerMinute());

    double idea = 8 + Math.min(10.0, stats.wordCount() / 40.0) + 1.5 * ideaHits;
    double technical = 8 + 1.5 * technicalHits + Math.min(5.0, stats.wordCount() / 100.0);
    double tools = toolScore(toolHits);
    double presentation = 10 + 2.0 * deliveryHits + (onPace ? 5 : 2);

    Map<ScoreCategory, CategoryScore> categories = new EnumMap<>(ScoreCategory.class);
    categories.put(
        ScoreCategory.IDEA,
        category(idea, "Estimated from length and " + ideaHits + " problem/solution cues"));
    categories.put(
        ScoreCategory.TECHNICAL,
        category(technical, technicalHits + " technical terms mentioned"));
    categories.put(
        ScoreCategory.TOOLS, category(tools, toolHits + " sponsor tools mentioned"));
    categories.put(
        ScoreCategory.PRESENTATION,
        category(
            presentation,
            String.format(
                "Speaking rate %.0f wpm (target %d)",
                stats.wordsPerMinute(), config.getTargetWordsPerMinute())));

    List<String> strengths = new ArrayList<>();
    List<String> improvements = new ArrayList<>();
    if (toolHits >= 2) {
      strengths.add("Uses several sponsor tools");
    } else {
      improvements.add("Integrate and mention more sponsor tools");
    }
    if (onPace) {
      strengths.add("Comfortable speaking pace");
    } else {
      improvements.add("Aim for about " + config.getTargetWordsPerMinute() + " words per minute");
    }

    log.debug(
        "Heuristic score for session {}: {} words, {} wpm, {} tools",
        context.sessionId(),
        stats.wordCount(),
        Math.round(stats.wordsPerMinute()),
        toolHits);
    return TierResult.of(
        method(),
        new ScoreDraft(
            categories,
            "Estimated locally from the transcript; AI analysis was unavailable.",
            strengths,
            improvements));
  }

  static double toolScore(int toolHits) {
    return switch (toolHits) {
      case 0 -> 5;
      case 1 -> 10;
      case 2 -> 15;
      default -> 20 + 2.5 * (toolHits - 3);
    };
  }

  static boolean isOnPace(double wordsPerMinute, int target) {
    return wordsPerMinute > 0 && Math.abs(wordsPerMinute - target) <= target * PACE_TOLERANCE;
  }

  private static CategoryScore category(double raw, String feedback) {
    double clamped = Math.max(0.0, Math.min(ScoreCategory.MAX_SCORE, raw));
    return CategoryScore.builder()
        .score(Math.round(clamped * 10.0) / 10.0)
        .maxScore(ScoreCategory.MAX_SCORE)
        .feedback(feedback)
        .build();
  }
}
