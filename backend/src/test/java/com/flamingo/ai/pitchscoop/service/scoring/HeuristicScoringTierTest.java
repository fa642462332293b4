package com.flamingo.ai.pitchscoop.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.CategoryScore;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.domain.model.Transcript;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HeuristicScoringTier")
class HeuristicScoringTierTest {

  private final HeuristicScoringTier tier = new HeuristicScoringTier(new PitchScoopProperties());

  @Test
  void shouldScoreEmptyTranscript_withinRange() {
    // When
    TierResult result = tier.score(context(Transcript.empty()));

    // Then
    assertThat(result.method()).isEqualTo(ScoringMethod.HEURISTIC);
    assertAllInRange(result);
    assertThat(result.draft().categories().get(ScoreCategory.TOOLS).getScore()).isEqualTo(5.0);
  }

  @Test
  void shouldRewardSponsorTools_andOnPaceDelivery() {
    // Given: 28 words over 12 seconds is 140 wpm
    String words =
        "Our live demo shows the problem and solution using OpenAI Redis and Gladia "
            + "with a vector pipeline architecture that keeps latency low for every customer "
            + "today at scale";
    Transcript transcript = new Transcript(List.of(TranscriptSegment.of(words, 0, 12)));

    // When
    TierResult result = tier.score(context(transcript));

    // Then
    assertAllInRange(result);
    assertThat(result.draft().categories().get(ScoreCategory.TOOLS).getScore()).isEqualTo(20.0);
    assertThat(result.draft().strengths()).contains("Comfortable speaking pace");
    assertThat(result.draft().categories().get(ScoreCategory.PRESENTATION).getScore())
        .isGreaterThan(15.0);
  }

  @Test
  void shouldBeDeterministic() {
    Transcript transcript =
        new Transcript(List.of(TranscriptSegment.of("We use Elasticsearch for search", 0, 3)));

    assertThat(tier.score(context(transcript)).draft())
        .isEqualTo(tier.score(context(transcript)).draft());
  }

  @Test
  void shouldClampVeryLongTranscripts_toMaximum() {
    // Given
    String keywordSoup =
        String.join(
            " ",
            Collections.nCopies(
                400,
                "problem solution customer users market unique innovative opportunity "
                    + "architecture api model database pipeline embedding vector agent"));
    Transcript transcript = new Transcript(List.of(TranscriptSegment.of(keywordSoup, 0, 60)));

    // When
    TierResult result = tier.score(context(transcript));

    // Then
    assertAllInRange(result);
    assertThat(result.draft().categories().get(ScoreCategory.IDEA).getScore()).isEqualTo(25.0);
  }

  @Test
  void shouldMapToolMentions_toSteppedScores() {
    assertThat(HeuristicScoringTier.toolScore(0)).isEqualTo(5.0);
    assertThat(HeuristicScoringTier.toolScore(1)).isEqualTo(10.0);
    assertThat(HeuristicScoringTier.toolScore(2)).isEqualTo(15.0);
    assertThat(HeuristicScoringTier.toolScore(3)).isEqualTo(20.0);
  }

  @Test
  void shouldAcceptPaceWithinTwentyPercent() {
    assertThat(HeuristicScoringTier.isOnPace(150, 150)).isTrue();
    assertThat(HeuristicScoringTier.isOnPace(180, 150)).isTrue();
    assertThat(HeuristicScoringTier.isOnPace(181, 150)).isFalse();
    assertThat(HeuristicScoringTier.isOnPace(0, 150)).isFalse();
  }

  private static void assertAllInRange(TierResult result) {
    assertThat(result.draft().categories()).hasSize(ScoreCategory.values().length);
    for (CategoryScore score : result.draft().categories().values()) {
      assertThat(score.getScore()).isBetween(0.0, ScoreCategory.MAX_SCORE);
    }
  }

  private static ScoringContext context(Transcript transcript) {
    return new ScoringContext("acme", "s-1", "Acme", "Demo", transcript);
  }
}
