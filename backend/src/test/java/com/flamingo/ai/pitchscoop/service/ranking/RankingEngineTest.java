package com.flamingo.ai.pitchscoop.service.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pitchscoop.domain.entity.CategoryScore;
import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import com.flamingo.ai.pitchscoop.domain.enums.RankSortKey;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.model.RankEntry;
import com.flamingo.ai.pitchscoop.domain.repository.ScoreRecordRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RankingEngine")
class RankingEngineTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private ScoreRecordRepository scoreRecordRepository;

  @Test
  @DisplayName("Should rank higher total first and assign tiers")
  void shouldRankByTotalDescending() {
    // Given
    ScoreRecord alpha = record("s-a", "Alpha", 21, 20, 20, 20, T0);
    ScoreRecord beta = record("s-b", "Beta", 20, 18, 19, 17, T0);

    // When
    List<RankEntry> ranking =
        RankingEngine.rank(List.of(beta, alpha), RankSortKey.TOTAL_SCORE, ScoreCategory.TOOLS);

    // Then
    assertThat(ranking).extracting(RankEntry::sessionId).containsExactly("s-a", "s-b");
    assertThat(ranking).extracting(RankEntry::rank).containsExactly(1, 2);
    assertThat(ranking.get(0).totalScore()).isEqualTo(81.0);
    assertThat(ranking.get(0).tier()).isEqualTo(PerformanceTier.VERY_GOOD);
    assertThat(ranking.get(1).totalScore()).isEqualTo(74.0);
  }

  @Test
  void shouldBreakEqualTotals_byToolsScore() {
    ScoreRecord fewerTools = record("s-a", "Alpha", 22, 20, 15, 18, T0);
    ScoreRecord moreTools = record("s-b", "Beta", 18, 19, 20, 18, T0);

    List<RankEntry> ranking =
        RankingEngine.rank(List.of(fewerTools, moreTools), RankSortKey.TOTAL_SCORE, null);

    assertThat(ranking).extracting(RankEntry::sessionId).containsExactly("s-b", "s-a");
    assertThat(ranking.get(0).tieBreakValue()).isEqualTo(20.0);
  }

  @Test
  void shouldBreakRemainingTies_byEarlierScoredAtThenSessionId() {
    ScoreRecord late = record("s-a", "Alpha", 20, 20, 20, 20, T0.plusSeconds(60));
    ScoreRecord early = record("s-z", "Zeta", 20, 20, 20, 20, T0);
    ScoreRecord earlySibling = record("s-m", "Mu", 20, 20, 20, 20, T0);

    List<RankEntry> ranking =
        RankingEngine.rank(
            List.of(late, early, earlySibling), RankSortKey.TOTAL_SCORE, ScoreCategory.TOOLS);

    assertThat(ranking).extracting(RankEntry::sessionId).containsExactly("s-m", "s-z", "s-a");
  }

  @Test
  void shouldSortByRequestedCategory() {
    ScoreRecord strongIdea = record("s-a", "Alpha", 25, 10, 10, 10, T0);
    ScoreRecord strongTotal = record("s-b", "Beta", 15, 20, 20, 20, T0);

    List<RankEntry> ranking =
        RankingEngine.rank(
            List.of(strongTotal, strongIdea), RankSortKey.IDEA, ScoreCategory.TOOLS);

    assertThat(ranking).extracting(RankEntry::sessionId).containsExactly("s-a", "s-b");
    assertThat(ranking.get(0).sortValue()).isEqualTo(25.0);
  }

  @Test
  void shouldProduceSameOrder_regardlessOfInputOrder() {
    // Given
    List<ScoreRecord> records = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      records.add(record("s-" + i, "Team " + i, 10 + i % 3, 15, 10 + i % 4, 12, T0));
    }
    List<String> expected =
        RankingEngine.rank(records, RankSortKey.TOTAL_SCORE, ScoreCategory.TOOLS).stream()
            .map(RankEntry::sessionId)
            .toList();

    // When
    List<ScoreRecord> shuffled = new ArrayList<>(records);
    Collections.shuffle(shuffled, new Random(42));
    List<String> actual =
        RankingEngine.rank(shuffled, RankSortKey.TOTAL_SCORE, ScoreCategory.TOOLS).stream()
            .map(RankEntry::sessionId)
            .toList();

    // Then
    assertThat(actual).isEqualTo(expected);
  }

  @Test
  void shouldReturnEmptyRanking_whenTenantHasNoScores() {
    when(scoreRecordRepository.findAllByTenant("acme")).thenReturn(List.of());

    RankingEngine engine = new RankingEngine(scoreRecordRepository);

    assertThat(engine.rank("acme", RankSortKey.TOTAL_SCORE, ScoreCategory.TOOLS)).isEmpty();
  }

  static ScoreRecord record(
      String sessionId,
      String teamName,
      double idea,
      double technical,
      double tools,
      double presentation,
      Instant scoredAt) {
    Map<ScoreCategory, CategoryScore> categories = new EnumMap<>(ScoreCategory.class);
    categories.put(ScoreCategory.IDEA, score(idea));
    categories.put(ScoreCategory.TECHNICAL, score(technical));
    categories.put(ScoreCategory.TOOLS, score(tools));
    categories.put(ScoreCategory.PRESENTATION, score(presentation));
    ScoreRecord record = ScoreRecord.of(categories, "", List.of(), List.of());
    record.setTenantId("acme");
    record.setSessionId(sessionId);
    record.setTeamName(teamName);
    record.setTitle(teamName + " pitch");
    record.setScoredAt(scoredAt);
    return record;
  }

  private static CategoryScore score(double value) {
    return CategoryScore.builder().score(value).maxScore(25.0).build();
  }
}
