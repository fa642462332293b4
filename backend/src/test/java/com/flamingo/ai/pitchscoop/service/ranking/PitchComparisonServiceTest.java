package com.flamingo.ai.pitchscoop.service.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.model.PitchComparison;
import com.flamingo.ai.pitchscoop.domain.model.PitchComparison.CategoryLeader;
import com.flamingo.ai.pitchscoop.domain.model.RankEntry;
import com.flamingo.ai.pitchscoop.domain.repository.ScoreRecordRepository;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PitchComparisonService")
class PitchComparisonServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private ScoreRecordRepository scoreRecordRepository;

  private PitchComparisonService comparisonService;

  @BeforeEach
  void setUp() {
    when(scoreRecordRepository.findBySessionId(eq("acme"), anyString()))
        .thenReturn(Optional.empty());
    when(scoreRecordRepository.findBySessionId("acme", "s-1"))
        .thenReturn(Optional.of(RankingEngineTest.record("s-1", "Beta", 20, 18, 19, 17, NOW)));
    when(scoreRecordRepository.findBySessionId("acme", "s-2"))
        .thenReturn(Optional.of(RankingEngineTest.record("s-2", "Alpha", 21, 20, 20, 20, NOW)));
    when(scoreRecordRepository.findBySessionId("acme", "s-3"))
        .thenReturn(Optional.of(RankingEngineTest.record("s-3", "Gamma", 10, 10, 24, 10, NOW)));
    comparisonService =
        new PitchComparisonService(scoreRecordRepository, new PitchScoopProperties());
  }

  @Test
  @DisplayName("Should rank compared pitches and name the strongest team per category")
  void shouldRankPitches_andNameCategoryLeaders() {
    // When
    PitchComparison comparison =
        comparisonService.compare("acme", List.of("s-1", "s-2", "s-3"), null);

    // Then
    assertThat(comparison.standings())
        .extracting(RankEntry::teamName)
        .containsExactly("Alpha", "Beta", "Gamma");
    assertThat(comparison.leaders()).hasSize(4);
    CategoryLeader tools = comparison.leaders().get(ScoreCategory.TOOLS);
    assertThat(tools.teamName()).isEqualTo("Gamma");
    assertThat(tools.score()).isEqualTo(24.0);
    assertThat(tools.marginOverNext()).isEqualTo(4.0);
    assertThat(comparison.leaders().get(ScoreCategory.IDEA).sessionId()).isEqualTo("s-2");
    assertThat(comparison.scoreSpread()).isEqualTo(81.0 - 54.0);
    assertThat(comparison.competitionLevel()).isEqualTo(PerformanceTier.GOOD);
    assertThat(comparison.missingSessionIds()).isEmpty();
  }

  @Test
  void shouldCompareOnlyRequestedCategories() {
    PitchComparison comparison =
        comparisonService.compare(
            "acme", List.of("s-1", "s-2"), List.of(ScoreCategory.PRESENTATION));

    assertThat(comparison.leaders()).containsOnlyKeys(ScoreCategory.PRESENTATION);
    assertThat(comparison.leaders().get(ScoreCategory.PRESENTATION).marginOverNext())
        .isEqualTo(3.0);
  }

  @Test
  void shouldReportUnscoredSessions_asMissing() {
    PitchComparison comparison =
        comparisonService.compare("acme", List.of("s-1", "s-7", "s-2"), null);

    assertThat(comparison.standings()).hasSize(2);
    assertThat(comparison.missingSessionIds()).containsExactly("s-7");
  }

  @Test
  void shouldReject_whenFewerThanTwoSessionsAreScored() {
    assertThatThrownBy(() -> comparisonService.compare("acme", List.of("s-1", "s-7"), null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldReject_duplicateIdsCountingAsOneSession() {
    assertThatThrownBy(() -> comparisonService.compare("acme", List.of("s-1", "s-1"), null))
        .isInstanceOf(ValidationException.class);
    verify(scoreRecordRepository, never()).findBySessionId(anyString(), anyString());
  }

  @Test
  void shouldReject_moreThanTenSessions() {
    List<String> ids = IntStream.rangeClosed(1, 11).mapToObj(i -> "s-" + i).toList();

    assertThatThrownBy(() -> comparisonService.compare("acme", ids, null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("got 11");
  }

  @Test
  void shouldNotReadScoresOfAnotherTenant() {
    assertThatThrownBy(() -> comparisonService.compare("globex", List.of("s-1", "s-2"), null))
        .isInstanceOf(ValidationException.class);
  }
}
