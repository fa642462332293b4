package com.flamingo.ai.pitchscoop.service.ranking;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import com.flamingo.ai.pitchscoop.domain.enums.RankSortKey;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.model.PitchComparison;
import com.flamingo.ai.pitchscoop.domain.model.PitchComparison.CategoryLeader;
import com.flamingo.ai.pitchscoop.domain.model.RankEntry;
import com.flamingo.ai.pitchscoop.domain.repository.ScoreRecordRepository;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Compares the stored scores of a handful of sessions within one tenant. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PitchComparisonService {

  static final int MIN_SESSIONS = 2;
  static final int MAX_SESSIONS = 10;

  private final ScoreRecordRepository scoreRecordRepository;
  private final PitchScoopProperties properties;

  /**
   * Ranks the requested sessions among themselves and names the strongest one per category.
   * Sessions without a score are reported as missing; at least two must be scored.
   *
   * @param criteria categories to compare, {@code null} or empty for all of them
   * @throws ValidationException when fewer than two or more than ten distinct sessions are given,
   *     or fewer than two of them are scored
   */
  public PitchComparison compare(
      String tenantId, List<String> sessionIds, List<ScoreCategory> criteria) {
    Set<String> requested = sessionIds == null ? Set.of() : new LinkedHashSet<>(sessionIds);
    if (requested.size() < MIN_SESSIONS || requested.size() > MAX_SESSIONS) {
      throw new ValidationException(
          String.format(
              "Between %d and %d distinct sessions can be compared, got %d",
              MIN_SESSIONS, MAX_SESSIONS, requested.size()));
    }

    List<ScoreRecord> scored = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    for (String sessionId : requested) {
      Optional<ScoreRecord> record = scoreRecordRepository.findBySessionId(tenantId, sessionId);
      record.ifPresentOrElse(scored::add, () -> missing.add(sessionId));
    }
    if (scored.size() < MIN_SESSIONS) {
      throw new ValidationException(
          "At least " + MIN_SESSIONS + " scored sessions are needed to compare pitches");
    }

    List<ScoreCategory> categories =
        criteria == null || criteria.isEmpty() ? List.of(ScoreCategory.values()) : criteria;
    Map<ScoreCategory, CategoryLeader> leaders = new EnumMap<>(ScoreCategory.class);
    for (ScoreCategory category : categories) {
      leaders.put(category, leaderOf(scored, category));
    }

    List<RankEntry> standings =
        RankingEngine.rank(
            scored, RankSortKey.TOTAL_SCORE, properties.getRanking().getTieBreakCategory());
    double highest = standings.get(0).totalScore();
    double lowest = standings.get(standings.size() - 1).totalScore();
    double average = standings.stream().mapToDouble(RankEntry::totalScore).average().orElse(0.0);
    log.debug(
        "Compared {} sessions in tenant {} ({} unscored)", scored.size(), tenantId, missing.size());
    return new PitchComparison(
        tenantId,
        standings,
        leaders,
        highest - lowest,
        PerformanceTier.fromScore(average),
        missing);
  }

  private static CategoryLeader leaderOf(List<ScoreRecord> records, ScoreCategory category) {
    List<ScoreRecord> ordered =
        records.stream()
            .sorted(
                Comparator.comparingDouble((ScoreRecord r) -> r.scoreOf(category))
                    .reversed()
                    .thenComparing(
                        ScoreRecord::getSessionId, Comparator.nullsLast(String::compareTo)))
            .toList();
    ScoreRecord best = ordered.get(0);
    double margin = best.scoreOf(category) - ordered.get(1).scoreOf(category);
    return new CategoryLeader(
        category, best.getSessionId(), best.getTeamName(), best.scoreOf(category), margin);
  }
}
