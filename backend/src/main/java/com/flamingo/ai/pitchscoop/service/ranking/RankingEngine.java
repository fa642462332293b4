package com.flamingo.ai.pitchscoop.service.ranking;

import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import com.flamingo.ai.pitchscoop.domain.enums.RankSortKey;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.model.RankEntry;
import com.flamingo.ai.pitchscoop.domain.repository.ScoreRecordRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Orders scored sessions. The ordering is total: sort key descending, then the tie-break category
 * descending, then earlier {@code scoredAt}, then session id, so equal inputs always rank the same
 * way regardless of the order the store returns them in.
 */
@Service
@RequiredArgsConstructor
public class RankingEngine {

  private final ScoreRecordRepository scoreRecordRepository;

  public List<RankEntry> rank(String tenantId, RankSortKey sortKey, ScoreCategory tieBreak) {
    return rank(scoreRecordRepository.findAllByTenant(tenantId), sortKey, tieBreak);
  }

  public static List<RankEntry> rank(
      List<ScoreRecord> records, RankSortKey sortKey, ScoreCategory tieBreak) {
    RankSortKey key = sortKey == null ? RankSortKey.TOTAL_SCORE : sortKey;
    ScoreCategory tieCategory = tieBreak == null ? ScoreCategory.TOOLS : tieBreak;

    Comparator<ScoreRecord> order =
        Comparator.comparingDouble((ScoreRecord r) -> sortValue(r, key))
            .reversed()
            .thenComparing(
                Comparator.comparingDouble((ScoreRecord r) -> r.scoreOf(tieCategory)).reversed())
            .thenComparing(
                ScoreRecord::getScoredAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(ScoreRecord::getSessionId, Comparator.nullsLast(String::compareTo));

    List<ScoreRecord> sorted = records.stream().sorted(order).toList();
    List<RankEntry> entries = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      ScoreRecord record = sorted.get(i);
      entries.add(
          new RankEntry(
              i + 1,
              record.getSessionId(),
              record.getTeamName(),
              record.getTitle(),
              record.totalScore(),
              sortValue(record, key),
              record.scoreOf(tieCategory),
              PerformanceTier.fromScore(record.totalScore())));
    }
    return entries;
  }

  private static double sortValue(ScoreRecord record, RankSortKey key) {
    return key.getCategory() == null ? record.totalScore() : record.scoreOf(key.getCategory());
  }
}
