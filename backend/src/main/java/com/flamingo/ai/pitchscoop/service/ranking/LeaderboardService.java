package com.flamingo.ai.pitchscoop.service.ranking;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import com.flamingo.ai.pitchscoop.domain.enums.RankSortKey;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.model.LeaderboardSnapshot;
import com.flamingo.ai.pitchscoop.domain.model.LeaderboardStats;
import com.flamingo.ai.pitchscoop.domain.model.RankEntry;
import com.flamingo.ai.pitchscoop.domain.model.TeamStanding;
import com.flamingo.ai.pitchscoop.exception.EntityNotFoundException;
import com.flamingo.ai.pitchscoop.service.scoring.event.ScoreRecordedEvent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/** Per-tenant leaderboard snapshots, rebuilt on demand after every new score in the tenant. */
@Service
@Slf4j
public class LeaderboardService {

  private final RankingEngine rankingEngine;
  private final PitchScoopProperties properties;
  private final Clock clock;
  private final Cache<SnapshotKey, LeaderboardSnapshot> snapshots;

  /** Bumped on every score write; a rebuild started before the bump lands under a stale key. */
  private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

  @Autowired
  public LeaderboardService(RankingEngine rankingEngine, PitchScoopProperties properties) {
    this(rankingEngine, properties, Clock.systemUTC());
  }

  public LeaderboardService(
      RankingEngine rankingEngine, PitchScoopProperties properties, Clock clock) {
    this.rankingEngine = rankingEngine;
    this.properties = properties;
    this.clock = clock;
    this.snapshots =
        Caffeine.newBuilder()
            .maximumSize(properties.getRanking().getCacheMaxTenants())
            .expireAfterWrite(properties.getRanking().getCacheTtl())
            .build();
  }

  /**
   * @param tieBreak category used to break ties, {@code null} for the configured default
   * @param limit maximum number of entries, {@code 0} or less for all
   */
  public LeaderboardSnapshot leaderboard(
      String tenantId, RankSortKey sortKey, ScoreCategory tieBreak, int limit) {
    RankSortKey key = sortKey == null ? RankSortKey.TOTAL_SCORE : sortKey;
    ScoreCategory tie = tieBreak == null ? properties.getRanking().getTieBreakCategory() : tieBreak;
    LeaderboardSnapshot snapshot =
        snapshots.get(
            new SnapshotKey(tenantId, generation(tenantId).get(), key, tie),
            k -> {
              log.debug("Rebuilding leaderboard for tenant {} by {}", tenantId, key);
              return new LeaderboardSnapshot(
                  tenantId, key, rankingEngine.rank(tenantId, key, tie), clock.instant());
            });
    return snapshot.limit(limit);
  }

  /** Position of a session in the total-score ranking. */
  public TeamStanding teamRank(String tenantId, String sessionId) {
    List<RankEntry> entries = leaderboard(tenantId, RankSortKey.TOTAL_SCORE, null, 0).entries();
    return entries.stream()
        .filter(entry -> entry.sessionId().equals(sessionId))
        .findFirst()
        .map(entry -> new TeamStanding(entry, entries.size()))
        .orElseThrow(() -> new EntityNotFoundException(tenantId, "score", sessionId));
  }

  public LeaderboardStats stats(String tenantId) {
    LeaderboardSnapshot snapshot = leaderboard(tenantId, RankSortKey.TOTAL_SCORE, null, 0);
    List<RankEntry> entries = snapshot.entries();
    Map<PerformanceTier, Integer> distribution = new EnumMap<>(PerformanceTier.class);
    entries.forEach(entry -> distribution.merge(entry.tier(), 1, Integer::sum));
    if (entries.isEmpty()) {
      return new LeaderboardStats(tenantId, 0, 0.0, 0.0, 0.0, distribution, snapshot.generatedAt());
    }
    DoubleSummaryStatistics totals =
        entries.stream().mapToDouble(RankEntry::totalScore).summaryStatistics();
    return new LeaderboardStats(
        tenantId,
        entries.size(),
        totals.getMax(),
        totals.getMin(),
        totals.getAverage(),
        distribution,
        snapshot.generatedAt());
  }

  @EventListener
  public void onScoreRecorded(ScoreRecordedEvent event) {
    invalidate(event.tenantId());
  }

  public void invalidate(String tenantId) {
    generation(tenantId).incrementAndGet();
    snapshots.asMap().keySet().removeIf(key -> key.tenantId().equals(tenantId));
    log.debug("Invalidated leaderboard snapshots of tenant {}", tenantId);
  }

  private AtomicLong generation(String tenantId) {
    return generations.computeIfAbsent(tenantId, t -> new AtomicLong());
  }

  private record SnapshotKey(
      String tenantId, long generation, RankSortKey sortKey, ScoreCategory tieBreak) {}
}
