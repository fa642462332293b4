package com.flamingo.ai.pitchscoop.domain.model;

import com.flamingo.ai.pitchscoop.domain.enums.RankSortKey;
import java.time.Instant;
import java.util.List;

/** Cached ranking of a tenant. */
public record LeaderboardSnapshot(
    String tenantId, RankSortKey sortKey, List<RankEntry> entries, Instant generatedAt) {

  public LeaderboardSnapshot {
    entries = List.copyOf(entries);
  }

  public LeaderboardSnapshot limit(int limit) {
    if (limit <= 0 || limit >= entries.size()) {
      return this;
    }
    return new LeaderboardSnapshot(tenantId, sortKey, entries.subList(0, limit), generatedAt);
  }
}
