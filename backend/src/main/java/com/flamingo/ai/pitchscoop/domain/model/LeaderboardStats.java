package com.flamingo.ai.pitchscoop.domain.model;

import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of a tenant's scores. With no scored sessions every score is {@code 0} and every tier
 * counts {@code 0}.
 *
 * @param distribution number of sessions per performance tier, one key per tier
 */
public record LeaderboardStats(
    String tenantId,
    int totalTeams,
    double highestScore,
    double lowestScore,
    double averageScore,
    Map<PerformanceTier, Integer> distribution,
    Instant generatedAt) {

  public LeaderboardStats {
    Map<PerformanceTier, Integer> counts = new EnumMap<>(PerformanceTier.class);
    for (PerformanceTier tier : PerformanceTier.values()) {
      counts.put(tier, distribution == null ? 0 : distribution.getOrDefault(tier, 0));
    }
    distribution = Map.copyOf(counts);
  }
}
