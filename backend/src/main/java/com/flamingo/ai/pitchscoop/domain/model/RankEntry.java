package com.flamingo.ai.pitchscoop.domain.model;

import com.flamingo.ai.pitchscoop.domain.enums.PerformanceTier;

/**
 * Position of one scored session in a tenant ranking.
 *
 * @param sortValue value of the requested sort key
 * @param tieBreakValue score in the tie-break category
 */
public record RankEntry(
    int rank,
    String sessionId,
    String teamName,
    String title,
    double totalScore,
    double sortValue,
    double tieBreakValue,
    PerformanceTier tier) {}
