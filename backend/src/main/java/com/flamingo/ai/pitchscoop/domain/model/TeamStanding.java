package com.flamingo.ai.pitchscoop.domain.model;

/**
 * Where one team stands in its tenant's total-score ranking.
 *
 * @param totalTeams number of scored sessions in the tenant
 */
public record TeamStanding(RankEntry entry, int totalTeams) {}
