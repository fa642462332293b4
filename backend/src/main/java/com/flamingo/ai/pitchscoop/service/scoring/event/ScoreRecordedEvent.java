package com.flamingo.ai.pitchscoop.service.scoring.event;

import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import java.time.Instant;

/** Published after a score record has been committed to the store. */
public record ScoreRecordedEvent(
    String tenantId,
    String sessionId,
    ScoringMethod methodUsed,
    double totalScore,
    Instant scoredAt) {}
