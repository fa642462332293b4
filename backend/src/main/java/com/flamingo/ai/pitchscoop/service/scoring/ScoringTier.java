package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;

/**
 * One strategy in the scoring fallback chain. The orchestrator tries tiers in ascending
 * {@link #order()} and stops at the first one that returns.
 */
public interface ScoringTier {

  ScoringMethod method();

  int order();

  /**
   * Whether the tier is a pure in-process computation. Local tiers run on the caller's thread so
   * a scoring pool held up by slow remote tiers can never starve them.
   */
  default boolean isLocal() {
    return false;
  }

  /**
   * Scores the session.
   *
   * @throws RuntimeException any failure; the orchestrator moves on to the next tier
   */
  TierResult score(ScoringContext context);
}
