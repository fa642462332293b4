package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.service.analysis.ScoreDraft;
import java.util.List;

/**
 * Output of a successful tier.
 *
 * @param contextRefs ids of the retrieval documents the tier grounded its answer on
 */
public record TierResult(ScoringMethod method, ScoreDraft draft, List<String> contextRefs) {

  public TierResult {
    contextRefs = contextRefs == null ? List.of() : List.copyOf(contextRefs);
  }

  public static TierResult of(ScoringMethod method, ScoreDraft draft) {
    return new TierResult(method, draft, List.of());
  }
}
