package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.service.analysis.AnalysisGateway;
import com.flamingo.ai.pitchscoop.service.analysis.ScoringPrompt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Second tier: the fixed rubric prompt on the transcript alone. */
@Component
@RequiredArgsConstructor
public class StructuredLlmScoringTier implements ScoringTier {

  private final AnalysisGateway analysisGateway;

  @Override
  public ScoringMethod method() {
    return ScoringMethod.STRUCTURED_LLM;
  }

  @Override
  public int order() {
    return 20;
  }

  @Override
  public TierResult score(ScoringContext context) {
    return TierResult.of(
        method(),
        analysisGateway.score(
            new ScoringPrompt(
                context.teamName(), context.title(), context.transcriptText(), null)));
  }
}
