package com.flamingo.ai.pitchscoop.service.analysis;

import com.flamingo.ai.pitchscoop.exception.AnalysisCapabilityException;
import com.flamingo.ai.pitchscoop.exception.MalformedAnalysisResponseException;
import java.util.List;

/** External language and embedding models. */
public interface AnalysisGateway {

  /**
   * Scores a pitch, grounded on rubric excerpts when the prompt carries them.
   *
   * @throws MalformedAnalysisResponseException if the answer does not match the score schema
   * @throws AnalysisCapabilityException if the model cannot be reached
   */
  ScoreDraft score(ScoringPrompt prompt);

  /**
   * Embeds text for the retrieval index.
   *
   * @throws AnalysisCapabilityException if the model cannot be reached
   */
  List<Float> embed(String text);
}
