package com.flamingo.ai.pitchscoop.service.analysis;

/**
 * Inputs for one scoring request.
 *
 * @param rubricContext retrieved rubric excerpts, {@code null} for the fixed-rubric prompt
 */
public record ScoringPrompt(
    String teamName, String title, String transcript, String rubricContext) {

  public boolean isGrounded() {
    return rubricContext != null && !rubricContext.isBlank();
  }
}
