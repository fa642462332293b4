package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.domain.model.Transcript;

/** Immutable view of a completed session handed to every scoring tier. */
public record ScoringContext(
    String tenantId, String sessionId, String teamName, String title, Transcript transcript) {

  public static ScoringContext from(RecordingSession session) {
    return new ScoringContext(
        session.getTenantId(),
        session.getSessionId(),
        session.getTeamName(),
        session.getTitle(),
        session.getTranscript());
  }

  public String transcriptText() {
    return transcript.totalText();
  }
}
