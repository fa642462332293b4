package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.exception.PitchScoopException;
import com.flamingo.ai.pitchscoop.service.retrieval.RubricIngestionService;
import com.flamingo.ai.pitchscoop.service.session.SessionService;
import com.flamingo.ai.pitchscoop.service.session.event.SessionCompletedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Follows up on completed sessions: indexes the frozen transcript and, when enabled, scores the
 * session. Runs on the pipeline event pool so completion never waits on the language model.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScoringEventsListener {

  private final SessionService sessionService;
  private final RubricIngestionService ingestionService;
  private final ScoringOrchestrator scoringOrchestrator;
  private final PitchScoopProperties properties;
  private final MeterRegistry meterRegistry;

  @Async("pipelineEventExecutor")
  @EventListener
  public void onSessionCompleted(SessionCompletedEvent event) {
    String tenantId = event.tenantId();
    String sessionId = event.sessionId();
    RecordingSession session = sessionService.get(tenantId, sessionId);

    if (session.getTranscript().hasContent()) {
      try {
        ingestionService.indexTranscript(
            tenantId, sessionId, session.getTeamName(), session.getTranscript().totalText());
      } catch (PitchScoopException e) {
        // scoring still works without the transcript document
        meterRegistry.counter("pipeline.transcript.index.failure").increment();
        log.warn(
            "Could not index transcript of session {} in tenant {}: {}",
            sessionId,
            tenantId,
            e.getMessage());
      }
    }

    if (!properties.getScoring().isAutoScoreOnComplete()) {
      return;
    }
    try {
      scoringOrchestrator.scoreSession(tenantId, sessionId, null);
    } catch (PitchScoopException e) {
      meterRegistry.counter("pipeline.autoscore.failure").increment();
      log.error(
          "Automatic scoring of session {} in tenant {} failed [{}]: {}",
          sessionId,
          tenantId,
          e.getKind(),
          e.getMessage());
    }
  }
}
