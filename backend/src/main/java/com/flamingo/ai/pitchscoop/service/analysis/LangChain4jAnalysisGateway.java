package com.flamingo.ai.pitchscoop.service.analysis;

import com.flamingo.ai.pitchscoop.agent.PitchScoringAgent;
import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.exception.AnalysisCapabilityException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Analysis gateway on LangChain4j: the scoring agent plus the embedding service. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jAnalysisGateway implements AnalysisGateway {

  private final PitchScoringAgent pitchScoringAgent;
  private final EmbeddingService embeddingService;
  private final ScoreResponseParser scoreResponseParser;
  private final PitchScoopProperties properties;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "analysis.score", description = "Time to score a pitch with the LLM")
  @CircuitBreaker(name = "openai", fallbackMethod = "scoreFallback")
  public ScoreDraft score(ScoringPrompt prompt) {
    String sponsorTools = String.join(", ", properties.getScoring().getSponsorTools());
    String mode = prompt.isGrounded() ? "grounded" : "structured";
    log.debug(
        "Requesting {} score for team '{}' ({} transcript chars)",
        mode,
        prompt.teamName(),
        prompt.transcript().length());

    String raw;
    try {
      raw =
          prompt.isGrounded()
              ? pitchScoringAgent.scoreWithRubric(
                  prompt.rubricContext(),
                  prompt.teamName(),
                  prompt.title(),
                  prompt.transcript(),
                  sponsorTools)
              : pitchScoringAgent.scoreStructured(
                  prompt.teamName(), prompt.title(), prompt.transcript(), sponsorTools);
    } catch (RuntimeException e) {
      throw new AnalysisCapabilityException("Scoring model call failed: " + e.getMessage(), e);
    }

    ScoreDraft draft = scoreResponseParser.parse(raw);
    meterRegistry.counter("analysis.score.success", "mode", mode).increment();
    return draft;
  }

  @Override
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public List<Float> embed(String text) {
    try {
      return embeddingService.embed(text);
    } catch (RuntimeException e) {
      throw new AnalysisCapabilityException("Embedding model call failed: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unused")
  private ScoreDraft scoreFallback(ScoringPrompt prompt, Throwable t) {
    meterRegistry.counter("analysis.score.failure").increment();
    throw asAnalysisFailure("Scoring", t);
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    meterRegistry.counter("embedding.requests.failure").increment();
    throw asAnalysisFailure("Embedding", t);
  }

  private AnalysisCapabilityException asAnalysisFailure(String operation, Throwable t) {
    if (t instanceof AnalysisCapabilityException ace) {
      return ace;
    }
    log.error("{} unavailable, circuit breaker rejected the call: {}", operation, t.getMessage());
    return new AnalysisCapabilityException(operation + " unavailable: " + t.getMessage(), t);
  }
}
