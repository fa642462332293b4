package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.domain.model.RetrievalHit;
import com.flamingo.ai.pitchscoop.exception.IndexEmptyException;
import com.flamingo.ai.pitchscoop.service.analysis.AnalysisGateway;
import com.flamingo.ai.pitchscoop.service.analysis.ScoreDraft;
import com.flamingo.ai.pitchscoop.service.analysis.ScoringPrompt;
import com.flamingo.ai.pitchscoop.service.retrieval.RetrievalIndex;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** First tier: scores against the tenant's own rubric excerpts retrieved by similarity. */
@Component
@RequiredArgsConstructor
@Slf4j
public class RagEnhancedScoringTier implements ScoringTier {

  static final String EXCERPT_SEPARATOR = "\n---\n";

  static final String SESSION_TRANSCRIPT_HEADER = "Indexed transcript of this session:\n";

  private final RetrievalIndex retrievalIndex;
  private final AnalysisGateway analysisGateway;
  private final PitchScoopProperties properties;

  @Override
  public ScoringMethod method() {
    return ScoringMethod.RAG_ENHANCED;
  }

  @Override
  public int order() {
    return 10;
  }

  @Override
  public TierResult score(ScoringContext context) {
    String tenantId = context.tenantId();
    if (retrievalIndex.count(tenantId, DocumentType.RUBRIC) == 0) {
      throw new IndexEmptyException(tenantId, DocumentType.RUBRIC);
    }

    List<RetrievalHit> rubricHits =
        retrievalIndex.query(
            tenantId,
            DocumentType.RUBRIC,
            context.transcriptText(),
            properties.getRetrieval().getTopK());
    if (rubricHits.isEmpty()) {
      throw new IndexEmptyException(tenantId, DocumentType.RUBRIC);
    }

    List<String> refs = new ArrayList<>();
    rubricHits.forEach(hit -> refs.add(hit.document().getDocId()));
    List<String> excerpts = new ArrayList<>();
    rubricHits.forEach(hit -> excerpts.add(hit.document().getText()));
    retrievalIndex
        .findByMetadata(
            tenantId,
            DocumentType.TRANSCRIPT,
            RetrievalDocument.SESSION_ID,
            context.sessionId())
        .stream()
        .findFirst()
        .ifPresent(
            doc -> {
              refs.add(doc.getDocId());
              excerpts.add(SESSION_TRANSCRIPT_HEADER + doc.getText());
            });

    String rubricContext = String.join(EXCERPT_SEPARATOR, excerpts);
    log.debug(
        "Grounding session {} in tenant {} on {} rubric excerpts",
        context.sessionId(),
        tenantId,
        rubricHits.size());

    ScoreDraft draft =
        analysisGateway.score(
            new ScoringPrompt(
                context.teamName(), context.title(), context.transcriptText(), rubricContext));
    return new TierResult(method(), draft, refs);
  }
}
