package com.flamingo.ai.pitchscoop.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.domain.model.RetrievalHit;
import com.flamingo.ai.pitchscoop.domain.model.Transcript;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.exception.IndexEmptyException;
import com.flamingo.ai.pitchscoop.service.analysis.AnalysisGateway;
import com.flamingo.ai.pitchscoop.service.analysis.ScoringPrompt;
import com.flamingo.ai.pitchscoop.service.retrieval.RetrievalIndex;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RagEnhancedScoringTier")
class RagEnhancedScoringTierTest {

  @Mock private RetrievalIndex retrievalIndex;

  @Mock private AnalysisGateway analysisGateway;

  private RagEnhancedScoringTier tier;
  private ScoringContext context;

  @BeforeEach
  void setUp() {
    tier = new RagEnhancedScoringTier(retrievalIndex, analysisGateway, new PitchScoopProperties());
    context =
        new ScoringContext(
            "acme",
            "s-1",
            "Acme",
            "Demo",
            new Transcript(List.of(TranscriptSegment.of("We built Acme", 0, 2))));
  }

  @Test
  void shouldSignalEmptyIndex_withoutCallingTheModel() {
    when(retrievalIndex.count("acme", DocumentType.RUBRIC)).thenReturn(0L);

    assertThatThrownBy(() -> tier.score(context)).isInstanceOf(IndexEmptyException.class);
    verify(analysisGateway, never()).score(any());
  }

  @Test
  @DisplayName("Should ground the prompt on rubric hits and the session's indexed transcript")
  void shouldGroundPromptOnRubricHits_andIndexedTranscript() {
    // Given
    when(retrievalIndex.count("acme", DocumentType.RUBRIC)).thenReturn(2L);
    when(retrievalIndex.query("acme", DocumentType.RUBRIC, "We built Acme", 5))
        .thenReturn(List.of(hit("r1", "Reward originality"), hit("r2", "Reward live demos")));
    when(retrievalIndex.findByMetadata(
            "acme", DocumentType.TRANSCRIPT, RetrievalDocument.SESSION_ID, "s-1"))
        .thenReturn(
            List.of(
                RetrievalDocument.builder()
                    .docId("t1")
                    .text("We built Acme and demoed it live")
                    .build()));
    when(analysisGateway.score(any())).thenReturn(ScoringOrchestratorTest.draft(20, 18, 19, 17));

    // When
    TierResult result = tier.score(context);

    // Then
    assertThat(result.method()).isEqualTo(ScoringMethod.RAG_ENHANCED);
    assertThat(result.contextRefs()).containsExactly("r1", "r2", "t1");
    ArgumentCaptor<ScoringPrompt> prompt = ArgumentCaptor.forClass(ScoringPrompt.class);
    verify(analysisGateway).score(prompt.capture());
    assertThat(prompt.getValue().isGrounded()).isTrue();
    assertThat(prompt.getValue().rubricContext())
        .isEqualTo(
            String.join(
                RagEnhancedScoringTier.EXCERPT_SEPARATOR,
                "Reward originality",
                "Reward live demos",
                RagEnhancedScoringTier.SESSION_TRANSCRIPT_HEADER
                    + "We built Acme and demoed it live"));
  }

  @Test
  void shouldGroundOnRubricHitsOnly_whenTranscriptIsNotIndexed() {
    // Given
    when(retrievalIndex.count("acme", DocumentType.RUBRIC)).thenReturn(1L);
    when(retrievalIndex.query("acme", DocumentType.RUBRIC, "We built Acme", 5))
        .thenReturn(List.of(hit("r1", "Reward originality")));
    when(retrievalIndex.findByMetadata(
            "acme", DocumentType.TRANSCRIPT, RetrievalDocument.SESSION_ID, "s-1"))
        .thenReturn(List.of());
    when(analysisGateway.score(any())).thenReturn(ScoringOrchestratorTest.draft(20, 18, 19, 17));

    // When
    TierResult result = tier.score(context);

    // Then
    assertThat(result.contextRefs()).containsExactly("r1");
    ArgumentCaptor<ScoringPrompt> prompt = ArgumentCaptor.forClass(ScoringPrompt.class);
    verify(analysisGateway).score(prompt.capture());
    assertThat(prompt.getValue().rubricContext()).isEqualTo("Reward originality");
  }

  private static RetrievalHit hit(String id, String text) {
    return new RetrievalHit(RetrievalDocument.builder().docId(id).text(text).build(), 0.8);
  }
}
