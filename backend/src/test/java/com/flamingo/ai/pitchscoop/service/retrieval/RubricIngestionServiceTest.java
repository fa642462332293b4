package com.flamingo.ai.pitchscoop.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RubricIngestionService")
class RubricIngestionServiceTest {

  @Mock private RetrievalIndex retrievalIndex;

  private PitchScoopProperties properties;
  private RubricIngestionService service;
  private final AtomicInteger ids = new AtomicInteger();

  @BeforeEach
  void setUp() {
    properties = new PitchScoopProperties();
    properties.getRetrieval().setChunkSize(60);
    when(retrievalIndex.index(anyString(), any(DocumentType.class), anyString(), anyMap()))
        .thenAnswer(inv -> "doc-" + ids.incrementAndGet());
    service = new RubricIngestionService(retrievalIndex, properties);
  }

  @Test
  void shouldExtractAndChunkRubricFile() {
    // Given
    String rubric =
        "Idea: originality of the problem and solution.\n\n"
            + "Technical: quality of the implementation.\n\n"
            + "Tools: depth of sponsor tool usage.";

    // When
    List<String> docIds =
        service.ingest("acme", "rubric.txt", rubric.getBytes(StandardCharsets.UTF_8));

    // Then
    assertThat(docIds).hasSize(3);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, String>> metadata = ArgumentCaptor.forClass(Map.class);
    verify(retrievalIndex, times(3))
        .index(eq("acme"), eq(DocumentType.RUBRIC), anyString(), metadata.capture());
    assertThat(metadata.getAllValues())
        .extracting(m -> m.get(RetrievalDocument.CHUNK_INDEX))
        .containsExactly("0", "1", "2");
    assertThat(metadata.getAllValues())
        .allMatch(m -> "rubric.txt".equals(m.get(RetrievalDocument.FILE_NAME)));
  }

  @Test
  void shouldRejectEmptyFiles() {
    assertThatThrownBy(() -> service.ingest("acme", "empty.pdf", new byte[0]))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldRejectRubricWithoutText() {
    assertThatThrownBy(() -> service.ingestText("acme", "blank", "  \n\n "))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void shouldIndexTranscript_withSessionMetadata() {
    // When
    service.indexTranscript("acme", "s-1", "Acme", "we built a thing");

    // Then
    verify(retrievalIndex)
        .index(
            "acme",
            DocumentType.TRANSCRIPT,
            "we built a thing",
            Map.of(RetrievalDocument.SESSION_ID, "s-1", RetrievalDocument.TEAM_NAME, "Acme"));
  }

  @Test
  void shouldIndexTeamProfile_underTeamName() {
    service.indexTeamProfile("acme", "Acme", "Three engineers from Berlin");

    verify(retrievalIndex)
        .index(
            "acme",
            DocumentType.TEAM_PROFILE,
            "Three engineers from Berlin",
            Map.of(RetrievalDocument.TEAM_NAME, "Acme"));
  }

  @Test
  void shouldPackParagraphs_andSplitOversizedOnes() {
    // Given
    String longParagraph = "x".repeat(25);

    // When
    List<String> chunks = RubricIngestionService.chunk("a\n\nb\n\n" + longParagraph, 10);

    // Then
    assertThat(chunks).containsExactly("a\n\nb", "xxxxxxxxxx", "xxxxxxxxxx", "xxxxx");
  }
}
