package com.flamingo.ai.pitchscoop.service.retrieval;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Service;

/**
 * Loads judging rubrics, team profiles and finished transcripts into the retrieval index. Rubric
 * files of any format Tika understands are reduced to plain text and split into paragraph
 * windows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RubricIngestionService {

  private static final Tika TIKA = new Tika();

  private final RetrievalIndex retrievalIndex;
  private final PitchScoopProperties properties;

  /**
   * Extracts text from a rubric file and indexes it.
   *
   * @return ids of the indexed chunks, in document order
   */
  public List<String> ingest(String tenantId, String fileName, byte[] content) {
    if (content == null || content.length == 0) {
      throw new ValidationException("Rubric file " + fileName + " is empty");
    }
    String text;
    try {
      text = TIKA.parseToString(new ByteArrayInputStream(content));
    } catch (IOException | TikaException e) {
      log.error("Tika extraction failed for rubric {}: {}", fileName, e.getMessage());
      throw new ValidationException("Could not extract text from " + fileName);
    }
    return ingestText(tenantId, fileName, text);
  }

  public List<String> ingestText(String tenantId, String sourceName, String text) {
    List<String> chunks = chunk(text == null ? "" : text, properties.getRetrieval().getChunkSize());
    if (chunks.isEmpty()) {
      throw new ValidationException("Rubric " + sourceName + " contains no text");
    }
    List<String> docIds = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      docIds.add(
          retrievalIndex.index(
              tenantId,
              DocumentType.RUBRIC,
              chunks.get(i),
              Map.of(
                  RetrievalDocument.FILE_NAME, sourceName,
                  RetrievalDocument.CHUNK_INDEX, String.valueOf(i))));
    }
    log.info("Indexed rubric {} for tenant {} as {} chunks", sourceName, tenantId, docIds.size());
    return docIds;
  }

  public String indexTeamProfile(String tenantId, String teamName, String profileText) {
    if (teamName == null || teamName.isBlank()) {
      throw new ValidationException("Team name is required");
    }
    String docId =
        retrievalIndex.index(
            tenantId,
            DocumentType.TEAM_PROFILE,
            profileText,
            Map.of(RetrievalDocument.TEAM_NAME, teamName));
    log.info("Indexed profile of team '{}' for tenant {}", teamName, tenantId);
    return docId;
  }

  /** Indexes a completed session's transcript so the grounded scoring tier can cite it. */
  public String indexTranscript(
      String tenantId, String sessionId, String teamName, String transcriptText) {
    String docId =
        retrievalIndex.index(
            tenantId,
            DocumentType.TRANSCRIPT,
            transcriptText,
            Map.of(
                RetrievalDocument.SESSION_ID, sessionId,
                RetrievalDocument.TEAM_NAME, teamName == null ? "" : teamName));
    log.info("Indexed transcript of session {} for tenant {} as {}", sessionId, tenantId, docId);
    return docId;
  }

  /** Packs blank-line separated paragraphs into windows of at most {@code maxChars}. */
  static List<String> chunk(String text, int maxChars) {
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String paragraph : text.split("\\n\\s*\\n+")) {
      String p = paragraph.strip();
      if (p.isEmpty()) {
        continue;
      }
      if (current.length() > 0 && current.length() + p.length() + 2 > maxChars) {
        chunks.add(current.toString());
        current.setLength(0);
      }
      if (p.length() > maxChars) {
        for (int i = 0; i < p.length(); i += maxChars) {
          chunks.add(p.substring(i, Math.min(p.length(), i + maxChars)).strip());
        }
        continue;
      }
      if (current.length() > 0) {
        current.append("\n\n");
      }
      current.append(p);
    }
    if (current.length() > 0) {
      chunks.add(current.toString());
    }
    return chunks;
  }
}
