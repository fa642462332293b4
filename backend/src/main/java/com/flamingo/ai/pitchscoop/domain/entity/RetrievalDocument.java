package com.flamingo.ai.pitchscoop.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Text with its embedding, stored in a tenant's retrieval index. Never updated in place. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetrievalDocument {

  public static final String SESSION_ID = "session_id";
  public static final String TEAM_NAME = "team_name";
  public static final String FILE_NAME = "file_name";
  public static final String CHUNK_INDEX = "chunk_index";

  private String docId;

  private String tenantId;

  private DocumentType documentType;

  private String text;

  private List<Float> embedding;

  @Builder.Default private Map<String, String> metadata = Map.of();

  private Instant indexedAt;
}
