package com.flamingo.ai.pitchscoop.service.retrieval;

import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.domain.model.RetrievalHit;
import java.util.List;
import java.util.Map;

/**
 * Vector index partitioned by tenant and document type. Partitions are created on first insert;
 * documents are immutable and re-indexing the same text adds a new document.
 */
public interface RetrievalIndex {

  /**
   * Embeds and stores a document.
   *
   * @return the new document id
   */
  String index(
      String tenantId, DocumentType documentType, String text, Map<String, String> metadata);

  /**
   * Returns up to {@code topK} documents by descending cosine similarity to {@code queryText},
   * newest first among equal similarities. An empty partition yields an empty list.
   */
  List<RetrievalHit> query(
      String tenantId, DocumentType documentType, String queryText, int topK);

  /** Documents whose metadata has {@code key = value}, newest first. */
  List<RetrievalDocument> findByMetadata(
      String tenantId, DocumentType documentType, String key, String value);

  /** Number of documents in a partition; zero when it was never created. */
  long count(String tenantId, DocumentType documentType);
}
