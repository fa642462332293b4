package com.flamingo.ai.pitchscoop.service.retrieval;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.domain.enums.EntityType;
import com.flamingo.ai.pitchscoop.domain.model.RetrievalHit;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import com.flamingo.ai.pitchscoop.service.analysis.AnalysisGateway;
import com.flamingo.ai.pitchscoop.store.TenantDocumentMapper;
import com.flamingo.ai.pitchscoop.store.TenantEntry;
import com.flamingo.ai.pitchscoop.store.TenantStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Retrieval index kept in the tenant store under {@code {tenant}:index:{type}:{docId}}. Queries
 * compute exact cosine similarity over the whole partition, which suits event-sized corpora.
 */
@Service
@ConditionalOnProperty(
    name = "pitchscoop.retrieval.backend",
    havingValue = "store",
    matchIfMissing = true)
@Slf4j
public class StoreBackedRetrievalIndex implements RetrievalIndex {

  private final TenantStore tenantStore;
  private final TenantDocumentMapper mapper;
  private final AnalysisGateway analysisGateway;
  private final PitchScoopProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public StoreBackedRetrievalIndex(
      TenantStore tenantStore,
      TenantDocumentMapper mapper,
      AnalysisGateway analysisGateway,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry) {
    this(tenantStore, mapper, analysisGateway, properties, meterRegistry, Clock.systemUTC());
  }

  public StoreBackedRetrievalIndex(
      TenantStore tenantStore,
      TenantDocumentMapper mapper,
      AnalysisGateway analysisGateway,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.tenantStore = tenantStore;
    this.mapper = mapper;
    this.analysisGateway = analysisGateway;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  @Timed(value = "retrieval.index", description = "Time to embed and index a document")
  public String index(
      String tenantId, DocumentType documentType, String text, Map<String, String> metadata) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Cannot index blank " + documentType.getValue() + " text");
    }
    RetrievalDocument document =
        RetrievalDocument.builder()
            .docId(UUID.randomUUID().toString())
            .tenantId(tenantId)
            .documentType(documentType)
            .text(text)
            .embedding(analysisGateway.embed(text))
            .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
            .indexedAt(clock.instant())
            .build();

    tenantStore.put(
        tenantId,
        EntityType.INDEX,
        entityId(documentType, document.getDocId()),
        mapper.write(document),
        properties.getStore().getIndexTtl());
    meterRegistry.counter("retrieval.indexed", "type", documentType.getValue()).increment();
    log.debug(
        "Indexed {} document {} for tenant {}",
        documentType.getValue(),
        document.getDocId(),
        tenantId);
    return document.getDocId();
  }

  @Override
  @Timed(value = "retrieval.query", description = "Time to query the retrieval index")
  public List<RetrievalHit> query(
      String tenantId, DocumentType documentType, String queryText, int topK) {
    if (topK <= 0) {
      return List.of();
    }
    List<RetrievalDocument> documents = load(tenantId, documentType);
    if (documents.isEmpty()) {
      return List.of();
    }

    List<Float> queryEmbedding = analysisGateway.embed(queryText);
    List<RetrievalHit> hits = new ArrayList<>(documents.size());
    for (RetrievalDocument document : documents) {
      hits.add(
          new RetrievalHit(
              document, CosineSimilarity.between(queryEmbedding, document.getEmbedding())));
    }
    hits.sort(RetrievalOrdering.BY_SIMILARITY);
    meterRegistry.counter("retrieval.query", "type", documentType.getValue()).increment();
    return List.copyOf(hits.subList(0, Math.min(topK, hits.size())));
  }

  @Override
  public List<RetrievalDocument> findByMetadata(
      String tenantId, DocumentType documentType, String key, String value) {
    List<RetrievalDocument> matches = new ArrayList<>();
    for (RetrievalDocument document : load(tenantId, documentType)) {
      Map<String, String> metadata = document.getMetadata();
      if (metadata != null && value != null && value.equals(metadata.get(key))) {
        matches.add(document);
      }
    }
    matches.sort(RetrievalOrdering.NEWEST_FIRST);
    return matches;
  }

  @Override
  public long count(String tenantId, DocumentType documentType) {
    long count = 0;
    for (TenantEntry ignored : scan(tenantId, documentType)) {
      count++;
    }
    return count;
  }

  private List<RetrievalDocument> load(String tenantId, DocumentType documentType) {
    List<RetrievalDocument> documents = new ArrayList<>();
    for (TenantEntry entry : scan(tenantId, documentType)) {
      documents.add(mapper.read(entry.value(), RetrievalDocument.class));
    }
    return documents;
  }

  private Iterable<TenantEntry> scan(String tenantId, DocumentType documentType) {
    return tenantStore.scanPrefix(tenantId, EntityType.INDEX, documentType.getValue() + ":");
  }

  private static String entityId(DocumentType documentType, String docId) {
    return documentType.getValue() + ":" + docId;
  }
}
