package com.flamingo.ai.pitchscoop.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.enums.DocumentType;
import com.flamingo.ai.pitchscoop.domain.model.RetrievalHit;
import com.flamingo.ai.pitchscoop.exception.StorageUnavailableException;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import com.flamingo.ai.pitchscoop.service.analysis.AnalysisGateway;
import com.flamingo.ai.pitchscoop.service.retrieval.RetrievalIndex;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Retrieval index on Elasticsearch. Each tenant and document type gets its own index, created on
 * first insert, with a cosine {@code dense_vector} field; every query also filters on the tenant
 * id.
 */
@Service
@ConditionalOnProperty(name = "pitchscoop.retrieval.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchRetrievalIndex implements RetrievalIndex {

  static final String FIELD_TENANT = "tenantId";
  static final String FIELD_TYPE = "documentType";
  static final String FIELD_TEXT = "text";
  static final String FIELD_EMBEDDING = "embedding";
  static final String FIELD_METADATA = "metadata";
  static final String FIELD_INDEXED_AT = "indexedAt";

  private final ElasticsearchClient elasticsearchClient;
  private final AnalysisGateway analysisGateway;
  private final MeterRegistry meterRegistry;
  private final String indexPrefix;
  private final int vectorDimensions;
  private final Clock clock;
  private final Set<String> knownIndices = ConcurrentHashMap.newKeySet();

  @Autowired
  public ElasticsearchRetrievalIndex(
      ElasticsearchClient elasticsearchClient,
      AnalysisGateway analysisGateway,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry) {
    this(elasticsearchClient, analysisGateway, properties, meterRegistry, Clock.systemUTC());
  }

  public ElasticsearchRetrievalIndex(
      ElasticsearchClient elasticsearchClient,
      AnalysisGateway analysisGateway,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.elasticsearchClient = elasticsearchClient;
    this.analysisGateway = analysisGateway;
    this.meterRegistry = meterRegistry;
    this.indexPrefix = properties.getRetrieval().getIndexPrefix();
    this.vectorDimensions = properties.getRetrieval().getEmbeddingDimensions();
    this.clock = clock;
  }

  /** Index name for a tenant partition: {@code {prefix}-{tenant}-{type}}, lower-cased. */
  String indexName(String tenantId, DocumentType documentType) {
    String raw = indexPrefix + "-" + tenantId + "-" + documentType.getValue();
    return raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_\\-]", "_");
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index a retrieval document")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "indexFallback")
  public String index(
      String tenantId, DocumentType documentType, String text, Map<String, String> metadata) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Cannot index blank " + documentType.getValue() + " text");
    }
    String indexName = indexName(tenantId, documentType);
    String docId = UUID.randomUUID().toString();
    List<Float> embedding = analysisGateway.embed(text);

    Map<String, Object> source = new LinkedHashMap<>();
    source.put(FIELD_TENANT, tenantId);
    source.put(FIELD_TYPE, documentType.getValue());
    source.put(FIELD_TEXT, text);
    source.put(FIELD_EMBEDDING, embedding);
    source.put(FIELD_METADATA, metadata == null ? Map.of() : new HashMap<>(metadata));
    source.put(FIELD_INDEXED_AT, clock.millis());

    try {
      ensureIndex(indexName);
      elasticsearchClient.index(
          i -> i.index(indexName).id(docId).document(source).refresh(Refresh.WaitFor));
    } catch (IOException e) {
      log.error("Failed to index document into {}: {}", indexName, e.getMessage(), e);
      throw new StorageUnavailableException("Failed to index document into " + indexName, e);
    }
    meterRegistry.counter("retrieval.indexed", "type", documentType.getValue()).increment();
    log.debug("Indexed {} document {} into {}", documentType.getValue(), docId, indexName);
    return docId;
  }

  @SuppressWarnings("unused")
  private String indexFallback(
      String tenantId,
      DocumentType documentType,
      String text,
      Map<String, String> metadata,
      Throwable t) {
    meterRegistry.counter("retrieval.index.fallback").increment();
    if (t instanceof RuntimeException re && !(t instanceof CallNotPermittedException)) {
      throw re;
    }
    throw new StorageUnavailableException(
        "Elasticsearch unavailable while indexing for tenant " + tenantId, t);
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "queryFallback")
  public List<RetrievalHit> query(
      String tenantId, DocumentType documentType, String queryText, int topK) {
    if (topK <= 0) {
      return List.of();
    }
    String indexName = indexName(tenantId, documentType);
    try {
      if (!indexExists(indexName)) {
        return List.of();
      }
      List<Float> queryEmbedding = analysisGateway.embed(queryText);
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .knn(
                          k ->
                              k.field(FIELD_EMBEDDING)
                                  .queryVector(queryEmbedding)
                                  .k(topK)
                                  .numCandidates(Math.max(topK * 4, 20))
                                  .filter(tenantFilter(tenantId)))
                      .size(topK),
              Map.class);

      List<RetrievalHit> hits = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        RetrievalDocument document = toDocument(hit);
        if (document != null) {
          hits.add(new RetrievalHit(document, toCosine(hit.score())));
        }
      }
      hits.sort(
          Comparator.comparingDouble(RetrievalHit::similarity)
              .reversed()
              .thenComparing(
                  h -> h.document().getIndexedAt(),
                  Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
      meterRegistry.counter("retrieval.query", "type", documentType.getValue()).increment();
      return hits;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", indexName, e.getMessage(), e);
      throw new StorageUnavailableException("Vector search failed for " + indexName, e);
    }
  }

  @SuppressWarnings("unused")
  private List<RetrievalHit> queryFallback(
      String tenantId, DocumentType documentType, String queryText, int topK, Throwable t) {
    log.warn(
        "Retrieval query fallback for tenant {} ({}): {}",
        tenantId,
        documentType.getValue(),
        t.getMessage());
    meterRegistry.counter("retrieval.query.fallback").increment();
    return List.of();
  }

  @Override
  public List<RetrievalDocument> findByMetadata(
      String tenantId, DocumentType documentType, String key, String value) {
    String indexName = indexName(tenantId, documentType);
    try {
      if (!indexExists(indexName)) {
        return List.of();
      }
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      b.filter(tenantFilter(tenantId))
                                          .filter(
                                              f ->
                                                  f.term(
                                                      t ->
                                                          t.field(FIELD_METADATA + "." + key)
                                                              .value(FieldValue.of(value))))))
                      .sort(so -> so.field(fs -> fs.field(FIELD_INDEXED_AT).order(SortOrder.Desc)))
                      .size(100),
              Map.class);
      List<RetrievalDocument> documents = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        RetrievalDocument document = toDocument(hit);
        if (document != null) {
          documents.add(document);
        }
      }
      return documents;
    } catch (IOException e) {
      throw new StorageUnavailableException("Metadata lookup failed for " + indexName, e);
    }
  }

  @Override
  public long count(String tenantId, DocumentType documentType) {
    String indexName = indexName(tenantId, documentType);
    try {
      if (!indexExists(indexName)) {
        return 0;
      }
      return elasticsearchClient
          .count(c -> c.index(indexName).query(tenantFilter(tenantId)))
          .count();
    } catch (IOException e) {
      throw new StorageUnavailableException("Count failed for " + indexName, e);
    }
  }

  private Query tenantFilter(String tenantId) {
    return Query.of(q -> q.term(t -> t.field(FIELD_TENANT).value(FieldValue.of(tenantId))));
  }

  private boolean indexExists(String indexName) throws IOException {
    if (knownIndices.contains(indexName)) {
      return true;
    }
    boolean exists = elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
    if (exists) {
      knownIndices.add(indexName);
    }
    return exists;
  }

  private void ensureIndex(String indexName) throws IOException {
    if (indexExists(indexName)) {
      return;
    }
    Map<String, Property> properties = new HashMap<>();
    properties.put(FIELD_TENANT, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_TYPE, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_TEXT, Property.of(p -> p.text(t -> t)));
    properties.put(FIELD_METADATA, Property.of(p -> p.flattened(f -> f)));
    properties.put(FIELD_INDEXED_AT, Property.of(p -> p.long_(l -> l)));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p -> p.denseVector(d -> d.dims(vectorDimensions).index(true).similarity("cosine"))));
    try {
      elasticsearchClient
          .indices()
          .create(
              c ->
                  c.index(indexName)
                      .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
      log.info("Created Elasticsearch index: {}", indexName);
    } catch (ElasticsearchException e) {
      // another node created it first
      if (!"resource_already_exists_exception".equals(e.error().type())) {
        throw e;
      }
    }
    knownIndices.add(indexName);
  }

  @SuppressWarnings("unchecked")
  private RetrievalDocument toDocument(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    if (source == null) {
      return null;
    }
    Map<String, String> metadata = new HashMap<>();
    Object rawMetadata = source.get(FIELD_METADATA);
    if (rawMetadata instanceof Map<?, ?> map) {
      map.forEach((k, v) -> metadata.put(String.valueOf(k), String.valueOf(v)));
    }
    List<Float> embedding = new ArrayList<>();
    Object rawEmbedding = source.get(FIELD_EMBEDDING);
    if (rawEmbedding instanceof List<?> values) {
      for (Object v : values) {
        embedding.add(((Number) v).floatValue());
      }
    }
    Object indexedAt = source.get(FIELD_INDEXED_AT);
    return RetrievalDocument.builder()
        .docId(hit.id())
        .tenantId((String) source.get(FIELD_TENANT))
        .documentType(DocumentType.fromValue((String) source.get(FIELD_TYPE)))
        .text((String) source.get(FIELD_TEXT))
        .embedding(embedding)
        .metadata(metadata)
        .indexedAt(
            indexedAt instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null)
        .build();
  }

  /** Elasticsearch reports cosine kNN scores as {@code (1 + cos) / 2}. */
  static double toCosine(Double score) {
    return score == null ? 0.0 : 2.0 * score - 1.0;
  }
}
