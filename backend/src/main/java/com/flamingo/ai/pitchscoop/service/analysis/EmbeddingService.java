package com.flamingo.ai.pitchscoop.service.analysis;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings with the configured embedding model. Queries and indexed documents go
 * through the same path, so a document queried with its own text is its own nearest neighbour.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense transcripts
  static final int MAX_CHARS_PER_EMBEDDING = 6000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @Timed(value = "embedding.embed", description = "Time to embed text")
  public List<Float> embed(String text) {
    String input = truncate(text == null ? "" : text);
    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success").increment();
    return toFloatList(response.content().vector());
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
