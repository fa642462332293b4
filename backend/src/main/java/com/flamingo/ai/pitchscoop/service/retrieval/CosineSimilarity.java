package com.flamingo.ai.pitchscoop.service.retrieval;

import java.util.List;

/** Cosine similarity between embedding vectors. */
public final class CosineSimilarity {

  private CosineSimilarity() {}

  /** Returns the cosine of the angle between the vectors, 0 when either has no magnitude. */
  public static double between(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
