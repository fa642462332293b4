package com.flamingo.ai.pitchscoop.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Deterministic bag-of-words vectors: equal texts embed identically, shared words overlap. */
public final class TestEmbeddings {

  public static final int DIMENSIONS = 64;

  private TestEmbeddings() {}

  public static List<Float> of(String text) {
    float[] vector = new float[DIMENSIONS];
    for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
      if (!token.isEmpty()) {
        vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1f;
      }
    }
    List<Float> result = new ArrayList<>(DIMENSIONS);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
