package com.flamingo.ai.pitchscoop.domain.model;

import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;

/** A retrieval document with its cosine similarity to the query. */
public record RetrievalHit(RetrievalDocument document, double similarity) {}
