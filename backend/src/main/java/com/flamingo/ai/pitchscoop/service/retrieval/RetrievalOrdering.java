package com.flamingo.ai.pitchscoop.service.retrieval;

import com.flamingo.ai.pitchscoop.domain.entity.RetrievalDocument;
import com.flamingo.ai.pitchscoop.domain.model.RetrievalHit;
import java.time.Instant;
import java.util.Comparator;

/** Result ordering shared by retrieval index implementations. */
final class RetrievalOrdering {

  /** Newest first, then by document id. */
  static final Comparator<RetrievalDocument> NEWEST_FIRST =
      Comparator.comparing(
              RetrievalDocument::getIndexedAt,
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(RetrievalDocument::getDocId);

  /** Highest similarity first; ties go to the most recently indexed document. */
  static final Comparator<RetrievalHit> BY_SIMILARITY =
      Comparator.comparingDouble(RetrievalHit::similarity)
          .reversed()
          .thenComparing(RetrievalHit::document, NEWEST_FIRST);

  private RetrievalOrdering() {}
}
