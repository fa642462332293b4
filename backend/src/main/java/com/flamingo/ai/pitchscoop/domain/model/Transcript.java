package com.flamingo.ai.pitchscoop.domain.model;

import java.util.List;

/** Ordered segments of a recording with the values derived from them. */
public record Transcript(List<TranscriptSegment> segments) {

  public Transcript {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static Transcript empty() {
    return new Transcript(List.of());
  }

  /** Segment texts joined with single spaces, in order. */
  public String totalText() {
    StringBuilder sb = new StringBuilder();
    for (TranscriptSegment segment : segments) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(segment.text());
    }
    return sb.toString();
  }

  public int wordCount() {
    String text = totalText().strip();
    return text.isEmpty() ? 0 : text.split("\\s+").length;
  }

  /** Span from the earliest start to the latest end, zero without segments. */
  public double durationSeconds() {
    if (segments.isEmpty()) {
      return 0.0;
    }
    double start = Double.MAX_VALUE;
    double end = 0.0;
    for (TranscriptSegment segment : segments) {
      start = Math.min(start, segment.startOffset());
      end = Math.max(end, segment.endOffset());
    }
    return end - start;
  }

  public boolean hasContent() {
    return !segments.isEmpty();
  }
}
