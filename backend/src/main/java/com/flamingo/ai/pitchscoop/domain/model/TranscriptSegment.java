package com.flamingo.ai.pitchscoop.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pitchscoop.exception.ValidationException;

/**
 * One recognised stretch of speech. Offsets are seconds from the start of the recording.
 *
 * @param text recognised text, never blank
 * @param startOffset start of the segment, {@code >= 0}
 * @param endOffset end of the segment, {@code >= startOffset}
 * @param confidence recogniser confidence in {@code [0, 1]}, or {@code null} when not reported
 * @param isFinal whether the provider marked the segment final
 */
public record TranscriptSegment(
    String text,
    double startOffset,
    double endOffset,
    Double confidence,
    @JsonProperty("isFinal") boolean isFinal) {

  public TranscriptSegment {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Transcript segment text must not be blank");
    }
    if (!Double.isFinite(startOffset) || !Double.isFinite(endOffset)) {
      throw new ValidationException("Transcript segment offsets must be finite");
    }
    if (startOffset < 0 || endOffset < 0) {
      throw new ValidationException("Transcript segment offsets must not be negative");
    }
    if (endOffset < startOffset) {
      throw new ValidationException(
          String.format(
              "Transcript segment ends (%.2fs) before it starts (%.2fs)", endOffset, startOffset));
    }
    if (confidence != null && !(confidence >= 0.0 && confidence <= 1.0)) {
      throw new ValidationException("Transcript segment confidence must be within [0, 1]");
    }
    text = text.strip();
  }

  public static TranscriptSegment of(String text, double startOffset, double endOffset) {
    return new TranscriptSegment(text, startOffset, endOffset, null, true);
  }

  public double duration() {
    return endOffset - startOffset;
  }
}
