package com.flamingo.ai.pitchscoop.exception;

import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import java.util.List;

/**
 * Exception thrown when the speech-to-text provider fails. May carry the segments recovered
 * before the failure.
 */
public class TranscriptionException extends PitchScoopException {

  private final List<TranscriptSegment> partialSegments;

  public TranscriptionException(String message) {
    this(message, List.of(), null);
  }

  public TranscriptionException(String message, Throwable cause) {
    this(message, List.of(), cause);
  }

  public TranscriptionException(
      String message, List<TranscriptSegment> partialSegments, Throwable cause) {
    super(
        ErrorKind.TRANSCRIPTION_ERROR,
        message,
        "Transcription is temporarily unavailable. Please try again.",
        cause);
    this.partialSegments = partialSegments == null ? List.of() : List.copyOf(partialSegments);
  }

  public List<TranscriptSegment> getPartialSegments() {
    return partialSegments;
  }
}
