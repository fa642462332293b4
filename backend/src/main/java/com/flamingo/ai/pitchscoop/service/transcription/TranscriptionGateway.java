package com.flamingo.ai.pitchscoop.service.transcription;

import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptionChannel;
import com.flamingo.ai.pitchscoop.exception.TranscriptionException;
import java.util.List;

/** External speech-to-text capability. */
public interface TranscriptionGateway {

  /**
   * Opens a live transcription channel for a session.
   *
   * @throws TranscriptionException if the provider does not hand out a channel
   */
  TranscriptionChannel openChannel(String tenantId, String sessionId);

  /**
   * Produces the final ordered segments of a recording. The provider's post-processed result
   * wins when it has one; otherwise the segments streamed live are authoritative.
   *
   * @param liveSegments segments received while recording, in receipt order
   * @throws TranscriptionException on failure, carrying the segments recovered so far
   */
  List<TranscriptSegment> finalizeTranscript(
      TranscriptionChannel channel, List<TranscriptSegment> liveSegments);
}
