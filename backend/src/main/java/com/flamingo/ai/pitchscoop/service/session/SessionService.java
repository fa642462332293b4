package com.flamingo.ai.pitchscoop.service.session;

import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.exception.InvalidTransitionException;
import com.flamingo.ai.pitchscoop.exception.SessionNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle of recording sessions.
 *
 * <pre>
 * initializing -> ready_to_record -> recording -> processing -> completed
 *        \_______________\______________\_____________\______-> error
 * </pre>
 *
 * Illegal calls throw {@link InvalidTransitionException} and leave the session untouched.
 */
public interface SessionService {

  /**
   * Creates a session and opens its transcription channel. If no channel can be obtained the
   * session is returned in {@code error} with the reason recorded.
   */
  RecordingSession create(String tenantId, String teamName, String title);

  /** Starts recording. Calling it again while recording is a no-op. */
  RecordingSession beginRecording(String tenantId, String sessionId);

  /** Appends a live segment; only legal while recording. */
  RecordingSession ingestSegment(String tenantId, String sessionId, TranscriptSegment segment);

  /**
   * Stops recording, stores the audio if given and finalizes the transcript in the background.
   *
   * @param audio recorded audio, or {@code null} when the caller keeps no audio
   * @param audioFormat file extension of {@code audio}
   * @return a handle completing with the session in {@code completed} or {@code error}
   * @throws InvalidTransitionException if the session is not recording
   */
  CompletableFuture<RecordingSession> complete(
      String tenantId, String sessionId, byte[] audio, String audioFormat);

  /** Records when scoring started. Does not change the status. */
  void annotateScoringTriggered(String tenantId, String sessionId, Instant triggeredAt);

  /**
   * @throws SessionNotFoundException if the session does not exist in the tenant
   */
  RecordingSession get(String tenantId, String sessionId);

  List<RecordingSession> list(String tenantId);
}
