package com.flamingo.ai.pitchscoop.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.pitchscoop.domain.enums.SessionStatus;
import com.flamingo.ai.pitchscoop.domain.model.BlobHandle;
import com.flamingo.ai.pitchscoop.domain.model.Transcript;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptionChannel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One team's pitch: recording, transcript and lifecycle status within an event. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordingSession {

  private String sessionId;

  private String tenantId;

  private String teamName;

  private String title;

  @Builder.Default private SessionStatus status = SessionStatus.INITIALIZING;

  private Instant createdAt;

  private Instant recordingStartedAt;

  private Instant recordingEndedAt;

  private Instant completedAt;

  private BlobHandle audioRef;

  private TranscriptionChannel transcriptionChannel;

  @Builder.Default private List<TranscriptSegment> segments = new ArrayList<>();

  private String errorReason;

  private Instant scoringTriggeredAt;

  @JsonIgnore
  public Transcript getTranscript() {
    return new Transcript(segments);
  }

  public void appendSegment(TranscriptSegment segment) {
    if (segments == null) {
      segments = new ArrayList<>();
    }
    segments.add(segment);
  }

  public void replaceSegments(List<TranscriptSegment> finalSegments) {
    segments = new ArrayList<>(finalSegments);
  }
}
