package com.flamingo.ai.pitchscoop.service.session;

import com.flamingo.ai.pitchscoop.blob.BlobStore;
import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.domain.enums.SessionStatus;
import com.flamingo.ai.pitchscoop.domain.model.BlobHandle;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptionChannel;
import com.flamingo.ai.pitchscoop.domain.repository.RecordingSessionRepository;
import com.flamingo.ai.pitchscoop.exception.InvalidTransitionException;
import com.flamingo.ai.pitchscoop.exception.TranscriptionException;
import com.flamingo.ai.pitchscoop.exception.ValidationException;
import com.flamingo.ai.pitchscoop.service.session.event.SessionCompletedEvent;
import com.flamingo.ai.pitchscoop.service.transcription.TranscriptionGateway;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Session state machine. Every mutation of a session runs under that session's lock, so segment
 * ingestion and transitions for one session are serialised while different sessions never
 * contend.
 */
@Service
@Slf4j
public class SessionServiceImpl implements SessionService {

  private final RecordingSessionRepository sessionRepository;
  private final TranscriptionGateway transcriptionGateway;
  private final BlobStore blobStore;
  private final ApplicationEventPublisher eventPublisher;
  private final Executor transcriptionExecutor;
  private final PitchScoopProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  // weak values: a lock lives as long as some thread holds a reference to it
  private final LoadingCache<String, ReentrantLock> sessionLocks =
      Caffeine.newBuilder().weakValues().build(key -> new ReentrantLock());

  @Autowired
  public SessionServiceImpl(
      RecordingSessionRepository sessionRepository,
      TranscriptionGateway transcriptionGateway,
      BlobStore blobStore,
      ApplicationEventPublisher eventPublisher,
      @Qualifier("transcriptionExecutor") Executor transcriptionExecutor,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry) {
    this(
        sessionRepository,
        transcriptionGateway,
        blobStore,
        eventPublisher,
        transcriptionExecutor,
        properties,
        meterRegistry,
        Clock.systemUTC());
  }

  public SessionServiceImpl(
      RecordingSessionRepository sessionRepository,
      TranscriptionGateway transcriptionGateway,
      BlobStore blobStore,
      ApplicationEventPublisher eventPublisher,
      Executor transcriptionExecutor,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.transcriptionGateway = transcriptionGateway;
    this.blobStore = blobStore;
    this.eventPublisher = eventPublisher;
    this.transcriptionExecutor = transcriptionExecutor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  @Timed(value = "session.create", description = "Time to create a session")
  public RecordingSession create(String tenantId, String teamName, String title) {
    if (teamName == null || teamName.isBlank()) {
      throw new ValidationException("Team name is required");
    }
    if (title == null || title.isBlank()) {
      throw new ValidationException("Pitch title is required");
    }

    RecordingSession session =
        RecordingSession.builder()
            .sessionId(UUID.randomUUID().toString())
            .tenantId(tenantId)
            .teamName(teamName.strip())
            .title(title.strip())
            .status(SessionStatus.INITIALIZING)
            .createdAt(clock.instant())
            .build();
    sessionRepository.save(session);
    meterRegistry.counter("session.created").increment();
    log.info(
        "Created session {} for team '{}' in tenant {}",
        session.getSessionId(),
        session.getTeamName(),
        tenantId);

    TranscriptionChannel channel;
    try {
      channel = transcriptionGateway.openChannel(tenantId, session.getSessionId());
    } catch (TranscriptionException e) {
      log.error(
          "No transcription channel for session {} in tenant {}: {}",
          session.getSessionId(),
          tenantId,
          e.getMessage());
      return withLock(
          tenantId,
          session.getSessionId(),
          () -> fail(load(tenantId, session.getSessionId()), e.getUserMessage()));
    }

    return withLock(
        tenantId,
        session.getSessionId(),
        () -> {
          RecordingSession current = load(tenantId, session.getSessionId());
          requireStatus(current, SessionStatus.INITIALIZING, "open a transcription channel");
          current.setTranscriptionChannel(channel);
          return transition(current, SessionStatus.READY_TO_RECORD);
        });
  }

  @Override
  public RecordingSession beginRecording(String tenantId, String sessionId) {
    return withLock(
        tenantId,
        sessionId,
        () -> {
          RecordingSession session = load(tenantId, sessionId);
          if (session.getStatus() == SessionStatus.RECORDING) {
            log.debug("Session {} already recording", sessionId);
            return session;
          }
          requireStatus(session, SessionStatus.READY_TO_RECORD, "begin recording");
          session.setRecordingStartedAt(clock.instant());
          return transition(session, SessionStatus.RECORDING);
        });
  }

  @Override
  public RecordingSession ingestSegment(
      String tenantId, String sessionId, TranscriptSegment segment) {
    if (segment == null) {
      throw new ValidationException("Transcript segment is required");
    }
    return withLock(
        tenantId,
        sessionId,
        () -> {
          RecordingSession session = load(tenantId, sessionId);
          requireStatus(session, SessionStatus.RECORDING, "ingest a segment");
          session.appendSegment(segment);
          sessionRepository.save(session);
          meterRegistry.counter("session.segments.ingested").increment();
          return session;
        });
  }

  @Override
  @Timed(value = "session.complete", description = "Time to stop recording")
  public CompletableFuture<RecordingSession> complete(
      String tenantId, String sessionId, byte[] audio, String audioFormat) {
    RecordingSession processing =
        withLock(
            tenantId,
            sessionId,
            () -> {
              RecordingSession session = load(tenantId, sessionId);
              requireStatus(session, SessionStatus.RECORDING, "complete");
              if (audio != null && audio.length > 0) {
                // blob first: a crash may orphan audio but never leaves a dangling audioRef
                BlobHandle handle = blobStore.put(tenantId, sessionId, audio, audioFormat);
                session.setAudioRef(handle);
              }
              session.setRecordingEndedAt(clock.instant());
              return transition(session, SessionStatus.PROCESSING);
            });

    TranscriptionChannel channel = processing.getTranscriptionChannel();
    List<TranscriptSegment> liveSegments = List.copyOf(processing.getSegments());
    Duration finalizeTimeout = properties.getTranscription().getFinalizeTimeout();

    return CompletableFuture.supplyAsync(
            () -> transcriptionGateway.finalizeTranscript(channel, liveSegments),
            transcriptionExecutor)
        .orTimeout(finalizeTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .handleAsync(
            (segments, error) ->
                error == null
                    ? finishOrFail(tenantId, sessionId, segments, finalizeTimeout)
                    : finishFailed(tenantId, sessionId, error, finalizeTimeout),
            transcriptionExecutor);
  }

  /** A session must never be left in PROCESSING when the completed state cannot be committed. */
  private RecordingSession finishOrFail(
      String tenantId, String sessionId, List<TranscriptSegment> segments, Duration timeout) {
    try {
      return finishCompleted(tenantId, sessionId, segments);
    } catch (RuntimeException e) {
      log.warn("Could not commit completed session {} in tenant {}", sessionId, tenantId, e);
      TranscriptionException uncommitted =
          new TranscriptionException("could not commit transcript", segments, e);
      return finishFailed(tenantId, sessionId, uncommitted, timeout);
    }
  }

  private RecordingSession finishCompleted(
      String tenantId, String sessionId, List<TranscriptSegment> segments) {
    RecordingSession completed =
        withLock(
            tenantId,
            sessionId,
            () -> {
              RecordingSession session = load(tenantId, sessionId);
              requireStatus(session, SessionStatus.PROCESSING, "finalize transcript");
              session.replaceSegments(segments);
              session.setCompletedAt(clock.instant());
              return transition(session, SessionStatus.COMPLETED);
            });
    log.info(
        "Session {} in tenant {} completed with {} words",
        sessionId,
        tenantId,
        completed.getTranscript().wordCount());
    eventPublisher.publishEvent(
        new SessionCompletedEvent(tenantId, sessionId, completed.getCompletedAt()));
    return completed;
  }

  private RecordingSession finishFailed(
      String tenantId, String sessionId, Throwable error, Duration timeout) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
    String reason =
        cause instanceof TimeoutException
            ? "Transcript finalization timed out after " + timeout.toSeconds() + "s"
            : "Transcript finalization failed: " + cause.getMessage();
    log.error("Session {} in tenant {} failed: {}", sessionId, tenantId, reason);
    meterRegistry.counter("session.finalize.failure").increment();

    return withLock(
        tenantId,
        sessionId,
        () -> {
          RecordingSession session = load(tenantId, sessionId);
          if (session.getStatus().isTerminal()) {
            return session;
          }
          if (cause instanceof TranscriptionException te && !te.getPartialSegments().isEmpty()) {
            session.replaceSegments(te.getPartialSegments());
          }
          return fail(session, reason);
        });
  }

  @Override
  public void annotateScoringTriggered(String tenantId, String sessionId, Instant triggeredAt) {
    withLock(
        tenantId,
        sessionId,
        () -> {
          RecordingSession session = load(tenantId, sessionId);
          session.setScoringTriggeredAt(triggeredAt);
          return sessionRepository.save(session);
        });
  }

  @Override
  public RecordingSession get(String tenantId, String sessionId) {
    return load(tenantId, sessionId);
  }

  @Override
  public List<RecordingSession> list(String tenantId) {
    return sessionRepository.findAllByTenant(tenantId);
  }

  private RecordingSession load(String tenantId, String sessionId) {
    return sessionRepository.getById(tenantId, sessionId);
  }

  private void requireStatus(RecordingSession session, SessionStatus expected, String operation) {
    if (session.getStatus() != expected) {
      meterRegistry
          .counter("session.transition.rejected", "from", session.getStatus().getValue())
          .increment();
      throw new InvalidTransitionException(session.getSessionId(), session.getStatus(), operation);
    }
  }

  private RecordingSession transition(RecordingSession session, SessionStatus target) {
    SessionStatus from = session.getStatus();
    if (!from.canTransitionTo(target)) {
      throw new InvalidTransitionException(
          session.getSessionId(), from, "move to " + target.getValue());
    }
    session.setStatus(target);
    sessionRepository.save(session);
    meterRegistry.counter("session.transition", "to", target.getValue()).increment();
    log.info(
        "Session {} in tenant {}: {} -> {}",
        session.getSessionId(),
        session.getTenantId(),
        from.getValue(),
        target.getValue());
    return session;
  }

  private RecordingSession fail(RecordingSession session, String reason) {
    session.setErrorReason(reason);
    return transition(session, SessionStatus.ERROR);
  }

  private <T> T withLock(String tenantId, String sessionId, Supplier<T> action) {
    ReentrantLock lock = sessionLocks.get(tenantId + "/" + sessionId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
