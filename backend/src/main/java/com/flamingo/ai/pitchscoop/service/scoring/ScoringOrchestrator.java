package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.config.PitchScoopProperties.ConcurrencyPolicy;
import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.ScoringMethod;
import com.flamingo.ai.pitchscoop.domain.enums.SessionStatus;
import com.flamingo.ai.pitchscoop.domain.repository.ScoreRecordRepository;
import com.flamingo.ai.pitchscoop.exception.AlreadyScoringException;
import com.flamingo.ai.pitchscoop.exception.AnalysisCapabilityException;
import com.flamingo.ai.pitchscoop.exception.ErrorKind;
import com.flamingo.ai.pitchscoop.exception.IndexEmptyException;
import com.flamingo.ai.pitchscoop.exception.InvalidTransitionException;
import com.flamingo.ai.pitchscoop.exception.MalformedAnalysisResponseException;
import com.flamingo.ai.pitchscoop.exception.PitchScoopException;
import com.flamingo.ai.pitchscoop.service.scoring.event.ScoreRecordedEvent;
import com.flamingo.ai.pitchscoop.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Scores completed sessions through the ordered tier chain and commits exactly one record per
 * run. Only one run per session is in flight at a time; concurrent callers either share its
 * result or are rejected, depending on {@code pitchscoop.scoring.concurrency-policy}.
 */
@Service
@Slf4j
public class ScoringOrchestrator {

  private final List<ScoringTier> tiers;
  private final SessionService sessionService;
  private final ScoreRecordRepository scoreRecordRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Executor scoringExecutor;
  private final PitchScoopProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final ConcurrentMap<String, CompletableFuture<ScoreRecord>> inFlight =
      new ConcurrentHashMap<>();

  @Autowired
  public ScoringOrchestrator(
      List<ScoringTier> tiers,
      SessionService sessionService,
      ScoreRecordRepository scoreRecordRepository,
      ApplicationEventPublisher eventPublisher,
      @Qualifier("scoringExecutor") Executor scoringExecutor,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry) {
    this(
        tiers,
        sessionService,
        scoreRecordRepository,
        eventPublisher,
        scoringExecutor,
        properties,
        meterRegistry,
        Clock.systemUTC());
  }

  public ScoringOrchestrator(
      List<ScoringTier> tiers,
      SessionService sessionService,
      ScoreRecordRepository scoreRecordRepository,
      ApplicationEventPublisher eventPublisher,
      Executor scoringExecutor,
      PitchScoopProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.tiers = tiers.stream().sorted(Comparator.comparingInt(ScoringTier::order)).toList();
    this.sessionService = sessionService;
    this.scoreRecordRepository = scoreRecordRepository;
    this.eventPublisher = eventPublisher;
    this.scoringExecutor = scoringExecutor;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    log.info(
        "Scoring chain: {}",
        this.tiers.stream().map(t -> t.method().getValue()).toList());
  }

  /**
   * Scores a completed session, replacing any earlier record.
   *
   * @param judgeId optional id of the judge who asked for the score
   * @throws InvalidTransitionException if the session is not completed
   * @throws AlreadyScoringException if another run is in flight and the policy is {@code REJECT}
   * @throws AnalysisCapabilityException if no tier produced a score
   */
  @Timed(value = "scoring.session", description = "Time to score a session")
  public ScoreRecord scoreSession(String tenantId, String sessionId, String judgeId) {
    RecordingSession session = sessionService.get(tenantId, sessionId);
    if (session.getStatus() != SessionStatus.COMPLETED) {
      throw new InvalidTransitionException(sessionId, session.getStatus(), "score");
    }

    String key = tenantId + "/" + sessionId;
    CompletableFuture<ScoreRecord> mine = new CompletableFuture<>();
    CompletableFuture<ScoreRecord> running = inFlight.putIfAbsent(key, mine);
    if (running != null) {
      if (properties.getScoring().getConcurrencyPolicy() == ConcurrencyPolicy.REJECT) {
        meterRegistry.counter("scoring.rejected").increment();
        throw new AlreadyScoringException(tenantId, sessionId);
      }
      log.info("Joining in-flight scoring of session {} in tenant {}", sessionId, tenantId);
      meterRegistry.counter("scoring.joined").increment();
      return await(running);
    }

    try {
      ScoreRecord record = runChain(session, judgeId);
      mine.complete(record);
      return record;
    } catch (RuntimeException e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, mine);
    }
  }

  /** Whether a scoring run for the session is currently in flight. */
  public boolean isScoring(String tenantId, String sessionId) {
    return inFlight.containsKey(tenantId + "/" + sessionId);
  }

  private ScoreRecord runChain(RecordingSession session, String judgeId) {
    String tenantId = session.getTenantId();
    String sessionId = session.getSessionId();
    sessionService.annotateScoringTriggered(tenantId, sessionId, clock.instant());
    ScoringContext context = ScoringContext.from(session);

    for (ScoringTier tier : tiers) {
      TierResult result = attempt(tier, context);
      if (result != null) {
        return commit(context, result, judgeId);
      }
    }

    log.error("All scoring tiers failed for session {} in tenant {}", sessionId, tenantId);
    throw new AnalysisCapabilityException(
        "All scoring tiers failed for session " + sessionId + " in tenant " + tenantId);
  }

  /** Runs one tier under its deadline; {@code null} means the tier failed. */
  private TierResult attempt(ScoringTier tier, ScoringContext context) {
    String tierId = tier.method().getValue();
    if (tier.isLocal()) {
      try {
        return tier.score(context);
      } catch (RuntimeException e) {
        recordFailure(tierId, context, describe(e));
        return null;
      }
    }

    Duration deadline = deadlineFor(tier.method());
    // FutureTask.cancel(true) interrupts the worker, releasing it for the next run
    FutureTask<TierResult> call = new FutureTask<>(() -> tier.score(context));
    try {
      scoringExecutor.execute(call);
    } catch (RejectedExecutionException e) {
      recordFailure(tierId, context, "scoring pool saturated");
      return null;
    }
    try {
      return call.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      recordFailure(tierId, context, "timed out after " + deadline.toMillis() + "ms");
    } catch (ExecutionException e) {
      recordFailure(tierId, context, describe(e.getCause()));
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new PitchScoopException(
          ErrorKind.INTERNAL_ERROR,
          "Interrupted while scoring session " + context.sessionId(),
          "Scoring was interrupted. Please try again.",
          e);
    }
    return null;
  }

  private ScoreRecord commit(ScoringContext context, TierResult result, String judgeId) {
    Instant scoredAt = clock.instant();
    ScoreRecord record = result.draft().toRecord();
    record.setTenantId(context.tenantId());
    record.setSessionId(context.sessionId());
    record.setTeamName(context.teamName());
    record.setTitle(context.title());
    record.setMethodUsed(result.method());
    record.setScoredAt(scoredAt);
    record.setJudgeId(judgeId);
    record.setScoringContextRefs(result.contextRefs());

    scoreRecordRepository.save(record);
    meterRegistry.counter("scoring.completed", "method", result.method().getValue()).increment();
    log.info(
        "Scored session {} in tenant {}: {} via {}",
        context.sessionId(),
        context.tenantId(),
        record.totalScore(),
        result.method().getValue());

    eventPublisher.publishEvent(
        new ScoreRecordedEvent(
            context.tenantId(),
            context.sessionId(),
            result.method(),
            record.totalScore(),
            scoredAt));
    return record;
  }

  private void recordFailure(String tierId, ScoringContext context, String reason) {
    meterRegistry.counter("scoring.tier.failure", "tier", tierId).increment();
    log.warn(
        "Scoring tier {} failed for session {} in tenant {}: {}",
        tierId,
        context.sessionId(),
        context.tenantId(),
        reason);
  }

  private Duration deadlineFor(ScoringMethod method) {
    PitchScoopProperties.Scoring config = properties.getScoring();
    return switch (method) {
      case RAG_ENHANCED -> config.getRagTimeout();
      case STRUCTURED_LLM -> config.getStructuredTimeout();
      case HEURISTIC -> config.getHeuristicTimeout();
    };
  }

  private static String describe(Throwable cause) {
    if (cause instanceof MalformedAnalysisResponseException malformed) {
      return malformed.getMessage() + " (raw: " + malformed.getRawPreview() + ")";
    }
    if (cause instanceof IndexEmptyException) {
      return cause.getMessage();
    }
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }

  private static ScoreRecord await(CompletableFuture<ScoreRecord> running) {
    try {
      return running.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
