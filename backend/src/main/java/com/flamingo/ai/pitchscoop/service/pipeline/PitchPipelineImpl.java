package com.flamingo.ai.pitchscoop.service.pipeline;

import com.flamingo.ai.pitchscoop.blob.BlobStore;
import com.flamingo.ai.pitchscoop.config.PitchScoopProperties;
import com.flamingo.ai.pitchscoop.domain.entity.RecordingSession;
import com.flamingo.ai.pitchscoop.domain.entity.ScoreRecord;
import com.flamingo.ai.pitchscoop.domain.enums.RankSortKey;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.domain.model.LeaderboardStats;
import com.flamingo.ai.pitchscoop.domain.model.PitchComparison;
import com.flamingo.ai.pitchscoop.domain.model.RankEntry;
import com.flamingo.ai.pitchscoop.domain.model.SignedUrl;
import com.flamingo.ai.pitchscoop.domain.model.TeamStanding;
import com.flamingo.ai.pitchscoop.domain.model.TranscriptSegment;
import com.flamingo.ai.pitchscoop.domain.repository.ScoreRecordRepository;
import com.flamingo.ai.pitchscoop.exception.EntityNotFoundException;
import com.flamingo.ai.pitchscoop.exception.PipelineErrorTranslator;
import com.flamingo.ai.pitchscoop.service.ranking.LeaderboardService;
import com.flamingo.ai.pitchscoop.service.ranking.PitchComparisonService;
import com.flamingo.ai.pitchscoop.service.retrieval.RubricIngestionService;
import com.flamingo.ai.pitchscoop.service.scoring.ScoringOrchestrator;
import com.flamingo.ai.pitchscoop.service.session.SessionService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Default {@link PitchPipeline}: delegates to the services and translates their failures. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PitchPipelineImpl implements PitchPipeline {

  private final SessionService sessionService;
  private final ScoringOrchestrator scoringOrchestrator;
  private final LeaderboardService leaderboardService;
  private final PitchComparisonService pitchComparisonService;
  private final ScoreRecordRepository scoreRecordRepository;
  private final RubricIngestionService ingestionService;
  private final BlobStore blobStore;
  private final PipelineErrorTranslator errorTranslator;
  private final PitchScoopProperties properties;

  @Override
  public PipelineResult<RecordingSession> createSession(
      String tenantId, String teamName, String title) {
    return call("createSession", () -> sessionService.create(tenantId, teamName, title));
  }

  @Override
  public PipelineResult<RecordingSession> beginRecording(String tenantId, String sessionId) {
    return call("beginRecording", () -> sessionService.beginRecording(tenantId, sessionId));
  }

  @Override
  public PipelineResult<RecordingSession> ingestSegment(
      String tenantId, String sessionId, TranscriptSegment segment) {
    return call(
        "ingestSegment", () -> sessionService.ingestSegment(tenantId, sessionId, segment));
  }

  @Override
  public CompletableFuture<PipelineResult<RecordingSession>> completeSession(
      String tenantId, String sessionId, byte[] audio, String audioFormat) {
    CompletableFuture<RecordingSession> finalization;
    try {
      finalization = sessionService.complete(tenantId, sessionId, audio, audioFormat);
    } catch (RuntimeException e) {
      return CompletableFuture.completedFuture(
          PipelineResult.failure(errorTranslator.translate("completeSession", e)));
    }
    return finalization.<PipelineResult<RecordingSession>>handle(
        (session, error) ->
            error == null
                ? PipelineResult.ok(session)
                : PipelineResult.failure(errorTranslator.translate("completeSession", error)));
  }

  @Override
  public PipelineResult<ScoreRecord> scoreSession(
      String tenantId, String sessionId, String judgeId) {
    return call(
        "scoreSession", () -> scoringOrchestrator.scoreSession(tenantId, sessionId, judgeId));
  }

  @Override
  public PipelineResult<List<RankEntry>> rankTenant(
      String tenantId, RankSortKey sortKey, ScoreCategory tieBreak, int limit) {
    return call(
        "rankTenant",
        () -> leaderboardService.leaderboard(tenantId, sortKey, tieBreak, limit).entries());
  }

  @Override
  public PipelineResult<TeamStanding> teamRank(String tenantId, String sessionId) {
    return call("teamRank", () -> leaderboardService.teamRank(tenantId, sessionId));
  }

  @Override
  public PipelineResult<LeaderboardStats> leaderboardStats(String tenantId) {
    return call("leaderboardStats", () -> leaderboardService.stats(tenantId));
  }

  @Override
  public PipelineResult<PitchComparison> comparePitches(
      String tenantId, List<String> sessionIds, List<ScoreCategory> criteria) {
    return call(
        "comparePitches", () -> pitchComparisonService.compare(tenantId, sessionIds, criteria));
  }

  @Override
  public PipelineResult<RecordingSession> getSession(String tenantId, String sessionId) {
    return call("getSession", () -> sessionService.get(tenantId, sessionId));
  }

  @Override
  public PipelineResult<List<RecordingSession>> listSessions(String tenantId) {
    return call("listSessions", () -> sessionService.list(tenantId));
  }

  @Override
  public PipelineResult<ScoreRecord> getScore(String tenantId, String sessionId) {
    return call("getScore", () -> scoreRecordRepository.getBySessionId(tenantId, sessionId));
  }

  @Override
  public PipelineResult<SignedUrl> getPlaybackUrl(
      String tenantId, String sessionId, Duration ttl) {
    return call(
        "getPlaybackUrl",
        () -> {
          RecordingSession session = sessionService.get(tenantId, sessionId);
          if (session.getAudioRef() == null) {
            throw new EntityNotFoundException(tenantId, "audio", sessionId);
          }
          Duration effective = ttl == null ? properties.getBlob().getDefaultUrlTtl() : ttl;
          return blobStore.sign(session.getAudioRef(), effective);
        });
  }

  @Override
  public PipelineResult<List<String>> indexRubric(
      String tenantId, String fileName, byte[] content) {
    return call("indexRubric", () -> ingestionService.ingest(tenantId, fileName, content));
  }

  @Override
  public PipelineResult<List<String>> indexRubricText(
      String tenantId, String sourceName, String text) {
    return call("indexRubric", () -> ingestionService.ingestText(tenantId, sourceName, text));
  }

  @Override
  public PipelineResult<String> indexTeamProfile(
      String tenantId, String teamName, String profileText) {
    return call(
        "indexTeamProfile",
        () -> ingestionService.indexTeamProfile(tenantId, teamName, profileText));
  }

  private <T> PipelineResult<T> call(String operation, Supplier<T> action) {
    try {
      return PipelineResult.ok(action.get());
    } catch (RuntimeException e) {
      return PipelineResult.failure(errorTranslator.translate(operation, e));
    }
  }
}
