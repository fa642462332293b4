package com.flamingo.ai.pitchscoop.service.pipeline;

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
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers of the pitch pipeline. Every call names its tenant explicitly and never
 * throws: failures come back as an {@link com.flamingo.ai.pitchscoop.exception.ApiError} inside
 * the result.
 */
public interface PitchPipeline {

  PipelineResult<RecordingSession> createSession(String tenantId, String teamName, String title);

  PipelineResult<RecordingSession> beginRecording(String tenantId, String sessionId);

  PipelineResult<RecordingSession> ingestSegment(
      String tenantId, String sessionId, TranscriptSegment segment);

  /**
   * Stops recording. The returned future completes once the transcript is final, with the session
   * in {@code completed}, or with an error result.
   *
   * @param audio recorded audio, may be {@code null}
   */
  CompletableFuture<PipelineResult<RecordingSession>> completeSession(
      String tenantId, String sessionId, byte[] audio, String audioFormat);

  PipelineResult<ScoreRecord> scoreSession(String tenantId, String sessionId, String judgeId);

  /**
   * @param tieBreak {@code null} for the configured category
   * @param limit {@code 0} for all entries
   */
  PipelineResult<List<RankEntry>> rankTenant(
      String tenantId, RankSortKey sortKey, ScoreCategory tieBreak, int limit);

  /** Rank of one scored session by total score; not found when the session has no score. */
  PipelineResult<TeamStanding> teamRank(String tenantId, String sessionId);

  /** Highest, lowest and average total plus the number of sessions per performance tier. */
  PipelineResult<LeaderboardStats> leaderboardStats(String tenantId);

  /**
   * Compares two to ten scored sessions of one tenant.
   *
   * @param criteria categories to compare, {@code null} or empty for all
   */
  PipelineResult<PitchComparison> comparePitches(
      String tenantId, List<String> sessionIds, List<ScoreCategory> criteria);

  PipelineResult<RecordingSession> getSession(String tenantId, String sessionId);

  PipelineResult<List<RecordingSession>> listSessions(String tenantId);

  PipelineResult<ScoreRecord> getScore(String tenantId, String sessionId);

  /** Signed playback URL for the session's audio; {@code null} ttl uses the configured default. */
  PipelineResult<SignedUrl> getPlaybackUrl(String tenantId, String sessionId, Duration ttl);

  PipelineResult<List<String>> indexRubric(String tenantId, String fileName, byte[] content);

  PipelineResult<List<String>> indexRubricText(String tenantId, String sourceName, String text);

  PipelineResult<String> indexTeamProfile(String tenantId, String teamName, String profileText);
}
