package com.flamingo.ai.pitchscoop.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that judges a pitch transcript against the competition criteria.
 *
 * <p>Both methods return the raw JSON text so the caller can validate it against the score schema
 * before anything is persisted.
 */
public interface PitchScoringAgent {

  @SystemMessage(
      """
        You are an expert judge for an AI agent pitch competition. Score three-minute pitch
        presentations on four criteria, each worth 25 points:

        1. idea - Unique value proposition delivered by a vertical-specific agent using advanced
           reasoning, action and tool use.
        2. technical - Surprise and inspire judges through novel use of tools in a unique way.
        3. tools - Integration of at least three sponsor tools to enable sophisticated agentic
           behaviour. Sponsor tools: {{sponsorTools}}.
        4. presentation - A live demo within three minutes that clearly demonstrates the agent's
           impact.

        Ground every judgement in the judging rubric excerpts you are given; prefer them over
        your own expectations when they disagree. Quote nothing that is not in the transcript.

        Return a JSON object exactly in this shape, scores between 0 and 25:
        {"idea": {"score": 0.0, "feedback": "..."},
         "technical": {"score": 0.0, "feedback": "..."},
         "tools": {"score": 0.0, "feedback": "..."},
         "presentation": {"score": 0.0, "feedback": "..."},
         "overall": {"total_score": 0.0, "feedback": "...",
                     "strengths": ["..."], "improvements": ["..."]}}
        """)
  @UserMessage(
      """
        Judging rubric excerpts:
        {{rubric}}

        Team: {{teamName}}
        Pitch title: {{title}}

        Transcript:
        {{transcript}}
        """)
  String scoreWithRubric(
      @V("rubric") String rubric,
      @V("teamName") String teamName,
      @V("title") String title,
      @V("transcript") String transcript,
      @V("sponsorTools") String sponsorTools);

  @SystemMessage(
      """
        You are an expert judge for an AI agent pitch competition. Score three-minute pitch
        presentations on four criteria, each worth 25 points:

        1. idea - Unique value proposition delivered by a vertical-specific agent using advanced
           reasoning, action and tool use.
        2. technical - Surprise and inspire judges through novel use of tools in a unique way.
        3. tools - Integration of at least three sponsor tools to enable sophisticated agentic
           behaviour. Sponsor tools: {{sponsorTools}}.
        4. presentation - A live demo within three minutes that clearly demonstrates the agent's
           impact.

        Return a JSON object exactly in this shape, scores between 0 and 25:
        {"idea": {"score": 0.0, "feedback": "..."},
         "technical": {"score": 0.0, "feedback": "..."},
         "tools": {"score": 0.0, "feedback": "..."},
         "presentation": {"score": 0.0, "feedback": "..."},
         "overall": {"total_score": 0.0, "feedback": "...",
                     "strengths": ["..."], "improvements": ["..."]}}
        """)
  @UserMessage(
      """
        Team: {{teamName}}
        Pitch title: {{title}}

        Transcript:
        {{transcript}}
        """)
  String scoreStructured(
      @V("teamName") String teamName,
      @V("title") String title,
      @V("transcript") String transcript,
      @V("sponsorTools") String sponsorTools);
}
