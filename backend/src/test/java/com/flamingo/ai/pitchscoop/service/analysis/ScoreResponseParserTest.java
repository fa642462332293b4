package com.flamingo.ai.pitchscoop.service.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.exception.MalformedAnalysisResponseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScoreResponseParser")
class ScoreResponseParserTest {

  private final ScoreResponseParser parser = new ScoreResponseParser(new ObjectMapper());

  @Nested
  @DisplayName("accepted shapes")
  class Accepted {

    @Test
    void shouldParseBareNumbers_andRecomputeTotal() {
      // When
      ScoreDraft draft =
          parser.parse(
              "{\"idea\":20,\"technical\":18,\"tools\":19,\"presentation\":17,\"overall\":74}");

      // Then
      assertThat(draft.totalScore()).isEqualTo(74.0);
      assertThat(draft.categories().get(ScoreCategory.TOOLS).getScore()).isEqualTo(19.0);
      assertThat(draft.categories().get(ScoreCategory.TOOLS).getMaxScore()).isEqualTo(25.0);
    }

    @Test
    void shouldParseObjects_withFeedbackAndOverallDetails() {
      // Given
      String raw =
          """
          {
            "idea": {"score": 21.5, "feedback": "Clear problem"},
            "technical_implementation": {"score": 18, "reasoning": "Solid RAG"},
            "tool_use": {"score": 20},
            "presentation_delivery": {"score": 16, "feedback": "Rushed ending"},
            "overall": {
              "total_score": 75.5,
              "judge_recommendation": "Finalist",
              "standout_features": ["Live demo"],
              "critical_improvements": ["Slow down"]
            }
          }
          """;

      // When
      ScoreDraft draft = parser.parse(raw);

      // Then
      assertThat(draft.totalScore()).isEqualTo(75.5);
      assertThat(draft.categories().get(ScoreCategory.IDEA).getFeedback())
          .isEqualTo("Clear problem");
      assertThat(draft.categories().get(ScoreCategory.TECHNICAL).getFeedback())
          .isEqualTo("Solid RAG");
      assertThat(draft.overallFeedback()).isEqualTo("Finalist");
      assertThat(draft.strengths()).containsExactly("Live demo");
      assertThat(draft.improvements()).containsExactly("Slow down");
    }

    @Test
    void shouldStripMarkdownFence() {
      ScoreDraft draft =
          parser.parse(
              "```json\n{\"idea\":1,\"technical\":2,\"tools\":3,\"presentation\":4}\n```");

      assertThat(draft.totalScore()).isEqualTo(10.0);
    }

    @Test
    void shouldIgnoreDisagreeingOverallTotal() {
      ScoreDraft draft =
          parser.parse(
              "{\"idea\":10,\"technical\":10,\"tools\":10,\"presentation\":10,\"overall\":99}");

      assertThat(draft.totalScore()).isEqualTo(40.0);
    }
  }

  @Nested
  @DisplayName("rejected shapes")
  class Rejected {

    @Test
    void shouldRejectNonJson_keepingARawPreview() {
      assertThatThrownBy(() -> parser.parse("The pitch was great, 9/10!"))
          .isInstanceOfSatisfying(
              MalformedAnalysisResponseException.class,
              e -> assertThat(e.getRawPreview()).startsWith("The pitch was great"));
    }

    @Test
    void shouldRejectMissingCategory() {
      assertThatThrownBy(() -> parser.parse("{\"idea\":10,\"technical\":10,\"tools\":10}"))
          .isInstanceOf(MalformedAnalysisResponseException.class)
          .hasMessageContaining("presentation");
    }

    @Test
    void shouldRejectNonNumericScore() {
      assertThatThrownBy(
              () ->
                  parser.parse(
                      "{\"idea\":\"high\",\"technical\":10,\"tools\":10,\"presentation\":10}"))
          .isInstanceOf(MalformedAnalysisResponseException.class);
    }

    @Test
    void shouldRejectScoresOutsideRange() {
      assertThatThrownBy(
              () ->
                  parser.parse(
                      "{\"idea\":26,\"technical\":10,\"tools\":10,\"presentation\":10}"))
          .isInstanceOf(MalformedAnalysisResponseException.class)
          .hasMessageContaining("outside");
      assertThatThrownBy(
              () ->
                  parser.parse(
                      "{\"idea\":-1,\"technical\":10,\"tools\":10,\"presentation\":10}"))
          .isInstanceOf(MalformedAnalysisResponseException.class);
    }

    @Test
    void shouldRejectJsonArrays() {
      assertThatThrownBy(() -> parser.parse("[1,2,3,4]"))
          .isInstanceOf(MalformedAnalysisResponseException.class);
    }
  }
}
