package com.flamingo.ai.pitchscoop.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pitchscoop.domain.entity.CategoryScore;
import com.flamingo.ai.pitchscoop.domain.enums.ScoreCategory;
import com.flamingo.ai.pitchscoop.exception.MalformedAnalysisResponseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates raw model output against the score schema.
 *
 * <p>Each category is either a bare number or an object with a numeric {@code score} and optional
 * {@code feedback}. The long-form keys of the published rubric ({@code technical_implementation},
 * {@code tool_use}, {@code presentation_delivery}) are accepted as aliases. {@code overall} is
 * optional; its total is never trusted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScoreResponseParser {

  private static final double TOTAL_TOLERANCE = 0.5;

  private static final Map<ScoreCategory, List<String>> KEYS =
      Map.of(
          ScoreCategory.IDEA, List.of("idea"),
          ScoreCategory.TECHNICAL, List.of("technical", "technical_implementation"),
          ScoreCategory.TOOLS, List.of("tools", "tool_use"),
          ScoreCategory.PRESENTATION, List.of("presentation", "presentation_delivery"));

  private final ObjectMapper objectMapper;

  public ScoreDraft parse(String raw) {
    JsonNode root = readObject(raw);

    Map<ScoreCategory, CategoryScore> categories = new EnumMap<>(ScoreCategory.class);
    List<String> strengths = new ArrayList<>();
    List<String> improvements = new ArrayList<>();
    for (ScoreCategory category : ScoreCategory.values()) {
      JsonNode node = categoryNode(root, category);
      if (node == null) {
        throw new MalformedAnalysisResponseException(
            "missing category '" + category.getKey() + "'", raw);
      }
      categories.put(category, readCategory(category, node, raw));
    }

    String overallFeedback = "";
    JsonNode overall = root.get("overall");
    Double reportedTotal = null;
    if (overall != null && overall.isNumber()) {
      reportedTotal = overall.asDouble();
    } else if (overall != null && overall.isObject()) {
      JsonNode total = overall.get("total_score");
      if (total != null && total.isNumber()) {
        reportedTotal = total.asDouble();
      }
      overallFeedback = firstText(overall, "feedback", "judge_recommendation");
      strengths.addAll(textList(overall, "strengths", "standout_features"));
      improvements.addAll(textList(overall, "improvements", "critical_improvements"));
    }

    ScoreDraft draft = new ScoreDraft(categories, overallFeedback, strengths, improvements);
    if (reportedTotal != null && Math.abs(reportedTotal - draft.totalScore()) > TOTAL_TOLERANCE) {
      log.warn(
          "Reported overall total {} disagrees with category sum {}; using the sum",
          reportedTotal,
          draft.totalScore());
    }
    return draft;
  }

  private JsonNode readObject(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedAnalysisResponseException("empty response", raw);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(raw));
    } catch (JsonProcessingException e) {
      throw new MalformedAnalysisResponseException("not valid JSON", raw, e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedAnalysisResponseException("expected a JSON object", raw);
    }
    return root;
  }

  private JsonNode categoryNode(JsonNode root, ScoreCategory category) {
    for (String key : KEYS.get(category)) {
      JsonNode node = root.get(key);
      if (node != null && !node.isNull()) {
        return node;
      }
    }
    return null;
  }

  private CategoryScore readCategory(ScoreCategory category, JsonNode node, String raw) {
    JsonNode scoreNode = node.isObject() ? node.get("score") : node;
    if (scoreNode == null || !scoreNode.isNumber()) {
      throw new MalformedAnalysisResponseException(
          "score for '" + category.getKey() + "' is not a number", raw);
    }
    double score = scoreNode.asDouble();
    if (score < 0.0 || score > ScoreCategory.MAX_SCORE) {
      throw new MalformedAnalysisResponseException(
          String.format(
              "score %.2f for '%s' is outside [0, %.0f]",
              score, category.getKey(), ScoreCategory.MAX_SCORE),
          raw);
    }
    String feedback = node.isObject() ? firstText(node, "feedback", "reasoning") : "";
    return CategoryScore.builder()
        .score(score)
        .maxScore(ScoreCategory.MAX_SCORE)
        .feedback(feedback)
        .build();
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return "";
  }

  private static List<String> textList(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isArray()) {
        List<String> items = new ArrayList<>();
        value.forEach(
            item -> {
              if (item.isTextual() && !item.asText().isBlank()) {
                items.add(item.asText());
              }
            });
        return items;
      }
    }
    return List.of();
  }

  /** Models sometimes wrap JSON in a markdown fence even in JSON mode. */
  private static String stripCodeFence(String raw) {
    String text = raw.strip();
    if (!text.startsWith("```")) {
      return text;
    }
    int firstNewline = text.indexOf('\n');
    int lastFence = text.lastIndexOf("```");
    if (firstNewline < 0 || lastFence <= firstNewline) {
      return text;
    }
    return text.substring(firstNewline + 1, lastFence).strip();
  }
}
