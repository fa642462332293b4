package com.flamingo.ai.pitchscoop.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Overall section of a score record. {@code totalScore} is the sum of the category scores. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OverallAssessment {

  private double totalScore;

  @Builder.Default private String feedback = "";

  @Builder.Default private List<String> strengths = List.of();

  @Builder.Default private List<String> improvements = List.of();
}
