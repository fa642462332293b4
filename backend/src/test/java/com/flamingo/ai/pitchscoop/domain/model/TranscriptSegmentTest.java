package com.flamingo.ai.pitchscoop.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pitchscoop.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TranscriptSegment")
class TranscriptSegmentTest {

  @Test
  void shouldStripText_andKeepOffsets() {
    TranscriptSegment segment = new TranscriptSegment("  we built it ", 1.5, 3.0, 0.8, true);

    assertThat(segment.text()).isEqualTo("we built it");
    assertThat(segment.duration()).isEqualTo(1.5);
  }

  @ParameterizedTest
  @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
  void shouldRejectNonFiniteStartOffset(double offset) {
    assertThatThrownBy(() -> TranscriptSegment.of("words", offset, 2.0))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("finite");
  }

  @ParameterizedTest
  @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY})
  void shouldRejectNonFiniteEndOffset(double offset) {
    assertThatThrownBy(() -> TranscriptSegment.of("words", 0.0, offset))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("finite");
  }

  @ParameterizedTest
  @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, -0.1, 1.01})
  void shouldRejectConfidence_outsideUnitInterval(double confidence) {
    assertThatThrownBy(() -> new TranscriptSegment("words", 0.0, 1.0, confidence, false))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("confidence");
  }

  @Test
  void shouldAcceptMissingConfidence() {
    assertThat(new TranscriptSegment("words", 0.0, 1.0, null, false).confidence()).isNull();
  }

  @Test
  void shouldRejectSegment_endingBeforeItStarts() {
    assertThatThrownBy(() -> TranscriptSegment.of("words", 2.0, 1.0))
        .isInstanceOf(ValidationException.class);
  }
}
