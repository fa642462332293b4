package com.flamingo.ai.pitchscoop.service.scoring;

import com.flamingo.ai.pitchscoop.domain.model.Transcript;
import java.util.Collection;
import java.util.Locale;

/**
 * Surface measurements of a transcript used by the heuristic tier.
 *
 * @param wordsPerMinute speaking rate, {@code 0} when the transcript carries no timing
 */
record TranscriptStatistics(
    int wordCount, double durationSeconds, double wordsPerMinute, String normalizedText) {

  static TranscriptStatistics of(Transcript transcript) {
    int words = transcript.wordCount();
    double duration = transcript.durationSeconds();
    double wpm = duration > 0 ? words / (duration / 60.0) : 0.0;
    return new TranscriptStatistics(
        words, duration, wpm, transcript.totalText().toLowerCase(Locale.ROOT));
  }

  /** Number of distinct terms from {@code terms} that occur in the transcript. */
  int countMentions(Collection<String> terms) {
    int found = 0;
    for (String term : terms) {
      if (!term.isBlank() && normalizedText.contains(term.toLowerCase(Locale.ROOT))) {
        found++;
      }
    }
    return found;
  }
}
