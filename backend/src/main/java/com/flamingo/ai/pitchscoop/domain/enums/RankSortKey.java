package com.flamingo.ai.pitchscoop.domain.enums;

/** Field a leaderboard is sorted by. */
public enum RankSortKey {
  TOTAL_SCORE(null),
  IDEA(ScoreCategory.IDEA),
  TECHNICAL(ScoreCategory.TECHNICAL),
  TOOLS(ScoreCategory.TOOLS),
  PRESENTATION(ScoreCategory.PRESENTATION);

  private final ScoreCategory category;

  RankSortKey(ScoreCategory category) {
    this.category = category;
  }

  /** The category sorted by, or {@code null} for the total. */
  public ScoreCategory getCategory() {
    return category;
  }
}
