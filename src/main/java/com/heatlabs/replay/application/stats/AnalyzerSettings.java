package com.heatlabs.replay.application.stats;

/**
 * Leaderboard sizes and thresholds for {@link StatisticsAnalyzer}.
 *
 * @param topActivePlayers entries in the most-active leaderboard
 * @param topWinRatePlayers entries in the win-rate leaderboard
 * @param topPartnerships entries in the partnership leaderboard
 * @param minQualifyingMatches known results a player needs to be ranked by win rate
 * @since 0.1.0
 */
public record AnalyzerSettings(
    int topActivePlayers, int topWinRatePlayers, int topPartnerships, int minQualifyingMatches) {
  public static final int DEFAULT_TOP_ACTIVE = 10;
  public static final int DEFAULT_TOP_WIN_RATE = 5;
  public static final int DEFAULT_TOP_PARTNERSHIPS = 10;
  public static final int DEFAULT_MIN_QUALIFYING = 2;

  public AnalyzerSettings {
    requirePositive(topActivePlayers, "topActivePlayers");
    requirePositive(topWinRatePlayers, "topWinRatePlayers");
    requirePositive(topPartnerships, "topPartnerships");
    requirePositive(minQualifyingMatches, "minQualifyingMatches");
  }

  public static AnalyzerSettings defaults() {
    return new AnalyzerSettings(
        DEFAULT_TOP_ACTIVE, DEFAULT_TOP_WIN_RATE, DEFAULT_TOP_PARTNERSHIPS, DEFAULT_MIN_QUALIFYING);
  }

  private static void requirePositive(int value, String name) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0 (was " + value + ")");
    }
  }
}
