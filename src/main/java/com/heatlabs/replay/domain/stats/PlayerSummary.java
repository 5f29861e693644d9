package com.heatlabs.replay.domain.stats;

import java.util.List;

/**
 * Player leaderboards.
 *
 * @param uniquePlayers number of distinct handles across the corpus
 * @param mostActive players ranked by match count
 * @param bestWinRate qualifying players ranked by win rate
 * @param minQualifyingMatches known results a player needs to enter {@code bestWinRate}
 * @since 0.1.0
 */
public record PlayerSummary(
    int uniquePlayers,
    List<PlayerStats> mostActive,
    List<PlayerStats> bestWinRate,
    int minQualifyingMatches) {
  public PlayerSummary {
    mostActive = List.copyOf(mostActive);
    bestWinRate = List.copyOf(bestWinRate);
  }
}
