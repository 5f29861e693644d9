package com.heatlabs.replay.domain.stats;

/**
 * Longest runs of consecutive results in chronological order.
 *
 * @param maxWinStreak longest run of wins
 * @param maxLossStreak longest run of losses
 * @since 0.1.0
 */
public record StreakSummary(int maxWinStreak, int maxLossStreak) {}
