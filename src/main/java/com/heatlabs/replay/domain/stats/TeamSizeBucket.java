package com.heatlabs.replay.domain.stats;

/**
 * One histogram bar of the players-per-match distribution.
 *
 * @param size number of players in a match
 * @param matches matches with exactly {@code size} players
 * @param percentage share of all analysed matches, {@code 0..100}
 * @since 0.1.0
 */
public record TeamSizeBucket(int size, int matches, double percentage) {}
