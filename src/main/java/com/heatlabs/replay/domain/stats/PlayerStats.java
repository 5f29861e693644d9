package com.heatlabs.replay.domain.stats;

import java.util.Objects;

/**
 * Results of the matches a single player appeared in.
 *
 * @param player player handle
 * @param tally results across the player's matches
 * @since 0.1.0
 */
public record PlayerStats(String player, ResultTally tally) {
  public PlayerStats {
    Objects.requireNonNull(player, "player");
    Objects.requireNonNull(tally, "tally");
  }

  public int matches() {
    return tally.total();
  }

  public double winRate() {
    return tally.winRatio();
  }
}
