package com.heatlabs.replay.domain.stats;

import com.heatlabs.replay.domain.replay.MapInfo;
import java.util.Objects;

/**
 * Results grouped by map and game mode.
 *
 * @param mapInfo map and mode of the group
 * @param tally results of the matches in the group
 * @since 0.1.0
 */
public record MapModeStats(MapInfo mapInfo, ResultTally tally) {
  public MapModeStats {
    Objects.requireNonNull(mapInfo, "mapInfo");
    Objects.requireNonNull(tally, "tally");
  }

  public int total() {
    return tally.total();
  }

  public double winRate() {
    return tally.winRatio();
  }
}
