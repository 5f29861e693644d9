package com.heatlabs.replay.domain.stats;

import java.util.List;

/**
 * Players-per-match distribution. All figures are {@code 0} for an empty corpus.
 *
 * @param average mean number of players per match
 * @param min smallest team size seen
 * @param max largest team size seen
 * @param buckets one bucket per distinct size, ascending
 * @since 0.1.0
 */
public record TeamSizeDistribution(double average, int min, int max, List<TeamSizeBucket> buckets) {
  private static final TeamSizeDistribution EMPTY = new TeamSizeDistribution(0d, 0, 0, List.of());

  public TeamSizeDistribution {
    buckets = List.copyOf(buckets);
  }

  public static TeamSizeDistribution empty() {
    return EMPTY;
  }
}
