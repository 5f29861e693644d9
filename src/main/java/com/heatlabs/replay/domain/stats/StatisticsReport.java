package com.heatlabs.replay.domain.stats;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Corpus-wide analytics computed from one corpus snapshot.
 * <p><strong>Why:</strong> Derived on demand and never persisted, so it always reflects the corpus it
 * was computed from.</p>
 *
 * @param progress processing counters
 * @param results overall result tally
 * @param maps per map and mode results, in order of first appearance
 * @param players player leaderboards
 * @param teamSizes players-per-match distribution
 * @param partnerships most frequent teammate pairs
 * @param streaks longest win and loss runs
 * @param dates filename date activity
 * @since 0.1.0
 */
public record StatisticsReport(
    CorpusProgress progress,
    ResultTally results,
    List<MapModeStats> maps,
    PlayerSummary players,
    TeamSizeDistribution teamSizes,
    List<Partnership> partnerships,
    StreakSummary streaks,
    DateActivity dates) {
  public StatisticsReport {
    Objects.requireNonNull(progress, "progress");
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(players, "players");
    Objects.requireNonNull(teamSizes, "teamSizes");
    Objects.requireNonNull(streaks, "streaks");
    Objects.requireNonNull(dates, "dates");
    maps = List.copyOf(maps);
    partnerships = List.copyOf(partnerships);
  }

  /**
   * Share of analysed matches with a known result, {@code 0..100}.
   *
   * @return percentage, {@code 0} for an empty corpus
   */
  public double knownResultPercentage() {
    return ResultTally.ratio(results.known(), progress.matchesAnalyzed()) * 100d;
  }
}
