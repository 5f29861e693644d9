package com.heatlabs.replay.infrastructure.report;

import com.heatlabs.replay.application.port.ReportRenderer;
import com.heatlabs.replay.domain.replay.MatchDate;
import com.heatlabs.replay.domain.stats.CorpusProgress;
import com.heatlabs.replay.domain.stats.DateActivity;
import com.heatlabs.replay.domain.stats.MapModeStats;
import com.heatlabs.replay.domain.stats.Partnership;
import com.heatlabs.replay.domain.stats.PlayerStats;
import com.heatlabs.replay.domain.stats.PlayerSummary;
import com.heatlabs.replay.domain.stats.ResultTally;
import com.heatlabs.replay.domain.stats.StatisticsReport;
import com.heatlabs.replay.domain.stats.TeamSizeBucket;
import com.heatlabs.replay.domain.stats.TeamSizeDistribution;
import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/**
 * Renders a {@link StatisticsReport} as plain-text sections for terminals.
 *
 * @since 0.1.0
 */
public final class TextReportRenderer implements ReportRenderer {

  @Override
  public void render(StatisticsReport report, Writer out) throws IOException {
    Lines lines = new Lines(out);
    progress(lines, report.progress());
    results(lines, report.results());
    maps(lines, report);
    players(lines, report.players());
    teamSizes(lines, report.teamSizes());
    partnerships(lines, report);
    dates(lines, report.dates());
    lines.line("=== STREAK ANALYSIS ===");
    lines.line("Longest win streak: " + report.streaks().maxWinStreak());
    lines.line("Longest loss streak: " + report.streaks().maxLossStreak());
    lines.blank();
    summary(lines, report);
  }

  private static void progress(Lines lines, CorpusProgress progress) throws IOException {
    lines.line("=== REPLAY DATA ANALYSIS ===");
    lines.blank();
    lines.line("Total files processed: " + progress.processedFiles() + "/" + progress.totalFiles());
    lines.line("Matches analyzed: " + progress.matchesAnalyzed());
    lines.blank();
  }

  private static void results(Lines lines, ResultTally tally) throws IOException {
    lines.line("=== MATCH RESULTS ===");
    lines.line("Wins: " + tally.wins());
    lines.line("Losses: " + tally.losses());
    lines.line("Unknown/Invalid: " + tally.unknown());
    lines.line("Win Ratio: " + percent(tally.winRatio()));
    if (tally.hasKnownResults()) {
      lines.line("Loss Ratio: " + percent(tally.lossRatio()));
    }
    lines.blank();
  }

  private static void maps(Lines lines, StatisticsReport report) throws IOException {
    lines.line("=== MAP STATISTICS ===");
    for (MapModeStats map : report.maps()) {
      ResultTally tally = map.tally();
      lines.line(map.mapInfo().label() + ":");
      lines.line(String.format(
          Locale.ROOT,
          "  Matches: %d (WINS: %d, LOSSES: %d, UNKNOWN: %d)",
          tally.total(),
          tally.wins(),
          tally.losses(),
          tally.unknown()));
      lines.line(tally.hasKnownResults()
          ? "  Win Rate: " + percent(tally.winRatio())
          : "  Win Rate: N/A (no known results)");
    }
    lines.blank();
  }

  private static void players(Lines lines, PlayerSummary players) throws IOException {
    lines.line("=== PLAYER STATISTICS ===");
    lines.line("Total unique players: " + players.uniquePlayers());
    lines.blank();
    lines.line("Top " + players.mostActive().size() + " Most Active Players:");
    for (PlayerStats stats : players.mostActive()) {
      lines.line(String.format(
          Locale.ROOT,
          "  %s: %d matches (%s win rate, unknown: %d)",
          stats.player(),
          stats.matches(),
          percent(stats.winRate()),
          stats.tally().unknown()));
    }
    lines.blank();
    if (!players.bestWinRate().isEmpty()) {
      lines.line("Top " + players.bestWinRate().size() + " Players by Win Rate (min "
          + players.minQualifyingMatches() + " known matches):");
      for (PlayerStats stats : players.bestWinRate()) {
        lines.line(String.format(
            Locale.ROOT,
            "  %s: %s (%d-%d, ?: %d)",
            stats.player(),
            percent(stats.winRate()),
            stats.tally().wins(),
            stats.tally().losses(),
            stats.tally().unknown()));
      }
      lines.blank();
    }
  }

  private static void teamSizes(Lines lines, TeamSizeDistribution sizes) throws IOException {
    lines.line("=== PLAYERS PER MATCH ANALYSIS ===");
    lines.line(String.format(Locale.ROOT, "Average players per match: %.1f", sizes.average()));
    lines.line("Minimum players per match: " + sizes.min());
    lines.line("Maximum players per match: " + sizes.max());
    lines.blank();
    lines.line("Team Size Distribution:");
    for (TeamSizeBucket bucket : sizes.buckets()) {
      lines.line(String.format(
          Locale.ROOT,
          "  %d players: %d matches (%.1f%%)",
          bucket.size(),
          bucket.matches(),
          bucket.percentage()));
    }
    lines.blank();
  }

  private static void partnerships(Lines lines, StatisticsReport report) throws IOException {
    lines.line("=== PLAYER PARTNERSHIPS ===");
    lines.line("Top " + report.partnerships().size() + " Most Frequent Teammate Pairs:");
    for (Partnership pair : report.partnerships()) {
      lines.line("  " + pair.first() + " & " + pair.second() + ": " + pair.matches()
          + " matches together");
    }
    lines.blank();
  }

  private static void dates(Lines lines, DateActivity dates) throws IOException {
    lines.line("=== TIME ANALYSIS ===");
    if (dates.mostActiveDate().isPresent()) {
      MatchDate date = dates.mostActiveDate().get();
      lines.line("Most active date: " + date.month() + "/" + date.day() + "/"
          + date.year() + " (" + dates.mostActiveDateMatches() + " matches)");
      lines.line("Total days with matches: " + dates.activeDays());
    } else {
      lines.line("No valid dates found in filenames");
    }
    if (dates.problematicFilenames() > 0) {
      lines.line("Note: " + dates.problematicFilenames()
          + " files had problematic filenames for date parsing");
    }
    lines.blank();
  }

  private static void summary(Lines lines, StatisticsReport report) throws IOException {
    ResultTally tally = report.results();
    lines.line("=== SUMMARY ===");
    lines.line("Total matches: " + report.progress().matchesAnalyzed());
    lines.line(String.format(
        Locale.ROOT,
        "Matches with known results: %d (%.1f%%)",
        tally.known(),
        report.knownResultPercentage()));
    lines.line("Overall win rate: " + percent(tally.winRatio()));
    lines.line("Unique players: " + report.players().uniquePlayers());
    lines.line(String.format(
        Locale.ROOT, "Average team size: %.1f", report.teamSizes().average()));
  }

  static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.2f%%", ratio * 100d);
  }

  private static final class Lines {
    private final Writer out;

    Lines(Writer out) {
      this.out = out;
    }

    void line(String text) throws IOException {
      out.write(text);
      out.write('\n');
    }

    void blank() throws IOException {
      out.write('\n');
    }
  }
}
