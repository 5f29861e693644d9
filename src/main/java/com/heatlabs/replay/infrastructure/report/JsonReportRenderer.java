package com.heatlabs.replay.infrastructure.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.heatlabs.replay.application.port.ReportRenderer;
import com.heatlabs.replay.domain.json.JsonCodec;
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
import java.util.List;

/**
 * Renders a {@link StatisticsReport} as a pretty-printed JSON document for downstream tooling.
 *
 * <p>Field names use {@code snake_case} like the corpus document. Ratios are fractions in {@code [0, 1]};
 * percentages are in {@code [0, 100]}.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportRenderer implements ReportRenderer {

  @Override
  public void render(StatisticsReport report, Writer out) throws IOException {
    try (JsonGenerator gen = JsonCodec.factory().createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();

      gen.writeObjectFieldStart("progress");
      gen.writeNumberField("total_files", report.progress().totalFiles());
      gen.writeNumberField("processed_files", report.progress().processedFiles());
      gen.writeNumberField("matches_analyzed", report.progress().matchesAnalyzed());
      gen.writeEndObject();

      gen.writeFieldName("results");
      writeTally(gen, report.results());

      gen.writeArrayFieldStart("maps");
      for (MapModeStats map : report.maps()) {
        gen.writeStartObject();
        gen.writeStringField("map", map.mapInfo().map());
        gen.writeStringField("mode", map.mapInfo().mode());
        gen.writeFieldName("results");
        writeTally(gen, map.tally());
        gen.writeEndObject();
      }
      gen.writeEndArray();

      writePlayers(gen, report.players());
      writeTeamSizes(gen, report.teamSizes());

      gen.writeArrayFieldStart("partnerships");
      for (Partnership pair : report.partnerships()) {
        gen.writeStartObject();
        gen.writeArrayFieldStart("players");
        gen.writeString(pair.first());
        gen.writeString(pair.second());
        gen.writeEndArray();
        gen.writeNumberField("matches", pair.matches());
        gen.writeEndObject();
      }
      gen.writeEndArray();

      gen.writeObjectFieldStart("streaks");
      gen.writeNumberField("max_win_streak", report.streaks().maxWinStreak());
      gen.writeNumberField("max_loss_streak", report.streaks().maxLossStreak());
      gen.writeEndObject();

      writeDates(gen, report.dates());
      gen.writeNumberField("known_result_percentage", report.knownResultPercentage());
      gen.writeEndObject();
    }
    out.write('\n');
  }

  private static void writeTally(JsonGenerator gen, ResultTally tally) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("total", tally.total());
    gen.writeNumberField("wins", tally.wins());
    gen.writeNumberField("losses", tally.losses());
    gen.writeNumberField("unknown", tally.unknown());
    gen.writeNumberField("win_ratio", tally.winRatio());
    gen.writeNumberField("loss_ratio", tally.lossRatio());
    gen.writeEndObject();
  }

  private static void writePlayers(JsonGenerator gen, PlayerSummary players) throws IOException {
    gen.writeObjectFieldStart("players");
    gen.writeNumberField("unique_players", players.uniquePlayers());
    gen.writeNumberField("min_qualifying_matches", players.minQualifyingMatches());
    writePlayerList(gen, "most_active", players.mostActive());
    writePlayerList(gen, "best_win_rate", players.bestWinRate());
    gen.writeEndObject();
  }

  private static void writePlayerList(JsonGenerator gen, String field, List<PlayerStats> players)
      throws IOException {
    gen.writeArrayFieldStart(field);
    for (PlayerStats stats : players) {
      gen.writeStartObject();
      gen.writeStringField("player", stats.player());
      gen.writeNumberField("matches", stats.matches());
      gen.writeNumberField("wins", stats.tally().wins());
      gen.writeNumberField("losses", stats.tally().losses());
      gen.writeNumberField("unknown", stats.tally().unknown());
      gen.writeNumberField("win_rate", stats.winRate());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeTeamSizes(JsonGenerator gen, TeamSizeDistribution sizes)
      throws IOException {
    gen.writeObjectFieldStart("team_sizes");
    gen.writeNumberField("average", sizes.average());
    gen.writeNumberField("min", sizes.min());
    gen.writeNumberField("max", sizes.max());
    gen.writeArrayFieldStart("distribution");
    for (TeamSizeBucket bucket : sizes.buckets()) {
      gen.writeStartObject();
      gen.writeNumberField("size", bucket.size());
      gen.writeNumberField("matches", bucket.matches());
      gen.writeNumberField("percentage", bucket.percentage());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeDates(JsonGenerator gen, DateActivity dates) throws IOException {
    gen.writeObjectFieldStart("dates");
    if (dates.mostActiveDate().isPresent()) {
      gen.writeStringField("most_active_date", dates.mostActiveDate().get().toString());
    } else {
      gen.writeNullField("most_active_date");
    }
    gen.writeNumberField("most_active_date_matches", dates.mostActiveDateMatches());
    gen.writeNumberField("active_days", dates.activeDays());
    gen.writeNumberField("problematic_filenames", dates.problematicFilenames());
    gen.writeEndObject();
  }
}
