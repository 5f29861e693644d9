package com.heatlabs.replay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.heatlabs.replay.application.stats.AnalyzerSettings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ReportConfigTest {

  @Test
  void defaultsToTextOnStdout() {
    ReportConfig config = ReportConfig.fromMap(DefaultsForMode.asFlatMap("report"));

    assertEquals(Path.of("replays_output.json"), config.corpusFile());
    assertEquals(ReportFormat.TEXT, config.format());
    assertEquals(Optional.empty(), config.outputFile());
    assertEquals(AnalyzerSettings.defaults(), config.analyzer());
  }

  @Test
  void parsesFormatOutputAndLeaderboardSizes() {
    ReportConfig config = ReportConfig.fromMap(Map.of(
        "corpus", "c.json",
        "format", " JSON ",
        "out", "reports/out.json",
        "topPlayers", "3",
        "topWinRate", "2",
        "topPartnerships", "1",
        "minQualifyingMatches", "5"));

    assertEquals(ReportFormat.JSON, config.format());
    assertEquals(Optional.of(Path.of("reports/out.json")), config.outputFile());
    assertEquals(new AnalyzerSettings(3, 2, 1, 5), config.analyzer());
  }

  @Test
  void rejectsUnknownFormatAndNonPositiveSizes() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> ReportConfig.fromMap(Map.of("format", "html")));
    assertEquals("format must be text or json (was html)", ex.getMessage());
    assertThrows(
        IllegalArgumentException.class, () -> ReportConfig.fromMap(Map.of("topPlayers", "0")));
  }
}
