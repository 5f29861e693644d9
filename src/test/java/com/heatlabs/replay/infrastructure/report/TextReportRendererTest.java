package com.heatlabs.replay.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.heatlabs.replay.domain.stats.StatisticsReport;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class TextReportRendererTest {
  private final TextReportRenderer renderer = new TextReportRenderer();

  @Test
  void rendersEverySection() throws Exception {
    String text = render(ReportFixtures.sampleReport());

    assertTrue(text.startsWith("=== REPLAY DATA ANALYSIS ===\n"));
    assertTrue(text.contains("Total files processed: 5/6\n"));
    assertTrue(text.contains("=== MATCH RESULTS ===\nWins: 2\nLosses: 1\nUnknown/Invalid: 2\n"));
    assertTrue(text.contains("Win Ratio: 66.67%\n"));
    assertTrue(text.contains("Loss Ratio: 33.33%\n"));
    assertTrue(text.contains("harbor (assault):\n  Matches: 3 (WINS: 1, LOSSES: 1, UNKNOWN: 1)\n"));
    assertTrue(text.contains("unknown (unknown):\n  Matches: 1 (WINS: 0, LOSSES: 0, UNKNOWN: 1)\n"
        + "  Win Rate: N/A (no known results)\n"));
    assertTrue(text.contains("  Amy#111: 3 matches (66.67% win rate, unknown: 0)\n"));
    assertTrue(text.contains("Players by Win Rate (min 2 known matches):\n  Amy#111: 66.67% (2-1, ?: 0)\n"));
    assertTrue(text.contains("  Amy#111 & Bob#222: 2 matches together\n"));
    assertTrue(text.contains("Most active date: 3/1/2024 (2 matches)\n"));
    assertTrue(text.contains("Note: 1 files had problematic filenames for date parsing\n"));
    assertTrue(text.contains("Longest win streak: 1\nLongest loss streak: 1\n"));
    assertTrue(text.contains("Matches with known results: 3 (60.0%)\n"));
  }

  @Test
  void emptyReportOmitsOptionalLines() throws Exception {
    String text = render(ReportFixtures.emptyReport());

    assertTrue(text.contains("Win Ratio: 0.00%\n"));
    assertFalse(text.contains("Loss Ratio"));
    assertFalse(text.contains("Players by Win Rate"));
    assertTrue(text.contains("No valid dates found in filenames\n"));
    assertFalse(text.contains("problematic filenames"));
    assertTrue(text.endsWith("Average team size: 0.0\n"));
  }

  @Test
  void percentUsesTwoDecimalsRegardlessOfLocale() {
    assertEquals("12.35%", TextReportRenderer.percent(0.123456));
    assertEquals("0.00%", TextReportRenderer.percent(0d));
  }

  private String render(StatisticsReport report) throws Exception {
    StringWriter out = new StringWriter();
    renderer.render(report, out);
    return out.toString();
  }
}
