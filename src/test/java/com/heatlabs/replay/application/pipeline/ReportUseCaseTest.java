package com.heatlabs.replay.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.heatlabs.replay.application.port.ReportRenderer;
import com.heatlabs.replay.application.stats.StatisticsAnalyzer;
import com.heatlabs.replay.domain.replay.BuildInfo;
import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.replay.MatchRecord;
import com.heatlabs.replay.domain.stats.StatisticsReport;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ReportUseCaseTest {
  @Test
  void analyzesLoadedCorpusAndRendersIt() throws Exception {
    Corpus corpus = Corpus.empty()
        .withTotalFiles(2)
        .withRecord(MatchRecord.extracted("a.replay", List.of(), BuildInfo.empty(), List.of("Amy#111")))
        .withRecord(MatchRecord.failed("b.replay", MatchRecord.FILE_NOT_FOUND));
    List<StatisticsReport> rendered = new ArrayList<>();
    ReportRenderer renderer = (report, out) -> {
      rendered.add(report);
      out.write("rendered");
    };
    StringWriter out = new StringWriter();

    StatisticsReport report = new ReportUseCase(() -> corpus, new StatisticsAnalyzer(), renderer).run(out);

    assertEquals("rendered", out.toString());
    assertEquals(1, rendered.size());
    assertSame(report, rendered.get(0));
    assertEquals(2, report.progress().totalFiles());
    assertEquals(2, report.progress().matchesAnalyzed());
    assertEquals(2, report.results().unknown());
    assertEquals(1, report.players().uniquePlayers());
  }

  @Test
  void loadFailurePropagatesWithoutRendering() {
    List<StatisticsReport> rendered = new ArrayList<>();
    ReportUseCase useCase = new ReportUseCase(
        () -> {
          throw new NoSuchFileException("replays_output.json");
        },
        new StatisticsAnalyzer(),
        (report, out) -> rendered.add(report));

    assertThrows(IOException.class, () -> useCase.run(new StringWriter()));
    assertTrue(rendered.isEmpty());
  }
}
