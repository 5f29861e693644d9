package com.heatlabs.replay.application.pipeline;

import com.heatlabs.replay.application.port.CorpusSource;
import com.heatlabs.replay.application.port.ReportRenderer;
import com.heatlabs.replay.application.stats.StatisticsAnalyzer;
import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.stats.StatisticsReport;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a corpus snapshot, analyzes it and renders the report.
 *
 * <p>A corpus that cannot be loaded fails the run; there is no fallback to an empty report.</p>
 *
 * @since 0.1.0
 */
public final class ReportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReportUseCase.class);

  private final CorpusSource corpusSource;
  private final StatisticsAnalyzer analyzer;
  private final ReportRenderer renderer;

  public ReportUseCase(CorpusSource corpusSource, StatisticsAnalyzer analyzer, ReportRenderer renderer) {
    this.corpusSource = Objects.requireNonNull(corpusSource, "corpusSource");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
  }

  /**
   * Produces the report and writes it to {@code out}.
   *
   * @param out destination; flushed, not closed
   * @return the computed report
   * @throws IOException if the corpus cannot be loaded or the output cannot be written
   */
  public StatisticsReport run(Writer out) throws IOException {
    Objects.requireNonNull(out, "out");
    Corpus corpus = corpusSource.load();
    log.info(
        "Loaded corpus with {} records ({} files discovered)",
        corpus.processedFiles(),
        corpus.totalFiles());
    StatisticsReport report = analyzer.analyze(corpus);
    renderer.render(report, out);
    out.flush();
    return report;
  }
}
