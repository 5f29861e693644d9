package com.heatlabs.replay.config;

import com.heatlabs.replay.application.pipeline.CorpusBuildUseCase;
import com.heatlabs.replay.application.pipeline.ReportUseCase;
import com.heatlabs.replay.application.port.CorpusStorePort;
import com.heatlabs.replay.application.port.MetricsPort;
import com.heatlabs.replay.application.port.ReportRenderer;
import com.heatlabs.replay.application.stats.StatisticsAnalyzer;
import com.heatlabs.replay.infrastructure.exec.ExecutorFactories;
import com.heatlabs.replay.infrastructure.metrics.NoOpMetricsAdapter;
import com.heatlabs.replay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.heatlabs.replay.infrastructure.persistence.JsonCorpusFile;
import com.heatlabs.replay.infrastructure.persistence.JsonCorpusStore;
import com.heatlabs.replay.infrastructure.replay.HeuristicReplayExtractor;
import com.heatlabs.replay.infrastructure.report.JsonReportRenderer;
import com.heatlabs.replay.infrastructure.report.TextReportRenderer;
import com.heatlabs.replay.infrastructure.source.DirectoryReplaySource;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires {@code replay} use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from configuration to runnable pipelines in one place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from {@link MetricsSettings} and own its lifecycle.</li>
 *   <li>Build the scan pipeline over a directory source, the heuristic extractor and the JSON corpus store.</li>
 *   <li>Build the report pipeline over a corpus file, the analyzer and a renderer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used once per CLI invocation.</p>
 * <p><strong>Observability:</strong> Closing the root flushes and shuts down the metrics exporter.</p>
 *
 * @since 0.1.0
 * @see CorpusBuildUseCase
 * @see ReportUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final String WORKER_PREFIX = "replay-scan";

  private final MetricsSettings metricsSettings;
  private MetricsPort metrics;
  private AutoCloseable metricsLifecycle;

  public CompositionRoot(MetricsSettings metricsSettings) {
    this.metricsSettings = Objects.requireNonNull(metricsSettings, "metricsSettings");
  }

  /**
   * Returns the metrics port, starting the exporter on first use.
   *
   * @return metrics sink shared by every adapter built by this root
   */
  public MetricsPort metrics() {
    if (metrics == null) {
      if (metricsSettings.enabled()) {
        log.debug("Starting OTLP metrics exporter at {}", metricsSettings.endpoint());
        OpenTelemetryMetricsAdapter adapter = OpenTelemetryMetricsAdapter.otlp(
            metricsSettings.endpoint(), metricsSettings.resourceAttributes());
        metrics = adapter;
        metricsLifecycle = adapter;
      } else {
        NoOpMetricsAdapter adapter = new NoOpMetricsAdapter();
        metrics = adapter;
        metricsLifecycle = adapter;
      }
    }
    return metrics;
  }

  /**
   * Opens the corpus store for a scan.
   *
   * @param config scan settings
   * @param warnings receives a message when an unreadable corpus is discarded
   * @return store; the caller closes it
   */
  public JsonCorpusStore corpusStore(ScanConfig config, Consumer<String> warnings) {
    return new JsonCorpusStore(
        new JsonCorpusFile(config.corpusFile()), config.flushEvery(), metrics(), warnings);
  }

  /**
   * Builds the scan pipeline.
   *
   * @param config scan settings
   * @param store corpus store to extend
   * @return configured use case
   */
  public CorpusBuildUseCase corpusBuildUseCase(ScanConfig config, CorpusStorePort store) {
    return new CorpusBuildUseCase(
        new DirectoryReplaySource(config.inputDirectory(), config.extension(), config.recursive()),
        new HeuristicReplayExtractor(),
        store,
        metrics(),
        size -> ExecutorFactories.newWorkerPool(
            size,
            WORKER_PREFIX,
            (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)),
        config.workers(),
        config.queueCapacity());
  }

  /**
   * Builds the report pipeline.
   *
   * @param config report settings
   * @return configured use case
   */
  public ReportUseCase reportUseCase(ReportConfig config) {
    return new ReportUseCase(
        new JsonCorpusFile(config.corpusFile()),
        new StatisticsAnalyzer(config.analyzer()),
        renderer(config.format()));
  }

  /**
   * Selects the renderer for a format.
   *
   * @param format output format
   * @return renderer
   */
  public static ReportRenderer renderer(ReportFormat format) {
    return switch (Objects.requireNonNull(format, "format")) {
      case TEXT -> new TextReportRenderer();
      case JSON -> new JsonReportRenderer();
    };
  }

  @Override
  public void close() {
    if (metricsLifecycle == null) {
      return;
    }
    try {
      metricsLifecycle.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics exporter", ex);
    } finally {
      metricsLifecycle = null;
      metrics = null;
    }
  }
}
