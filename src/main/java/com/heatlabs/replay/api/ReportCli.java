package com.heatlabs.replay.api;

import com.heatlabs.replay.application.pipeline.ReportUseCase;
import com.heatlabs.replay.config.CompositionRoot;
import com.heatlabs.replay.config.ReportConfig;
import com.heatlabs.replay.domain.stats.StatisticsReport;
import com.heatlabs.replay.infrastructure.persistence.AtomicFileWriter;
import com.heatlabs.replay.infrastructure.persistence.CorpusFormatException;
import com.heatlabs.replay.logging.LoggingConfigurator;
import com.heatlabs.replay.validation.Paths;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for rendering statistics over an existing corpus.
 *
 * @since 0.1.0
 */
public final class ReportCli {
  private static final Logger log = LoggerFactory.getLogger(ReportCli.class);
  private static final String MODE = "report";
  private static final String SUMMARY_USAGE =
      "usage: report [corpus=FILE] [format=text|json] [out=FILE] [topPlayers=N] [topWinRate=N] "
          + "[topPartnerships=N] [minQualifyingMatches=N] [config=YAML]";
  private static final String HELP_TEXT = """
      replay report

      Usage:
        report [corpus=replays_output.json] [options]

      Optional:
        corpus=FILE                Corpus document to analyze (default replays_output.json)
        format=text|json           Output format (default text)
        out=FILE                   Write the report to FILE instead of stdout
        topPlayers=N               Most active players listed (default 10)
        topWinRate=N               Best win rates listed (default 5)
        topPartnerships=N          Partnerships listed (default 10)
        minQualifyingMatches=N     Known results needed for the win-rate ranking (default 2)
        config=YAML                Read defaults from the common and report sections of a YAML file
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ReportCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the report command and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for report CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ReportConfig config;
    Optional<Path> output;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      config = ReportConfig.fromMap(effective);
      output = config.outputFile().map(path -> Paths.validateOutputFile("out", path));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid report arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    Path corpus = config.corpusFile();
    try (CompositionRoot root = new CompositionRoot(config.metrics())) {
      ReportUseCase useCase = root.reportUseCase(config);
      if (output.isPresent()) {
        AtomicFileWriter.write(output.get(), stream -> {
          Writer writer = new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
          useCase.run(writer);
        });
        log.info("Report written to {}", output.get());
      } else {
        StatisticsReport report = useCase.run(CliPrinter.writer());
        log.debug("Report rendered for {} analyzed matches", report.progress().matchesAnalyzed());
      }
      root.metrics().increment("report.rendered");
      return ExitCode.SUCCESS;
    } catch (NoSuchFileException ex) {
      log.error("Corpus file does not exist: {}", corpus);
      return ExitCode.IO_ERROR;
    } catch (CorpusFormatException ex) {
      log.error("Corpus {} is not a valid corpus document: {}", corpus, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Report I/O failure for corpus {}", corpus, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Report configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while rendering report", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
