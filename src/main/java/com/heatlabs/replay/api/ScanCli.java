package com.heatlabs.replay.api;

import com.heatlabs.replay.application.pipeline.BuildSummary;
import com.heatlabs.replay.application.pipeline.CorpusBuildUseCase;
import com.heatlabs.replay.config.CompositionRoot;
import com.heatlabs.replay.config.ScanConfig;
import com.heatlabs.replay.infrastructure.persistence.JsonCorpusStore;
import com.heatlabs.replay.logging.LoggingConfigurator;
import com.heatlabs.replay.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for building or extending a corpus from a directory of replays.
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final String MODE = "scan";
  private static final String SUMMARY_USAGE =
      "usage: scan in=DIR [corpus=FILE] [extension=.replay] [recursive=true|false] [workers=N] "
          + "[queueCapacity=N] [flushEvery=N] [config=YAML] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      replay scan

      Usage:
        scan in=./replays [options]

      Required:
        in=DIR                     Directory holding replay files

      Optional:
        corpus=FILE                Corpus document to create or extend (default replays_output.json)
        extension=.replay          File extension to pick up (case-insensitive)
        recursive=true|false       Descend into subdirectories (default false)
        workers=N                  Extraction threads (default half the processors, at least 2)
        queueCapacity=N            Files in flight at once (default 64)
        flushEvery=N               Records applied between corpus rewrites (default 1)
        config=YAML                Read defaults from the common and scan sections of a YAML file
        --dry-run                  Validate inputs and print the plan without scanning
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Re-running over the same directory replaces existing entries; the corpus on disk is always a
        complete document.
      """;

  private ScanCli() {}

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
   * Executes the scan command and returns its exit code.
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
      log.debug("Verbose logging enabled for scan CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid scan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");

    ScanConfig config;
    Path inputDirectory;
    Path corpusFile;
    try {
      config = ScanConfig.fromMap(effective);
      inputDirectory = Paths.requireReadableDirectory("in", config.inputDirectory());
      corpusFile = dryRun
          ? config.corpusFile().toAbsolutePath().normalize()
          : Paths.validateOutputFile("corpus", config.corpusFile());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid scan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, inputDirectory, corpusFile);
      return ExitCode.SUCCESS;
    }

    log.info(
        "Configured scan: input={}, corpus={}, extension={}, recursive={}, workers={}, metricsExporter={}",
        inputDirectory,
        corpusFile,
        config.extension(),
        config.recursive(),
        config.workers(),
        config.metrics().exporter().name().toLowerCase(Locale.ROOT));

    try (CompositionRoot root = new CompositionRoot(config.metrics());
        JsonCorpusStore store = root.corpusStore(config, warning -> CliPrinter.println("Warning: " + warning))) {
      CorpusBuildUseCase useCase = root.corpusBuildUseCase(config, store);
      BuildSummary summary = useCase.run();
      printSummary(summary, corpusFile);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Scan configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Scan I/O failure while processing {}", inputDirectory, ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Scan interrupted; pending records were flushed", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printSummary(BuildSummary summary, Path corpusFile) {
    CliPrinter.printLines(
        "Scan complete.",
        " Files discovered  : " + summary.discovered(),
        " Extracted         : " + summary.extracted(),
        " Missing           : " + summary.missing(),
        " Failed            : " + summary.failed(),
        " Corpus records    : " + summary.corpusRecords(),
        " Corpus file       : " + corpusFile,
        " Elapsed           : " + summary.elapsed().toMillis() + " ms");
  }

  private static void printDryRunPlan(ScanConfig config, Path inputDirectory, Path corpusFile) {
    CliPrinter.printLines(
        "Scan dry-run: no replays will be read.",
        " Input directory   : " + inputDirectory,
        " Extension         : " + config.extension(),
        " Recursive         : " + config.recursive(),
        " Corpus file       : " + corpusFile,
        " Workers           : " + config.workers(),
        " Queue capacity    : " + config.queueCapacity(),
        " Flush every       : " + config.flushEvery(),
        " Metrics exporter  : " + config.metrics().exporter().name().toLowerCase(Locale.ROOT),
        " Re-run without --dry-run to scan.");
  }
}
