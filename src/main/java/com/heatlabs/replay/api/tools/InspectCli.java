package com.heatlabs.replay.api.tools;

import com.heatlabs.replay.api.CliArgsParser;
import com.heatlabs.replay.api.CliInput;
import com.heatlabs.replay.api.CliPrinter;
import com.heatlabs.replay.api.ConfigCliUtils;
import com.heatlabs.replay.api.ExitCode;
import com.heatlabs.replay.config.InspectConfig;
import com.heatlabs.replay.domain.json.JsonCodec;
import com.heatlabs.replay.domain.replay.BuildInfo;
import com.heatlabs.replay.domain.replay.MatchDate;
import com.heatlabs.replay.domain.replay.MatchRecord;
import com.heatlabs.replay.domain.replay.ReplayFileName;
import com.heatlabs.replay.domain.replay.Segment;
import com.heatlabs.replay.domain.scan.JsonSegmentScanner;
import com.heatlabs.replay.domain.scan.MetadataExtractor;
import com.heatlabs.replay.domain.scan.PrintableStringExtractor;
import com.heatlabs.replay.domain.scan.ZlibChunk;
import com.heatlabs.replay.domain.scan.ZlibChunkScanner;
import com.heatlabs.replay.infrastructure.persistence.AtomicFileWriter;
import com.heatlabs.replay.logging.Logs;
import com.heatlabs.replay.logging.LoggingConfigurator;
import com.heatlabs.replay.validation.Paths;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI utility that dumps what the extractor finds in one replay: JSON segments, build info, player
 * handles, embedded zlib streams and, on request, printable strings.
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String MODE = "inspect";
  private static final int PREVIEW_BYTES = 512;
  private static final String SUMMARY_USAGE =
      "usage: inspect file=REPLAY [strings=true|false] [minStringLength=N] [zlib=true|false] [out=FILE]";
  private static final String HELP_TEXT = """
      replay inspect

      Usage:
        inspect file=./replays/match.replay [options]

      Required:
        file=PATH                  Replay file to dump

      Optional:
        strings=true|false         List printable ASCII runs (default false)
        minStringLength=N          Shortest printable run listed (default 4)
        zlib=true|false            List embedded zlib streams (default true)
        out=FILE                   Write the dump to FILE instead of stdout
        config=YAML                Read defaults from the common and inspect sections of a YAML file
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private InspectCli() {}

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
   * Executes the inspect utility and returns the resulting exit code.
   *
   * @param args command-line arguments
   * @return exit code for the dump
   */
  public static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for inspect CLI");
    }

    InspectConfig config;
    Path replay;
    Optional<Path> output;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      config = InspectConfig.fromMap(ConfigCliUtils.effectiveConfig(MODE, kv, log::warn));
      replay = Paths.requireReadableFile("file", config.replayFile());
      output = config.outputFile().map(path -> Paths.validateOutputFile("out", path));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      byte[] content = Files.readAllBytes(replay);
      List<String> lines = describe(replay.getFileName().toString(), content, config);
      if (output.isPresent()) {
        AtomicFileWriter.write(output.get(), stream -> {
          Writer writer = new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
          writeLines(writer, lines);
        });
        log.info("Inspection of {} written to {}", replay, output.get());
      } else {
        PrintWriter writer = CliPrinter.writer();
        writeLines(writer, lines);
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to inspect {} due to I/O error", replay, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while inspecting {}", replay, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> describe(String fileName, byte[] content, InspectConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Replay: " + fileName + " (" + content.length + " bytes)");
    Optional<ReplayFileName> parsedName = ReplayFileName.parse(fileName);
    if (parsedName.isPresent()) {
      ReplayFileName name = parsedName.get();
      lines.add("Map: " + name.mapInfo().label());
      lines.add("Date: " + name.date().map(MatchDate::toString).orElse("<none>")
          + name.time().map(time -> " " + time).orElse(""));
    } else {
      lines.add("Map: unknown (filename is not in the replay layout)");
    }

    MetadataExtractor metadata = new MetadataExtractor();
    BuildInfo build = metadata.extractBuildInfo(content);
    lines.add("Build: " + build.build().orElse("<none>") + ", branch: " + build.branch().orElse("<none>"));

    List<Segment> segments = new JsonSegmentScanner().scan(content);
    SortedSet<String> players = metadata.extractPlayerNames(content);
    MatchRecord record = MatchRecord.extracted(fileName, segments, build, players);
    lines.add("Outcome: " + record.outcome().wireValue());

    lines.add("");
    lines.add("Players (" + players.size() + "):");
    for (String player : players) {
      lines.add("  " + player);
    }

    lines.add("");
    lines.add("JSON segments (" + segments.size() + "):");
    for (Segment segment : segments) {
      lines.add("  [" + segment.startOffset() + ".." + segment.endOffset() + "]");
      for (String jsonLine : JsonCodec.toPrettyString(segment.value()).split("\\R")) {
        lines.add("    " + jsonLine);
      }
    }

    if (config.includeZlib()) {
      List<ZlibChunk> chunks = new ZlibChunkScanner().scan(content);
      lines.add("");
      lines.add("Zlib chunks (" + chunks.size() + "):");
      for (ZlibChunk chunk : chunks) {
        lines.add("  [" + chunk.startOffset() + ".." + chunk.endOffset() + ") inflated "
            + chunk.inflatedSize() + " bytes" + (chunk.isText() ? "" : ", binary"));
        chunk.text().ifPresent(text -> lines.add("    " + Logs.truncate(text, PREVIEW_BYTES)));
      }
    }

    if (config.includeStrings()) {
      List<String> strings = new PrintableStringExtractor(config.minStringLength()).extract(content);
      lines.add("");
      lines.add("Printable strings (" + strings.size() + "):");
      for (String value : strings) {
        lines.add("  " + value);
      }
    }
    return lines;
  }

  private static void writeLines(Writer writer, List<String> lines) throws IOException {
    for (String line : lines) {
      writer.write(line);
      writer.write('\n');
    }
    writer.flush();
  }
}
