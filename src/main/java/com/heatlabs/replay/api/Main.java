package com.heatlabs.replay.api;

import com.heatlabs.replay.api.tools.InspectCli;
import com.heatlabs.replay.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code replay} CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: replay <scan|report|inspect> [options]";
  private static final String HELP_TEXT = """
      replay command dispatcher

      Usage:
        replay <command> [options]

      Commands:
        scan      Extract match data from a directory of replays into a corpus
        report    Print statistics over a corpus
        inspect   Dump what the extractor sees in a single replay

      Global flags:
        --help    Show this message (or a command's help when given after it)
        --verbose Enable DEBUG logging
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(raw);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[raw.length - 1];
    System.arraycopy(raw, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(raw, commandIndex + 1, delegateArgs, commandIndex, raw.length - commandIndex - 1);
    log.debug("Dispatching {} with {}", command, Arrays.toString(delegateArgs));

    switch (command) {
      case "scan":
        return ScanCli.run(delegateArgs);
      case "report":
        return ReportCli.run(delegateArgs);
      case "inspect":
        return InspectCli.run(delegateArgs);
      default:
        CliInput input = CliInput.parse(raw);
        if (input.verbose()) {
          LoggingConfigurator.enableVerboseLogging();
        }
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
    }
  }

  // The command is the first token that is neither a flag nor a key=value pair.
  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (arg.isEmpty() || arg.startsWith("-") || arg.contains("=")) {
        continue;
      }
      if (arg.equalsIgnoreCase("help")) {
        return -1;
      }
      return i;
    }
    return -1;
  }
}
