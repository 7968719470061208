package ca.gc.cra.lookout.api;

import ca.gc.cra.lookout.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LOOKOUT command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: lookout <watch|replay> [options]";
  private static final String HELP_TEXT = """
      LOOKOUT agent session log monitor

      Usage:
        lookout <command> [options]

      Commands:
        watch     Tail a live session and stream its records (watch --help for details)
        replay    Read a finished session once and print its statistics

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a command without terminating the JVM.
   *
   * @param args arguments; the first non-flag token names the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    LoggingConfigurator.configure(input.verbose());
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "watch" -> WatchCli.run(delegateArgs);
      case "replay" -> ReplayCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  /** Drops the command token, keeping flags so the command sees {@code --help} or {@code --dry-run}. */
  private static String[] delegateArgs(String[] args, String command) {
    int idx = Arrays.asList(args).indexOf(command);
    String[] rest = new String[args.length - 1];
    System.arraycopy(args, 0, rest, 0, idx);
    System.arraycopy(args, idx + 1, rest, idx, args.length - idx - 1);
    return rest;
  }
}
