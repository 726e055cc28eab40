package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sluice CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sluice <transfer|generate> [options]";
  private static final String HELP_TEXT = """
      sluice: bounded-memory file transfer with backpressure

      Usage:
        sluice <command> [options]

      Commands:
        transfer    Copy a file through the backpressure core (transfer --help for details)
        generate    Write a sample input file (generate --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
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
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    // global flags before the command travel with the delegated arguments
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Dispatching {} with {}", command, Arrays.toString(delegateArgs));
    }

    return switch (command) {
      case "transfer" -> TransferCli.run(delegateArgs);
      case "generate" -> GenerateCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
