package ca.gc.cra.s3.api;

import ca.gc.cra.s3.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * S3 foundation CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: s3-foundation <bucket|acl|status> [options]";
  private static final String HELP_TEXT = """
      S3 foundation command dispatcher

      Usage:
        s3-foundation <command> [options]

      Commands:
        bucket    Validate a bucket name (bucket --help for details)
        acl       Convert an AccessControlPolicy XML document (acl --help for details)
        status    List status codes and their retry classification

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
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

    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case "bucket" -> BucketCli.run(delegateArgs);
      case "acl" -> AclCli.run(delegateArgs);
      case "status" -> StatusCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg != null && !arg.isBlank() && !arg.trim().startsWith("-") && !arg.trim().equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
