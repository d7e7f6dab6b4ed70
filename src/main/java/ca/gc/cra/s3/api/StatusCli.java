package ca.gc.cra.s3.api;

import ca.gc.cra.s3.domain.status.S3Status;
import ca.gc.cra.s3.logging.LoggingConfigurator;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists status codes, or describes a single one.
 *
 * @since 0.1.0
 */
public final class StatusCli {
  private static final Logger log = LoggerFactory.getLogger(StatusCli.class);
  private static final String SUMMARY_USAGE = "usage: status [name=STATUS]";
  private static final String HELP_TEXT = """
      Status code reference

      Usage:
        status                List every status with its category and retry classification
        status name=STATUS    Describe one status, by display name (InvalidBucketNameTooLong)
                              or constant name (INVALID_BUCKET_NAME_TOO_LONG)
      """;

  private StatusCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid status arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String name = kv.get("name");
    if (name == null) {
      for (S3Status status : S3Status.values()) {
        CliPrinter.println(describe(status));
      }
      return ExitCode.SUCCESS;
    }

    Optional<S3Status> status = S3Status.fromName(name);
    if (status.isEmpty()) {
      log.error("Unknown status: {}", name);
      return ExitCode.INVALID_ARGS;
    }
    CliPrinter.println(describe(status.get()));
    return ExitCode.SUCCESS;
  }

  static String describe(S3Status status) {
    return status.displayName() + "\t" + status.category() + "\tretryable=" + status.isRetryable();
  }
}
