package ca.gc.cra.s3.api;

import ca.gc.cra.s3.config.BucketConfig;
import ca.gc.cra.s3.domain.status.S3Status;
import ca.gc.cra.s3.logging.LoggingConfigurator;
import ca.gc.cra.s3.logging.Logs;
import ca.gc.cra.s3.validation.BucketNameValidator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a bucket name against the naming grammar of a URI style.
 *
 * @since 0.1.0
 */
public final class BucketCli {
  private static final Logger log = LoggerFactory.getLogger(BucketCli.class);
  private static final int LOG_NAME_BYTES = 300;
  private static final String SUMMARY_USAGE =
      "usage: bucket name=NAME [style=path|virtualhost] [config=PATH]";
  private static final String HELP_TEXT = """
      Bucket name validation

      Usage:
        bucket name=my-bucket [options]

      Required:
        name=NAME                 Bucket name to check

      Optional:
        style=path|virtualhost    URI style whose grammar applies (default virtualhost)
        config=PATH               YAML file; reads the common and bucket sections
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Output:
        OK, or the name of the first rule the bucket name breaks.

      Exit codes:
        0 valid, 1 rejected, 2 invalid arguments, 3 configuration read failure
      """;

  private BucketCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    BucketConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      config = BucketConfig.fromMap(ConfigCliUtils.effectiveConfig("bucket", kv, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid bucket arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (config.name().isEmpty()) {
      log.error("Missing required argument: name");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    S3Status status = BucketNameValidator.validate(config.name(), config.style());
    CliPrinter.println(status.displayName());
    if (!status.isOk()) {
      log.debug("Bucket name {} rejected for {} style: {}",
          Logs.truncate(config.name(), LOG_NAME_BYTES), config.style(), status.displayName());
      return ExitCode.REJECTED;
    }
    return ExitCode.SUCCESS;
  }
}
