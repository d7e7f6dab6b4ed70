package ca.gc.cra.s3.api;

import ca.gc.cra.s3.application.acl.AclConversionResult;
import ca.gc.cra.s3.application.acl.AclXmlConverter;
import ca.gc.cra.s3.config.AclConfig;
import ca.gc.cra.s3.domain.acl.AclGrant;
import ca.gc.cra.s3.domain.acl.Grantee;
import ca.gc.cra.s3.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.s3.infrastructure.xml.StaxXmlPathEventSource;
import ca.gc.cra.s3.logging.LoggingConfigurator;
import ca.gc.cra.s3.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts an {@code AccessControlPolicy} XML file and prints its owner and grants.
 *
 * @since 0.1.0
 */
public final class AclCli {
  private static final Logger log = LoggerFactory.getLogger(AclCli.class);
  private static final String SUMMARY_USAGE =
      "usage: acl in=FILE [maxGrants=N] [format=text|json] [limits.FIELD=N] [config=PATH] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      ACL document conversion

      Usage:
        acl in=./acl.xml [options]

      Required:
        in=FILE                      AccessControlPolicy XML document (UTF-8)

      Optional (validated):
        maxGrants=N                  Grant capacity, 1..10000 (default 100)
        format=text|json             Output rendering (default text)
        limits.emailAddress=N        Grantee e-mail address capacity (default 127)
        limits.userId=N              Grantee canonical id capacity (default 127)
        limits.userDisplayName=N     Grantee display name capacity (default 127)
        limits.groupUri=N            Grantee group URI capacity (default 127)
        limits.permission=N          Permission token capacity (default 31)
        limits.ownerId=N             Owner id capacity (default 127)
        limits.ownerDisplayName=N    Owner display name capacity (default 127)
        limits.document=N            Document capacity in characters (default 65536)
        config=PATH                  YAML file; reads the common and acl sections
        metricsExporter=otlp|none    Configure metrics exporter (default none)
        otelEndpoint=URL             OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --verbose                    Enable DEBUG logging
        --help                       Show this message

      Exit codes:
        0 converted, 1 document rejected, 2 invalid arguments, 3 I/O failure
      """;

  private AclCli() {}

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

    Map<String, String> effective;
    AclConfig config;
    Path file;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("acl", kv, log);
      config = AclConfig.fromMap(effective);
      file = Paths.requireReadableFile(config.input()
          .orElseThrow(() -> new IllegalArgumentException("Missing required argument: in")));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid acl arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    String xml;
    try {
      xml = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.error("Unable to read ACL document {}", file, ex);
      return ExitCode.IO_ERROR;
    }

    AclGrant[] grants = new AclGrant[config.maxGrants()];
    AclConversionResult result;
    try (OpenTelemetryMetricsAdapter metrics = TelemetryConfigurator.openMetrics(effective)) {
      AclXmlConverter converter = new AclXmlConverter(new StaxXmlPathEventSource(), config.limits(), metrics);
      result = converter.convert(xml, grants);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid telemetry arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      if (config.format() == AclConfig.OutputFormat.JSON) {
        CliPrinter.println(new AclJsonWriter().write(result, grants));
      } else {
        CliPrinter.println(renderText(result, grants));
      }
    } catch (IOException ex) {
      log.error("Unable to render ACL output", ex);
      return ExitCode.IO_ERROR;
    }

    if (!result.isOk()) {
      log.error("ACL document {} rejected: {}", file, result.status().displayName());
      return ExitCode.REJECTED;
    }
    return ExitCode.SUCCESS;
  }

  static List<String> renderText(AclConversionResult result, AclGrant[] grants) {
    List<String> lines = new ArrayList<>(result.grantCount() + 2);
    lines.add("status: " + result.status().displayName());
    lines.add("owner: id=" + result.owner().id() + " displayName=" + result.owner().displayName());
    for (int i = 0; i < result.grantCount(); i++) {
      AclGrant grant = grants[i];
      lines.add("grant: " + grant.permission().wireName() + " " + describe(grant.grantee()));
    }
    return lines;
  }

  private static String describe(Grantee grantee) {
    if (grantee instanceof Grantee.EmailAddress email) {
      return "email=" + email.emailAddress();
    }
    if (grantee instanceof Grantee.CanonicalUser user) {
      return "user=" + user.id() + " displayName=" + user.displayName();
    }
    return "group=" + grantee.type().name();
  }
}
