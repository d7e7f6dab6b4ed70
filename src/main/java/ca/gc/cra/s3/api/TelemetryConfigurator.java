package ca.gc.cra.s3.api;

import ca.gc.cra.s3.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.s3.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the JVM and opens the metrics adapter used by a CLI run.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Publishes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} as the system
   * properties read by the OpenTelemetry bootstrap, then opens the adapter.
   *
   * @param config effective configuration
   * @return open adapter; callers close it to flush metrics before exit
   * @throws IllegalArgumentException when a telemetry value is malformed
   */
  static OpenTelemetryMetricsAdapter openMetrics(Map<String, String> config) {
    configureMetrics(config);
    return new OpenTelemetryMetricsAdapter();
  }

  static void configureMetrics(Map<String, String> config) {
    if (config == null || config.isEmpty()) {
      return;
    }
    String exporter = trimToNull(config.get("metricsExporter"));
    if (exporter != null) {
      exporter = exporter.toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    }
    String endpoint = trimToNull(config.get("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
    }
    String resourceAttributes = config.get("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      resourceAttributes = Strings.requirePrintableAscii(
          "otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    } else {
      resourceAttributes = null;
    }

    // Properties are only touched once every value has been validated.
    if (exporter != null) {
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty("otel.metrics.exporter", exporter);
    }
    if (endpoint != null) {
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    if (resourceAttributes != null) {
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
