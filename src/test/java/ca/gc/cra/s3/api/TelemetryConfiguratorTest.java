package ca.gc.cra.s3.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  @AfterEach
  void clearProperties() {
    for (String property : PROPERTIES) {
      System.clearProperty(property);
    }
  }

  @Test
  void validValuesBecomeSystemProperties() {
    TelemetryConfigurator.configureMetrics(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "https://collector.example:4317",
        "otelResourceAttributes", "env=test"));

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("https://collector.example:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("env=test", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void invalidEndpointLeavesPropertiesUntouched() {
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(Map.of(
        "metricsExporter", "otlp",
        "otelEndpoint", "ftp://collector")));

    assertNull(System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "prometheus")));
  }
}
