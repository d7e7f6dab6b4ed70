/**
 * OpenTelemetry-backed {@code MetricsPort} adapter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.infrastructure.metrics;
