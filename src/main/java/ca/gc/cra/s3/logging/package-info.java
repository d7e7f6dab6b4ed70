/**
 * Logback level control and log hygiene helpers shared by the CLI and application services.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.logging;
