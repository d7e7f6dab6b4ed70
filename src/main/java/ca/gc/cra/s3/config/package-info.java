/**
 * Configuration for the command-line tool: YAML loading, embedded defaults, merge precedence, and typed
 * per-command settings.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.config;
