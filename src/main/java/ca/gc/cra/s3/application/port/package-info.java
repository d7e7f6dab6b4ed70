/**
 * Ports connecting the S3 foundation services to the host application, the crypto library, XML parsing, the
 * request subsystem, and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.application.port;
