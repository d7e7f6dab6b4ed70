/**
 * <strong>Purpose:</strong> Bucket addressing vocabulary shared by validation and configuration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.domain.bucket;
