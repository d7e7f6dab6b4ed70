/**
 * <strong>Purpose:</strong> Status taxonomy shared by the lock bridge, ACL decoder, and bucket validator.
 * <p><strong>Concurrency:</strong> Immutable enum and exception types.
 * <p><strong>Observability:</strong> Status display names are the values written to logs and CLI output.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.domain.status;
