/**
 * <strong>Purpose:</strong> Bucket-name grammar plus validation helpers used during CLI parsing and
 * configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; grammar failures surface as
 * {@code S3Status} values and argument failures via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.validation;
