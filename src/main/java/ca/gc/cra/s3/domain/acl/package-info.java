/**
 * <strong>Purpose:</strong> Access control list value types and the bounded-memory streaming grant decoder.
 * <p><strong>Concurrency:</strong> Value types are immutable; {@link ca.gc.cra.s3.domain.acl.AclGrantDecoder}
 * and {@link ca.gc.cra.s3.domain.acl.BoundedText} are single-threaded and scoped to one decode.
 * <p><strong>Performance:</strong> Accumulators are sized once from {@link ca.gc.cra.s3.domain.acl.AclLimits};
 * nothing grows while decoding.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.domain.acl;
