/**
 * <strong>Purpose:</strong> Mutex capability and lock-mode vocabulary shared by the lock bridge and the
 * crypto library adapters.
 * <p><strong>Concurrency:</strong> Handles are opaque; their thread-safety is the host application's contract.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.domain.lock;
