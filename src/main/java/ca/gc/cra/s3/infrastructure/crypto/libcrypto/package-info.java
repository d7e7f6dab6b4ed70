/**
 * JNR-FFI binding for libcrypto's locking callback registration functions.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.infrastructure.crypto.libcrypto;
