/**
 * Crypto library locking adapters: a JNR-FFI libcrypto binding and a disabled adapter for libraries that
 * manage their own threading.
 *
 * @since 0.1.0
 */
package ca.gc.cra.s3.infrastructure.crypto;
