package ca.gc.cra.s3.infrastructure.crypto;

import ca.gc.cra.s3.application.port.CryptoLockingPort;
import ca.gc.cra.s3.infrastructure.crypto.libcrypto.JnrLibcrypto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the {@link CryptoLockingPort} for the running platform.
 *
 * @since 0.1.0
 */
public final class CryptoLockingPorts {
  private static final Logger log = LoggerFactory.getLogger(CryptoLockingPorts.class);

  private CryptoLockingPorts() {}

  /**
   * Binds native libcrypto when it exports the locking callback API, otherwise returns a
   * {@link DisabledCryptoLocking}.
   *
   * @return locking port; never {@code null}
   */
  public static CryptoLockingPort detect() {
    try {
      JnrLibcrypto lib = JnrLibcrypto.load();
      int locks = lib.CRYPTO_num_locks();
      log.debug("libcrypto exports locking callbacks with {} static locks", locks);
      return new JnrLibcryptoLocking(lib);
    } catch (UnsatisfiedLinkError ex) {
      log.info("libcrypto locking callbacks unavailable ({}); crypto locking disabled", ex.getMessage());
      return new DisabledCryptoLocking();
    }
  }
}
