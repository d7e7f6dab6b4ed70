package ca.gc.cra.s3.domain.lock;

/**
 * Mode bits passed by the crypto library to its locking callbacks.
 *
 * @since 0.1.0
 */
public final class LockMode {
  /** Acquire the lock. When clear, the call releases it. */
  public static final int LOCK = 1;
  /** Release the lock. */
  public static final int UNLOCK = 2;
  /** Shared access requested. */
  public static final int READ = 4;
  /** Exclusive access requested. */
  public static final int WRITE = 8;

  private LockMode() {
    // Utility
  }

  /**
   * Tests the acquire bit.
   *
   * @param mode mode word from the crypto library
   * @return {@code true} when the call acquires, {@code false} when it releases
   */
  public static boolean isLock(int mode) {
    return (mode & LOCK) != 0;
  }
}
