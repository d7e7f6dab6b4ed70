package ca.gc.cra.s3.domain.lock;

/**
 * Opaque mutex capability produced by a host application's create callback.
 *
 * <p>The library never inspects a handle; it only passes it back to the host's lock, unlock, and destroy
 * callbacks. Ownership moves to whichever component holds the handle: the lock table for static locks, the
 * crypto library for dynamic locks.</p>
 *
 * @since 0.1.0
 */
public interface MutexHandle {
  /**
   * Non-null sentinel handed out when the host supplies no create callback. Lock, unlock, and destroy skip it
   * even when the host supplies those callbacks.
   */
  MutexHandle SINGLE_THREADED = new MutexHandle() {
    @Override
    public String toString() {
      return "MutexHandle.SINGLE_THREADED";
    }
  };
}
