package ca.gc.cra.s3.application.port;

import ca.gc.cra.s3.domain.lock.MutexHandle;

/**
 * <strong>What:</strong> Mutex capability set supplied by the host application.
 * <p><strong>Why:</strong> The host decides which mutex primitive backs the crypto library's locks.</p>
 * <p><strong>Role:</strong> Driving-side port consumed by {@code ThirdPartyThreadSafetyBridge}.</p>
 * <p><strong>Single-threaded mode:</strong> any callback may be {@code null}. A missing {@code create} yields
 * {@link MutexHandle#SINGLE_THREADED}, which is never passed to the host's callbacks; missing {@code lock},
 * {@code unlock}, or {@code destroy} make those operations no-ops. {@link #singleThreaded()} returns the
 * all-absent set.</p>
 * <p><strong>Thread-safety:</strong> when present, the callbacks must form a correct mutex implementation; they
 * are invoked from whichever threads the crypto library runs on.</p>
 *
 * @param create allocates a mutex; returns {@code null} on failure
 * @param lock acquires a mutex
 * @param unlock releases a mutex
 * @param destroy frees a mutex
 * @since 0.1.0
 */
public record MutexCallbacks(Create create, Lock lock, Unlock unlock, Destroy destroy) {
  private static final MutexCallbacks SINGLE_THREADED = new MutexCallbacks(null, null, null, null);

  /**
   * Returns the capability set with every callback absent.
   *
   * @return single-threaded capability set
   */
  public static MutexCallbacks singleThreaded() {
    return SINGLE_THREADED;
  }

  /**
   * Creates a mutex, falling back to the single-threaded sentinel when no create callback is present.
   *
   * @return new handle, or {@code null} when the host's create callback failed
   */
  public MutexHandle createMutex() {
    return create != null ? create.create() : MutexHandle.SINGLE_THREADED;
  }

  /**
   * Acquires {@code handle} when a lock callback is present and the handle came from the host.
   *
   * @param handle handle produced by {@link #createMutex()}
   */
  public void lockMutex(MutexHandle handle) {
    if (lock != null && handle != MutexHandle.SINGLE_THREADED) {
      lock.lock(handle);
    }
  }

  /**
   * Releases {@code handle} when an unlock callback is present and the handle came from the host.
   *
   * @param handle handle produced by {@link #createMutex()}
   */
  public void unlockMutex(MutexHandle handle) {
    if (unlock != null && handle != MutexHandle.SINGLE_THREADED) {
      unlock.unlock(handle);
    }
  }

  /**
   * Frees {@code handle} when a destroy callback is present and the handle came from the host.
   *
   * @param handle handle produced by {@link #createMutex()}
   */
  public void destroyMutex(MutexHandle handle) {
    if (destroy != null && handle != MutexHandle.SINGLE_THREADED) {
      destroy.destroy(handle);
    }
  }

  /** Allocates a mutex. */
  @FunctionalInterface
  public interface Create {
    /**
     * Allocates a new mutex.
     *
     * @return new handle, or {@code null} when allocation failed
     */
    MutexHandle create();
  }

  /** Acquires a mutex, blocking until it is available. */
  @FunctionalInterface
  public interface Lock {
    /**
     * Acquires {@code handle}.
     *
     * @param handle mutex to acquire
     */
    void lock(MutexHandle handle);
  }

  /** Releases a mutex held by the calling thread. */
  @FunctionalInterface
  public interface Unlock {
    /**
     * Releases {@code handle}.
     *
     * @param handle mutex to release
     */
    void unlock(MutexHandle handle);
  }

  /** Frees a mutex that is no longer held. */
  @FunctionalInterface
  public interface Destroy {
    /**
     * Frees {@code handle}.
     *
     * @param handle mutex to free
     */
    void destroy(MutexHandle handle);
  }
}
