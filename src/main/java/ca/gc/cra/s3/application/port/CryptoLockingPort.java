package ca.gc.cra.s3.application.port;

import ca.gc.cra.s3.domain.lock.MutexHandle;

/**
 * <strong>What:</strong> Registration API through which a third-party crypto library accepts externally supplied
 * locking.
 * <p><strong>Why:</strong> Crypto libraries of this generation call back into the host to lock their internal
 * state; the lock bridge satisfies that contract with the host's mutex capability set.</p>
 * <p><strong>Role:</strong> Driven-side port; implemented by the JNR libcrypto binding and by a disabled
 * adapter for libraries that manage their own threading.</p>
 * <p><strong>Registration:</strong> registrations are process-wide. Passing {@code null} unregisters the
 * corresponding hook.</p>
 * <p><strong>Dynamic locks:</strong> the library treats the value returned by the create hook as an opaque
 * per-object token; adapters translate between their native token and the {@link MutexHandle}.</p>
 * <p><strong>Thread-safety:</strong> registration methods must not run concurrently with crypto activity.</p>
 *
 * @since 0.1.0
 */
public interface CryptoLockingPort {
  /**
   * Returns the number of static locks the library indexes through {@link LockingCallback}.
   *
   * @return static lock count
   */
  int numLocks();

  /**
   * Registers or clears the thread identity hook.
   *
   * @param callback identity hook, or {@code null} to unregister
   */
  void setThreadIdCallback(ThreadSelfCallback callback);

  /**
   * Registers or clears the static lock hook.
   *
   * @param callback static lock hook, or {@code null} to unregister
   */
  void setLockingCallback(LockingCallback callback);

  /**
   * Registers or clears the dynamic lock create hook.
   *
   * @param callback create hook, or {@code null} to unregister
   */
  void setDynlockCreateCallback(DynlockCreateCallback callback);

  /**
   * Registers or clears the dynamic lock acquire/release hook.
   *
   * @param callback lock hook, or {@code null} to unregister
   */
  void setDynlockLockCallback(DynlockLockCallback callback);

  /**
   * Registers or clears the dynamic lock destroy hook.
   *
   * @param callback destroy hook, or {@code null} to unregister
   */
  void setDynlockDestroyCallback(DynlockDestroyCallback callback);

  /** Static lock hook: acquires or releases the lock at {@code index}. */
  @FunctionalInterface
  interface LockingCallback {
    /**
     * Acquires or releases a static lock.
     *
     * @param mode mode bits; see {@code LockMode}
     * @param index static lock index in {@code [0, numLocks())}
     * @param file source file of the library call site, for diagnostics
     * @param line source line of the library call site
     */
    void lock(int mode, int index, String file, int line);
  }

  /** Dynamic lock create hook. */
  @FunctionalInterface
  interface DynlockCreateCallback {
    /**
     * Creates a dynamic lock.
     *
     * @param file source file of the library call site
     * @param line source line of the library call site
     * @return new lock, or {@code null} when the host could not create one
     */
    MutexHandle create(String file, int line);
  }

  /** Dynamic lock acquire/release hook. */
  @FunctionalInterface
  interface DynlockLockCallback {
    /**
     * Acquires or releases a dynamic lock.
     *
     * @param mode mode bits; see {@code LockMode}
     * @param lock lock returned by the create hook
     * @param file source file of the library call site
     * @param line source line of the library call site
     */
    void lock(int mode, MutexHandle lock, String file, int line);
  }

  /** Dynamic lock destroy hook. */
  @FunctionalInterface
  interface DynlockDestroyCallback {
    /**
     * Destroys a dynamic lock.
     *
     * @param lock lock returned by the create hook
     * @param file source file of the library call site
     * @param line source line of the library call site
     */
    void destroy(MutexHandle lock, String file, int line);
  }
}
