package ca.gc.cra.s3.application.lock;

import ca.gc.cra.s3.application.port.CryptoLockingPort;
import ca.gc.cra.s3.application.port.MetricsPort;
import ca.gc.cra.s3.application.port.MutexCallbacks;
import ca.gc.cra.s3.application.port.ThreadSelfCallback;
import ca.gc.cra.s3.domain.lock.LockMode;
import ca.gc.cra.s3.domain.lock.MutexHandle;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adapts a host-supplied {@link MutexCallbacks} set to a crypto library's locking
 * callback protocol.
 * <p><strong>Why:</strong> The crypto library requires externally supplied locks for thread safety while the
 * host application owns the mutex primitive.</p>
 * <p><strong>Role:</strong> Application service owning the static lock table between {@link #initialize()} and
 * {@link #deinitialize()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one mutex per static lock index and roll back every created mutex when creation fails.</li>
 *   <li>Register the thread identity, static lock, and dynamic lock hooks with the crypto library.</li>
 *   <li>Unregister every hook before destroying any lock during teardown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> the bridge holds no lock of its own. {@link #initialize()} and
 * {@link #deinitialize()} must each run once, on one thread, with no crypto activity in flight. Between them
 * correctness rests on the crypto library's discipline and the host's mutex implementation. The static lock
 * index is trusted to lie within the table.</p>
 * <p><strong>Observability:</strong> Logs lifecycle transitions; emits {@code crypto.locks.initialized} and
 * {@code crypto.locks.deinitialized} observations carrying the table size.</p>
 *
 * @since 0.1.0
 */
public final class ThirdPartyThreadSafetyBridge {
  private static final Logger log = LoggerFactory.getLogger(ThirdPartyThreadSafetyBridge.class);
  private static final int HOOK_COUNT = 5;

  private final CryptoLockingPort crypto;
  private final MutexCallbacks mutexes;
  private final ThreadSelfCallback threadSelf;
  private final MetricsPort metrics;

  private MutexHandle[] locks;

  /**
   * Creates a bridge without metrics.
   *
   * @param crypto crypto library registration API
   * @param mutexes host mutex capability set; {@link MutexCallbacks#singleThreaded()} disables locking
   * @param threadSelf thread identity hook registered verbatim; may be {@code null}
   */
  public ThirdPartyThreadSafetyBridge(
      CryptoLockingPort crypto, MutexCallbacks mutexes, ThreadSelfCallback threadSelf) {
    this(crypto, mutexes, threadSelf, MetricsPort.NO_OP);
  }

  /**
   * Creates a bridge.
   *
   * @param crypto crypto library registration API
   * @param mutexes host mutex capability set; {@link MutexCallbacks#singleThreaded()} disables locking
   * @param threadSelf thread identity hook registered verbatim; may be {@code null}
   * @param metrics metrics sink
   */
  public ThirdPartyThreadSafetyBridge(
      CryptoLockingPort crypto,
      MutexCallbacks mutexes,
      ThreadSelfCallback threadSelf,
      MetricsPort metrics) {
    this.crypto = Objects.requireNonNull(crypto, "crypto");
    this.mutexes = Objects.requireNonNull(mutexes, "mutexes");
    this.threadSelf = threadSelf;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the static lock table and registers the five locking hooks.
   *
   * <p>When mutex creation fails at index {@code k}, mutexes {@code [0, k)} are destroyed in creation order and
   * no hook is registered. When a hook registration throws, the hooks registered so far are cleared, every
   * mutex is destroyed, and the throwable propagates.</p>
   *
   * @throws S3Exception {@link S3Status#OUT_OF_MEMORY} when the table cannot be allocated,
   *     {@link S3Status#FAILED_TO_CREATE_MUTEX} when a mutex cannot be created, or
   *     {@link S3Status#INTERNAL_ERROR} when the library reports a negative lock count
   * @throws IllegalStateException if the bridge is already initialized
   */
  public void initialize() throws S3Exception {
    if (locks != null) {
      throw new IllegalStateException("Thread safety bridge already initialized");
    }
    int count = crypto.numLocks();
    if (count < 0) {
      throw new S3Exception(S3Status.INTERNAL_ERROR, "crypto library reported " + count + " locks");
    }

    MutexHandle[] table;
    try {
      table = new MutexHandle[count];
    } catch (OutOfMemoryError err) {
      throw new S3Exception(S3Status.OUT_OF_MEMORY, "unable to allocate " + count + " lock slots", err);
    }

    for (int i = 0; i < count; i++) {
      MutexHandle handle;
      try {
        handle = mutexes.createMutex();
      } catch (RuntimeException ex) {
        destroyCreated(table, i);
        throw new S3Exception(S3Status.FAILED_TO_CREATE_MUTEX, "mutex create threw at index " + i, ex);
      }
      if (handle == null) {
        destroyCreated(table, i);
        throw new S3Exception(S3Status.FAILED_TO_CREATE_MUTEX, "mutex create failed at index " + i);
      }
      table[i] = handle;
    }

    locks = table;
    int registered = 0;
    try {
      crypto.setThreadIdCallback(threadSelf);
      registered++;
      crypto.setLockingCallback(this::staticLock);
      registered++;
      crypto.setDynlockCreateCallback(this::dynlockCreate);
      registered++;
      crypto.setDynlockLockCallback(this::dynlockLock);
      registered++;
      crypto.setDynlockDestroyCallback(this::dynlockDestroy);
    } catch (RuntimeException | LinkageError ex) {
      log.warn("Registering crypto locking hook {} failed; rolling back", registered, ex);
      unregister(registered);
      locks = null;
      destroyCreated(table, count);
      throw ex;
    }

    metrics.observe("crypto.locks.initialized", count);
    log.info("Crypto thread safety bridge initialized with {} static locks", count);
  }

  /**
   * Unregisters every locking hook, then destroys every static lock in table order and releases the table.
   * Does nothing when the bridge is not initialized.
   */
  public void deinitialize() {
    MutexHandle[] table = locks;
    if (table == null) {
      return;
    }
    unregister(HOOK_COUNT);

    for (MutexHandle handle : table) {
      mutexes.destroyMutex(handle);
    }
    locks = null;

    metrics.observe("crypto.locks.deinitialized", table.length);
    log.info("Crypto thread safety bridge released {} static locks", table.length);
  }

  /**
   * Indicates whether the lock table is live.
   *
   * @return {@code true} between a successful {@link #initialize()} and {@link #deinitialize()}
   */
  public boolean isInitialized() {
    return locks != null;
  }

  /**
   * Returns the static lock table size.
   *
   * @return number of live static locks; zero when not initialized
   */
  public int lockCount() {
    MutexHandle[] table = locks;
    return table == null ? 0 : table.length;
  }

  /** Clears the first {@code registered} hooks in reverse registration order. */
  private void unregister(int registered) {
    if (registered > 4) {
      crypto.setDynlockDestroyCallback(null);
    }
    if (registered > 3) {
      crypto.setDynlockLockCallback(null);
    }
    if (registered > 2) {
      crypto.setDynlockCreateCallback(null);
    }
    if (registered > 1) {
      crypto.setLockingCallback(null);
    }
    if (registered > 0) {
      crypto.setThreadIdCallback(null);
    }
  }

  private void destroyCreated(MutexHandle[] table, int created) {
    log.warn("Destroying {} created mutexes", created);
    for (int i = 0; i < created; i++) {
      mutexes.destroyMutex(table[i]);
      table[i] = null;
    }
  }

  private void staticLock(int mode, int index, String file, int line) {
    MutexHandle handle = locks[index];
    if (LockMode.isLock(mode)) {
      mutexes.lockMutex(handle);
    } else {
      mutexes.unlockMutex(handle);
    }
  }

  private MutexHandle dynlockCreate(String file, int line) {
    return mutexes.createMutex();
  }

  private void dynlockLock(int mode, MutexHandle lock, String file, int line) {
    if (LockMode.isLock(mode)) {
      mutexes.lockMutex(lock);
    } else {
      mutexes.unlockMutex(lock);
    }
  }

  private void dynlockDestroy(MutexHandle lock, String file, int line) {
    mutexes.destroyMutex(lock);
  }
}
