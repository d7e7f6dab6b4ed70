package ca.gc.cra.s3.infrastructure.crypto;

import ca.gc.cra.s3.application.port.CryptoLockingPort;
import ca.gc.cra.s3.application.port.ThreadSelfCallback;

/**
 * {@link CryptoLockingPort} for crypto libraries that manage their own threading, such as libcrypto 1.1 and
 * later. Reports zero static locks; registrations are kept so callers can inspect them but are never invoked.
 *
 * @since 0.1.0
 */
public final class DisabledCryptoLocking implements CryptoLockingPort {
  private volatile ThreadSelfCallback threadIdCallback;
  private volatile LockingCallback lockingCallback;
  private volatile DynlockCreateCallback dynlockCreateCallback;
  private volatile DynlockLockCallback dynlockLockCallback;
  private volatile DynlockDestroyCallback dynlockDestroyCallback;

  @Override
  public int numLocks() {
    return 0;
  }

  @Override
  public void setThreadIdCallback(ThreadSelfCallback callback) {
    threadIdCallback = callback;
  }

  @Override
  public void setLockingCallback(LockingCallback callback) {
    lockingCallback = callback;
  }

  @Override
  public void setDynlockCreateCallback(DynlockCreateCallback callback) {
    dynlockCreateCallback = callback;
  }

  @Override
  public void setDynlockLockCallback(DynlockLockCallback callback) {
    dynlockLockCallback = callback;
  }

  @Override
  public void setDynlockDestroyCallback(DynlockDestroyCallback callback) {
    dynlockDestroyCallback = callback;
  }

  /**
   * Counts the hooks currently registered.
   *
   * @return number of non-null registrations, between 0 and 5
   */
  public int registeredHookCount() {
    int count = 0;
    count += threadIdCallback != null ? 1 : 0;
    count += lockingCallback != null ? 1 : 0;
    count += dynlockCreateCallback != null ? 1 : 0;
    count += dynlockLockCallback != null ? 1 : 0;
    count += dynlockDestroyCallback != null ? 1 : 0;
    return count;
  }
}
