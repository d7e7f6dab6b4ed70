package ca.gc.cra.s3.application.port;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory stand-in for the crypto library registration API. Records every registration call in order.
 */
public final class FakeCryptoLockingPort implements CryptoLockingPort {
  private final int numLocks;
  private final List<String> events;
  private String failingHook;

  public ThreadSelfCallback threadId;
  public LockingCallback locking;
  public DynlockCreateCallback dynlockCreate;
  public DynlockLockCallback dynlockLock;
  public DynlockDestroyCallback dynlockDestroy;

  public FakeCryptoLockingPort(int numLocks) {
    this(numLocks, new ArrayList<>());
  }

  /**
   * Creates a fake that appends to a shared event journal.
   *
   * @param numLocks static lock count reported to the bridge
   * @param events journal shared with the mutex host double
   */
  public FakeCryptoLockingPort(int numLocks, List<String> events) {
    this.numLocks = numLocks;
    this.events = events;
  }

  @Override
  public int numLocks() {
    return numLocks;
  }

  @Override
  public void setThreadIdCallback(ThreadSelfCallback callback) {
    record("threadId", callback);
    threadId = callback;
  }

  @Override
  public void setLockingCallback(LockingCallback callback) {
    record("locking", callback);
    locking = callback;
  }

  @Override
  public void setDynlockCreateCallback(DynlockCreateCallback callback) {
    record("dynlockCreate", callback);
    dynlockCreate = callback;
  }

  @Override
  public void setDynlockLockCallback(DynlockLockCallback callback) {
    record("dynlockLock", callback);
    dynlockLock = callback;
  }

  @Override
  public void setDynlockDestroyCallback(DynlockDestroyCallback callback) {
    record("dynlockDestroy", callback);
    dynlockDestroy = callback;
  }

  /**
   * Makes registering {@code hook} throw {@link UnsatisfiedLinkError}, as a libcrypto missing that symbol would.
   *
   * @param hook journal name of the hook, e.g. {@code dynlockCreate}
   */
  public void failOn(String hook) {
    failingHook = hook;
  }

  public boolean anyRegistered() {
    return threadId != null || locking != null || dynlockCreate != null || dynlockLock != null
        || dynlockDestroy != null;
  }

  public List<String> events() {
    return events;
  }

  private void record(String hook, Object callback) {
    if (callback != null && hook.equals(failingHook)) {
      throw new UnsatisfiedLinkError("CRYPTO_set_" + hook + "_callback");
    }
    events.add((callback == null ? "unset " : "set ") + hook);
  }
}
