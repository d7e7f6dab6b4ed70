package ca.gc.cra.s3.infrastructure.crypto;

import ca.gc.cra.s3.application.port.CryptoLockingPort;
import ca.gc.cra.s3.application.port.ThreadSelfCallback;
import ca.gc.cra.s3.domain.lock.MutexHandle;
import ca.gc.cra.s3.infrastructure.crypto.libcrypto.JnrLibcrypto;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import jnr.ffi.Memory;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;

/**
 * {@link CryptoLockingPort} backed by native libcrypto through JNR-FFI.
 *
 * <p>Each registered Java callback is wrapped in a native closure that stays referenced by this adapter until it
 * is replaced or unregistered, so the JVM never collects a function pointer libcrypto still holds.</p>
 * <p>libcrypto treats a dynamic lock as an opaque {@code struct CRYPTO_dynlock_value *}. The adapter hands out
 * a one-byte native allocation per dynamic lock and maps its address back to the host's {@link MutexHandle}.</p>
 *
 * @since 0.1.0
 */
public final class JnrLibcryptoLocking implements CryptoLockingPort {
  private final JnrLibcrypto lib;
  private final Runtime runtime;
  private final ConcurrentMap<Long, DynlockToken> tokens = new ConcurrentHashMap<>();

  private JnrLibcrypto.IdFunction idFunction;
  private JnrLibcrypto.LockingFunction lockingFunction;
  private JnrLibcrypto.DynlockCreateFunction dynlockCreateFunction;
  private JnrLibcrypto.DynlockLockFunction dynlockLockFunction;
  private JnrLibcrypto.DynlockDestroyFunction dynlockDestroyFunction;

  /**
   * Creates an adapter over a loaded library.
   *
   * @param lib bound libcrypto
   */
  public JnrLibcryptoLocking(JnrLibcrypto lib) {
    this.lib = Objects.requireNonNull(lib, "lib");
    this.runtime = Runtime.getRuntime(lib);
  }

  @Override
  public int numLocks() {
    return lib.CRYPTO_num_locks();
  }

  @Override
  public void setThreadIdCallback(ThreadSelfCallback callback) {
    idFunction = callback == null ? null : callback::threadId;
    lib.CRYPTO_set_id_callback(idFunction);
  }

  @Override
  public void setLockingCallback(LockingCallback callback) {
    lockingFunction = callback == null ? null : callback::lock;
    lib.CRYPTO_set_locking_callback(lockingFunction);
  }

  @Override
  public void setDynlockCreateCallback(DynlockCreateCallback callback) {
    dynlockCreateFunction = callback == null ? null : (file, line) -> {
      MutexHandle handle = callback.create(file, line);
      if (handle == null) {
        return null;
      }
      Pointer token = Memory.allocateDirect(runtime, 1);
      tokens.put(token.address(), new DynlockToken(token, handle));
      return token;
    };
    lib.CRYPTO_set_dynlock_create_callback(dynlockCreateFunction);
  }

  @Override
  public void setDynlockLockCallback(DynlockLockCallback callback) {
    dynlockLockFunction = callback == null ? null
        : (mode, lock, file, line) -> callback.lock(mode, handleOf(lock), file, line);
    lib.CRYPTO_set_dynlock_lock_callback(dynlockLockFunction);
  }

  @Override
  public void setDynlockDestroyCallback(DynlockDestroyCallback callback) {
    dynlockDestroyFunction = callback == null ? null : (lock, file, line) -> {
      DynlockToken token = tokens.remove(lock.address());
      if (token == null) {
        throw new IllegalStateException("unknown dynamic lock at 0x" + Long.toHexString(lock.address()));
      }
      callback.destroy(token.handle(), file, line);
    };
    lib.CRYPTO_set_dynlock_destroy_callback(dynlockDestroyFunction);
  }

  private MutexHandle handleOf(Pointer lock) {
    DynlockToken token = tokens.get(lock.address());
    if (token == null) {
      throw new IllegalStateException("unknown dynamic lock at 0x" + Long.toHexString(lock.address()));
    }
    return token.handle();
  }

  // The pointer field keeps the native allocation reachable for as long as libcrypto may use it.
  private record DynlockToken(Pointer memory, MutexHandle handle) {}
}
