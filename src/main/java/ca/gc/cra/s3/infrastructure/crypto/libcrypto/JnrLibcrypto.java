package ca.gc.cra.s3.infrastructure.crypto.libcrypto;

import jnr.ffi.LibraryLoader;
import jnr.ffi.Pointer;
import jnr.ffi.annotations.Delegate;

/**
 * JNR-FFI bindings for the locking callback registration API of libcrypto 1.0.x.
 * <p>libcrypto 1.1 and later turned these functions into no-op macros; calling a binding that the loaded
 * library does not export raises {@link UnsatisfiedLinkError}.</p>
 *
 * @since 0.1.0
 */
public interface JnrLibcrypto {
  /**
   * Loads libcrypto from the default library search path.
   *
   * @return bound library
   * @throws UnsatisfiedLinkError when no libcrypto can be found
   */
  static JnrLibcrypto load() {
    return LibraryLoader.create(JnrLibcrypto.class).load("crypto");
  }

  /**
   * Wraps {@code CRYPTO_num_locks}.
   *
   * @return number of static locks the library indexes
   */
  int CRYPTO_num_locks();

  /**
   * Wraps {@code CRYPTO_set_id_callback}.
   *
   * @param callback thread identity function, or {@code null} to unregister
   */
  void CRYPTO_set_id_callback(IdFunction callback);

  /**
   * Wraps {@code CRYPTO_set_locking_callback}.
   *
   * @param callback static locking function, or {@code null} to unregister
   */
  void CRYPTO_set_locking_callback(LockingFunction callback);

  /**
   * Wraps {@code CRYPTO_set_dynlock_create_callback}.
   *
   * @param callback dynamic lock factory, or {@code null} to unregister
   */
  void CRYPTO_set_dynlock_create_callback(DynlockCreateFunction callback);

  /**
   * Wraps {@code CRYPTO_set_dynlock_lock_callback}.
   *
   * @param callback dynamic lock function, or {@code null} to unregister
   */
  void CRYPTO_set_dynlock_lock_callback(DynlockLockFunction callback);

  /**
   * Wraps {@code CRYPTO_set_dynlock_destroy_callback}.
   *
   * @param callback dynamic lock destructor, or {@code null} to unregister
   */
  void CRYPTO_set_dynlock_destroy_callback(DynlockDestroyFunction callback);

  /** {@code unsigned long (*)(void)}. */
  interface IdFunction {
    @Delegate
    long invoke();
  }

  /** {@code void (*)(int mode, int n, const char *file, int line)}. */
  interface LockingFunction {
    @Delegate
    void invoke(int mode, int n, String file, int line);
  }

  /** {@code struct CRYPTO_dynlock_value *(*)(const char *file, int line)}. */
  interface DynlockCreateFunction {
    @Delegate
    Pointer invoke(String file, int line);
  }

  /** {@code void (*)(int mode, struct CRYPTO_dynlock_value *l, const char *file, int line)}. */
  interface DynlockLockFunction {
    @Delegate
    void invoke(int mode, Pointer lock, String file, int line);
  }

  /** {@code void (*)(struct CRYPTO_dynlock_value *l, const char *file, int line)}. */
  interface DynlockDestroyFunction {
    @Delegate
    void invoke(Pointer lock, String file, int line);
  }
}
