package ca.gc.cra.s3.application.lock;

import ca.gc.cra.s3.application.port.CryptoLockingPort;
import ca.gc.cra.s3.application.port.MetricsPort;
import ca.gc.cra.s3.application.port.MutexCallbacks;
import ca.gc.cra.s3.application.port.RequestApiPort;
import ca.gc.cra.s3.application.port.ThreadSelfCallback;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-wide lifecycle of the S3 foundation services.
 * <p><strong>Why:</strong> The crypto library's locking hooks are global, so exactly one
 * {@link ThirdPartyThreadSafetyBridge} may be live per process.</p>
 * <p><strong>Ordering:</strong> initialize sets up the locks first and then the request subsystem; when the
 * request subsystem fails the locks are released again. Deinitialize runs in reverse.</p>
 * <p><strong>Thread-safety:</strong> methods are {@code synchronized} to guard the static bridge reference only.</p>
 *
 * @since 0.1.0
 */
public final class S3Library {
  private static final Logger log = LoggerFactory.getLogger(S3Library.class);

  private static ThirdPartyThreadSafetyBridge bridge;
  private static RequestApiPort requestApi;

  private S3Library() {}

  /**
   * Initializes the locks and the request subsystem.
   *
   * @param userAgentInfo product token forwarded to the request subsystem; may be {@code null}
   * @param crypto crypto library registration API
   * @param mutexes host mutex capability set
   * @param threadSelf thread identity hook; may be {@code null}
   * @param requestApiPort request subsystem lifecycle
   * @param metrics metrics sink
   * @throws S3Exception when the lock bridge or the request subsystem fails to start; nothing stays
   *     registered in that case
   * @throws IllegalStateException if the library is already initialized
   * @throws RuntimeException rethrown from the request subsystem after the locks are released
   */
  public static synchronized void initialize(
      String userAgentInfo,
      CryptoLockingPort crypto,
      MutexCallbacks mutexes,
      ThreadSelfCallback threadSelf,
      RequestApiPort requestApiPort,
      MetricsPort metrics)
      throws S3Exception {
    Objects.requireNonNull(requestApiPort, "requestApiPort");
    if (bridge != null) {
      throw new IllegalStateException("S3 library already initialized");
    }
    ThirdPartyThreadSafetyBridge candidate =
        new ThirdPartyThreadSafetyBridge(crypto, mutexes, threadSelf, metrics);
    candidate.initialize();

    S3Status status;
    try {
      status = requestApiPort.initialize(userAgentInfo);
    } catch (RuntimeException ex) {
      log.warn("Request subsystem threw during initialization; releasing crypto locks", ex);
      candidate.deinitialize();
      throw ex;
    }
    if (!status.isOk()) {
      log.warn("Request subsystem failed to initialize ({}); releasing crypto locks", status.displayName());
      candidate.deinitialize();
      throw new S3Exception(status, "request subsystem initialization failed");
    }

    bridge = candidate;
    requestApi = requestApiPort;
    log.debug("S3 library initialized");
  }

  /**
   * Deinitializes the request subsystem and then the locks. Does nothing when not initialized.
   */
  public static synchronized void deinitialize() {
    if (bridge == null) {
      return;
    }
    requestApi.deinitialize();
    bridge.deinitialize();
    bridge = null;
    requestApi = null;
    log.debug("S3 library deinitialized");
  }

  /**
   * Indicates whether the library is initialized.
   *
   * @return {@code true} between a successful initialize and deinitialize
   */
  public static synchronized boolean isInitialized() {
    return bridge != null;
  }
}
