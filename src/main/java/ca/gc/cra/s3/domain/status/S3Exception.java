package ca.gc.cra.s3.domain.status;

import java.util.Objects;

/**
 * Checked exception carrying the {@link S3Status} that caused an operation to fail.
 *
 * @since 0.1.0
 */
public final class S3Exception extends Exception {
  private static final long serialVersionUID = 1L;

  private final S3Status status;

  /**
   * Creates an exception whose message is the status display name.
   *
   * @param status failure status; must not be {@code null} or {@link S3Status#OK}
   */
  public S3Exception(S3Status status) {
    this(status, status == null ? null : status.displayName(), null);
  }

  /**
   * Creates an exception with a descriptive message.
   *
   * @param status failure status; must not be {@code null} or {@link S3Status#OK}
   * @param msg human-readable detail
   */
  public S3Exception(S3Status status, String msg) {
    this(status, msg, null);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param status failure status; must not be {@code null} or {@link S3Status#OK}
   * @param msg human-readable detail
   * @param cause root cause raised by a callback or native binding
   */
  public S3Exception(S3Status status, String msg, Throwable cause) {
    super(msg, cause);
    this.status = Objects.requireNonNull(status, "status");
    if (status.isOk()) {
      throw new IllegalArgumentException("S3Exception requires a failure status");
    }
  }

  /**
   * Returns the failure status.
   *
   * @return status; never {@link S3Status#OK}
   */
  public S3Status status() {
    return status;
  }
}
