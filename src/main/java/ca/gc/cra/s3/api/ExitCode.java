package ca.gc.cra.s3.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the S3 foundation command-line tools.
 * <p><strong>Why:</strong> Lets scripts tell a rejected bucket name or ACL document apart from a usage or I/O
 * error.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Input was well-formed but rejected (invalid bucket name, undecodable ACL). */
  REJECTED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
