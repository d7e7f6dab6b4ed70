package ca.gc.cra.s3.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration flows.
 * <p><strong>Why:</strong> ACL documents and YAML files are read whole, so the CLI checks the input file up front
 * and reports a usable message instead of an I/O stack trace.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} names an existing readable regular file.
   *
   * @param path candidate input file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path contains control characters, is missing, is not a regular file,
   *     or is not readable
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS) && !Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("path is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }
}
