package ca.gc.cra.s3.domain.bucket;

import java.util.Locale;
import java.util.Objects;

/**
 * Convention used to address a bucket in request URIs. Each style imposes its own bucket naming grammar.
 *
 * @since 0.1.0
 */
public enum UriStyle {
  /** {@code https://host/bucket/key}: up to 255 characters, underscores allowed. */
  PATH(255),
  /** {@code https://bucket.host/key}: up to 63 characters, DNS-compatible names only. */
  VIRTUAL_HOST(63);

  private final int maxBucketNameLength;

  UriStyle(int maxBucketNameLength) {
    this.maxBucketNameLength = maxBucketNameLength;
  }

  /**
   * Returns the longest bucket name accepted under this style.
   *
   * @return maximum length in characters
   */
  public int maxBucketNameLength() {
    return maxBucketNameLength;
  }

  /**
   * Parses a CLI/config token such as {@code path}, {@code virtualhost}, or {@code virtual-host}.
   *
   * @param raw token; case-insensitive
   * @return matching style
   * @throws IllegalArgumentException when the token names no style
   */
  public static UriStyle parse(String raw) {
    Objects.requireNonNull(raw, "raw");
    String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
    return switch (normalized) {
      case "path" -> PATH;
      case "virtualhost", "vhost" -> VIRTUAL_HOST;
      default -> throw new IllegalArgumentException("style must be 'path' or 'virtualhost' (was " + raw + ")");
    };
  }
}
