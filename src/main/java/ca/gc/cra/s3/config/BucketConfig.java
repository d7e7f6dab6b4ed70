package ca.gc.cra.s3.config;

import ca.gc.cra.s3.domain.bucket.UriStyle;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code bucket} command.
 *
 * @param name bucket name to validate; may be empty when not configured
 * @param style URI style whose grammar applies
 * @since 0.1.0
 */
public record BucketConfig(String name, UriStyle style) {
  public BucketConfig {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(style, "style");
  }

  /**
   * Builds the configuration from a flattened map. A missing or blank {@code style} selects
   * {@link UriStyle#VIRTUAL_HOST}.
   *
   * @param map flattened key/value settings
   * @return configuration
   * @throws IllegalArgumentException when {@code style} names no URI style
   */
  public static BucketConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    String style = map.getOrDefault("style", "");
    return new BucketConfig(
        map.getOrDefault("name", ""),
        style.isBlank() ? UriStyle.VIRTUAL_HOST : UriStyle.parse(style));
  }
}
