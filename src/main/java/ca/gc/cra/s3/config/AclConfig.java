package ca.gc.cra.s3.config;

import ca.gc.cra.s3.domain.acl.AclLimits;
import ca.gc.cra.s3.validation.Numbers;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the {@code acl} command: decode limits, grant capacity, input file, and output format.
 *
 * @param limits per-field and document limits
 * @param maxGrants length of the grant array allocated for a conversion
 * @param input ACL document to read; empty when not configured
 * @param format output rendering
 * @since 0.1.0
 */
public record AclConfig(AclLimits limits, int maxGrants, Optional<Path> input, OutputFormat format) {
  /** Smallest accepted grant capacity. */
  public static final int MIN_GRANTS = 1;
  /** Largest accepted grant capacity. */
  public static final int MAX_GRANTS = 10_000;
  /** Largest accepted value for any field limit. */
  public static final int MAX_FIELD_LENGTH = 64 * 1024;
  /** Largest accepted document limit (16 MiB). */
  public static final int MAX_DOCUMENT_LENGTH = 16 * 1024 * 1024;

  public AclConfig {
    Objects.requireNonNull(limits, "limits");
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(format, "format");
    Numbers.requireRange("maxGrants", maxGrants, MIN_GRANTS, MAX_GRANTS);
  }

  /**
   * Returns the configuration used when nothing overrides the defaults.
   *
   * @return default configuration with no input file
   */
  public static AclConfig defaults() {
    return new AclConfig(AclLimits.defaults(), AclLimits.DEFAULT_MAX_GRANTS, Optional.empty(), OutputFormat.TEXT);
  }

  /**
   * Builds the configuration from a flattened map such as {@link DefaultsForMode#asFlatMap(String)} merged with
   * YAML and CLI values. Missing keys fall back to {@link #defaults()}.
   *
   * @param map flattened key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static AclConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    AclLimits d = AclLimits.defaults();
    AclLimits limits = new AclLimits(
        field(map, "limits.emailAddress", d.maxEmailAddressLength()),
        field(map, "limits.userId", d.maxUserIdLength()),
        field(map, "limits.userDisplayName", d.maxUserDisplayNameLength()),
        field(map, "limits.groupUri", d.maxGroupUriLength()),
        field(map, "limits.permission", d.maxPermissionLength()),
        field(map, "limits.ownerId", d.maxOwnerIdLength()),
        field(map, "limits.ownerDisplayName", d.maxOwnerDisplayNameLength()),
        intValue(map, "limits.document", d.maxDocumentLength(), 1, MAX_DOCUMENT_LENGTH));
    int maxGrants = intValue(map, "maxGrants", AclLimits.DEFAULT_MAX_GRANTS, MIN_GRANTS, MAX_GRANTS);

    String rawInput = map.getOrDefault("in", "").trim();
    Optional<Path> input = rawInput.isEmpty() ? Optional.empty() : Optional.of(Path.of(rawInput));
    OutputFormat format = OutputFormat.parse(map.getOrDefault("format", "text"));
    return new AclConfig(limits, maxGrants, input, format);
  }

  private static int field(Map<String, String> map, String key, int defaultValue) {
    return intValue(map, key, defaultValue, 1, MAX_FIELD_LENGTH);
  }

  private static int intValue(Map<String, String> map, String key, int defaultValue, int min, int max) {
    String raw = map.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  /** Rendering of a converted ACL. */
  public enum OutputFormat {
    TEXT,
    JSON;

    /**
     * Parses {@code text} or {@code json}, ignoring case.
     *
     * @param raw token
     * @return format
     * @throws IllegalArgumentException for any other token
     */
    public static OutputFormat parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "text", "" -> TEXT;
        case "json" -> JSON;
        default -> throw new IllegalArgumentException("format must be 'text' or 'json' (was " + raw + ")");
      };
    }
  }
}
