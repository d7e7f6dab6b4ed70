package ca.gc.cra.s3.config;

import ca.gc.cra.s3.domain.acl.AclLimits;
import ca.gc.cra.s3.domain.bucket.UriStyle;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI arguments.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "");

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name ({@code acl} or {@code bucket})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when {@code mode} names no configurable command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "acl" -> buildAclDefaults();
      case "bucket" -> buildBucketDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildAclDefaults() {
    AclLimits limits = AclLimits.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("format", "text");
    map.put("maxGrants", Integer.toString(AclLimits.DEFAULT_MAX_GRANTS));
    map.put("limits.emailAddress", Integer.toString(limits.maxEmailAddressLength()));
    map.put("limits.userId", Integer.toString(limits.maxUserIdLength()));
    map.put("limits.userDisplayName", Integer.toString(limits.maxUserDisplayNameLength()));
    map.put("limits.groupUri", Integer.toString(limits.maxGroupUriLength()));
    map.put("limits.permission", Integer.toString(limits.maxPermissionLength()));
    map.put("limits.ownerId", Integer.toString(limits.maxOwnerIdLength()));
    map.put("limits.ownerDisplayName", Integer.toString(limits.maxOwnerDisplayNameLength()));
    map.put("limits.document", Integer.toString(limits.maxDocumentLength()));
    return map;
  }

  private static Map<String, String> buildBucketDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", "");
    map.put("style", UriStyle.VIRTUAL_HOST.name().toLowerCase(Locale.ROOT).replace("_", ""));
    return map;
  }
}
