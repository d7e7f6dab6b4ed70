package ca.gc.cra.s3.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key, or when a key is unknown
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.containsKey(entry.getKey())) {
        sink.accept("Ignoring unknown YAML key for " + mode + ": " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("acl".equalsIgnoreCase(mode)) {
      String format = effective.getOrDefault("format", "text").trim().toLowerCase(Locale.ROOT);
      if (!format.equals("text") && !format.equals("json")) {
        throw new IllegalArgumentException("format must be 'text' or 'json' (was " + format + ")");
      }
    }
  }
}
