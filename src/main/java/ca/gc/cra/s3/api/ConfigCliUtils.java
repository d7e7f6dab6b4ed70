package ca.gc.cra.s3.api;

import ca.gc.cra.s3.config.ConfigMerger;
import ca.gc.cra.s3.config.DefaultsForMode;
import ca.gc.cra.s3.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI arguments with YAML and embedded defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves the effective configuration for {@code mode}: removes {@code config=PATH} from {@code args}, loads
   * that YAML file, and merges it between the embedded defaults and the remaining CLI arguments.
   *
   * @param mode command name
   * @param args mutable CLI arguments
   * @param log logger receiving override warnings
   * @return effective configuration
   * @throws IllegalArgumentException when the YAML file is missing or invalid, or the merge fails validation
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> args, Logger log)
      throws IOException {
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, args, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
