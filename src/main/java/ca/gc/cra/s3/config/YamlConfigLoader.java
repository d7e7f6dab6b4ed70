package ca.gc.cra.s3.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the {@code s3} tool's YAML configuration file.
 *
 * <p>Top-level sections are {@code common} plus one per command ({@code acl}, {@code bucket}, {@code status}),
 * matched case-insensitively; any other section is rejected so a misspelt command name does not silently
 * drop its settings. The requested command's section is layered over {@code common}, and nested mappings
 * become dotted keys: {@code acl: {limits: {emailAddress: 64}}} yields {@code limits.emailAddress=64}.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Set<String> COMMANDS = Set.of("acl", "bucket", "status");

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to {@code command}.
   *
   * @param path YAML file
   * @param command command name, case-insensitive
   * @return flat settings, empty when {@code path} does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the command is unknown or the document is not a valid configuration
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = sectionName(Objects.requireNonNull(command, "command"));
    if (!COMMANDS.contains(section)) {
      throw new IllegalArgumentException("Unknown command section: " + command);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    mapping(document, path.toString()).forEach((name, body) -> {
      String key = sectionName(name);
      if (!key.equals(COMMON) && !COMMANDS.contains(key)) {
        throw new IllegalArgumentException("Unknown section '" + name + "' in " + path);
      }
      if (sections.put(key, body) != null) {
        throw new IllegalArgumentException("Section '" + key + "' appears more than once in " + path);
      }
    });

    Map<String, String> settings = new LinkedHashMap<>();
    for (String key : new String[] {COMMON, section}) {
      Object body = sections.get(key);
      if (body != null) {
        flatten(mapping(body, key), key, "", settings);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static String sectionName(String raw) {
    return raw.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> node, String section, String prefix, Map<String, String> out) {
    node.forEach((name, value) -> {
      String key = prefix + name;
      if (value instanceof Map<?, ?>) {
        flatten(mapping(value, section + "." + key), section, key + ".", out);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + key);
      } else {
        out.put(key, value == null ? "" : value.toString());
      }
    });
  }
}
