package ca.gc.cra.s3.api;

import ca.gc.cra.s3.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits {@code key=value} command arguments into an ordered map.
 *
 * <p>Keys are option names such as {@code name}, {@code style} or {@code limits.ownerId}. Values are kept
 * verbatim after trimming, so a bucket name or ACL file path reaches its validator unchanged. Naming the same
 * key twice is an error rather than last-wins.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern OPTION_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  private CliArgsParser() {}

  /**
   * Parses {@code args} in command-line order.
   *
   * @param args raw arguments; {@code null} and blank entries are skipped
   * @return mutable map in argument order
   * @throws IllegalArgumentException when an argument is not {@code key=value}, names an invalid or repeated
   *     option, or carries a NUL character
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    if (args == null) {
      return options;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int eq = raw.indexOf('=');
      String name = eq < 0 ? raw.trim() : raw.substring(0, eq).trim();
      String value = eq < 0 ? "" : raw.substring(eq + 1).trim();
      if (name.isEmpty() || value.isEmpty()) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      if (!OPTION_NAME.matcher(name).matches()) {
        throw new IllegalArgumentException("invalid option name: " + name);
      }
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("option " + name + " must not contain NUL characters");
      }
      if (options.putIfAbsent(name, Strings.requireNonBlank(name, value)) != null) {
        throw new IllegalArgumentException("option " + name + " given more than once");
      }
    }
    return options;
  }
}
