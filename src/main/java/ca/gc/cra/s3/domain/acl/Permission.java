package ca.gc.cra.s3.domain.acl;

import java.util.Objects;
import java.util.Optional;

/**
 * Access permission conveyed by an ACL grant.
 *
 * @since 0.1.0
 */
public enum Permission {
  /** Read object data or list bucket contents. */
  READ("READ"),
  /** Create, overwrite, or delete objects. */
  WRITE("WRITE"),
  /** Read the ACL itself. */
  READ_ACP("READ_ACP"),
  /** Replace the ACL. */
  WRITE_ACP("WRITE_ACP"),
  /** All of the above. */
  FULL_CONTROL("FULL_CONTROL");

  private final String wireName;

  Permission(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the literal used in ACL XML documents.
   *
   * @return wire literal such as {@code READ_ACP}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Matches a permission token against the five wire literals. Matching is exact and case-sensitive.
   *
   * @param token accumulated permission text; must not be {@code null}
   * @return matching permission, or empty for any other value including the empty string
   */
  public static Optional<Permission> fromWireName(CharSequence token) {
    Objects.requireNonNull(token, "token");
    for (Permission permission : values()) {
      if (permission.wireName.contentEquals(token)) {
        return Optional.of(permission);
      }
    }
    return Optional.empty();
  }
}
