package ca.gc.cra.s3.domain.acl;

import java.util.Objects;

/**
 * Owner of the bucket or object an ACL belongs to. Either field is empty when absent from the document.
 *
 * @param id canonical id of the owner
 * @param displayName owner display name
 * @since 0.1.0
 */
public record Owner(String id, String displayName) {
  /** Owner with both fields empty. */
  public static final Owner EMPTY = new Owner("", "");

  public Owner {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(displayName, "displayName");
  }
}
