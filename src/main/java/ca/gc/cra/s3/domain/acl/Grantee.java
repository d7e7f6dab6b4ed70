package ca.gc.cra.s3.domain.acl;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity a grant applies to. Exactly one variant is resolved per committed grant.
 *
 * @since 0.1.0
 */
public sealed interface Grantee
    permits Grantee.EmailAddress, Grantee.CanonicalUser, Grantee.AllAwsUsers, Grantee.AllUsers {

  /** Group URI identifying every authenticated account holder. */
  String AUTHENTICATED_USERS_URI = "http://acs.amazonaws.com/groups/global/AuthenticatedUsers";

  /** Group URI identifying everyone. */
  String ALL_USERS_URI = "http://acs.amazonaws.com/groups/global/AllUsers";

  /** Shared instance of the authenticated-users group. */
  Grantee ALL_AWS_USERS = new AllAwsUsers();

  /** Shared instance of the everyone group. */
  Grantee ALL_USERS = new AllUsers();

  /**
   * Returns the variant discriminator.
   *
   * @return grantee type
   */
  GranteeType type();

  /**
   * Resolves one of the two built-in groups by URI. Matching is exact.
   *
   * @param uri accumulated group URI text
   * @return the group grantee, or empty when the URI names neither group
   */
  static Optional<Grantee> group(CharSequence uri) {
    Objects.requireNonNull(uri, "uri");
    if (AUTHENTICATED_USERS_URI.contentEquals(uri)) {
      return Optional.of(ALL_AWS_USERS);
    }
    if (ALL_USERS_URI.contentEquals(uri)) {
      return Optional.of(ALL_USERS);
    }
    return Optional.empty();
  }

  /**
   * Customer identified by e-mail address.
   *
   * @param emailAddress e-mail address as it appeared in the document
   */
  record EmailAddress(String emailAddress) implements Grantee {
    public EmailAddress {
      Objects.requireNonNull(emailAddress, "emailAddress");
    }

    @Override
    public GranteeType type() {
      return GranteeType.EMAIL_ADDRESS;
    }
  }

  /**
   * Customer identified by canonical id.
   *
   * @param id canonical user id
   * @param displayName display name reported alongside the id
   */
  record CanonicalUser(String id, String displayName) implements Grantee {
    public CanonicalUser {
      Objects.requireNonNull(id, "id");
      Objects.requireNonNull(displayName, "displayName");
    }

    @Override
    public GranteeType type() {
      return GranteeType.CANONICAL_USER;
    }
  }

  /** Every authenticated account holder. */
  record AllAwsUsers() implements Grantee {
    @Override
    public GranteeType type() {
      return GranteeType.ALL_AWS_USERS;
    }
  }

  /** Everyone. */
  record AllUsers() implements Grantee {
    @Override
    public GranteeType type() {
      return GranteeType.ALL_USERS;
    }
  }
}
