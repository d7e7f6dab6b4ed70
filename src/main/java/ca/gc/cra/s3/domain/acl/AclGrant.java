package ca.gc.cra.s3.domain.acl;

import java.util.Objects;

/**
 * One (grantee, permission) pair of an access control list.
 *
 * @param grantee identity receiving the permission
 * @param permission permission granted
 * @since 0.1.0
 */
public record AclGrant(Grantee grantee, Permission permission) {
  public AclGrant {
    Objects.requireNonNull(grantee, "grantee");
    Objects.requireNonNull(permission, "permission");
  }

  /**
   * Returns the grantee discriminator.
   *
   * @return grantee type
   */
  public GranteeType granteeType() {
    return grantee.type();
  }
}
