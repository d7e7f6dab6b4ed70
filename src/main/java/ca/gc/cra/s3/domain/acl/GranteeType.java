package ca.gc.cra.s3.domain.acl;

/**
 * Kind of identity an ACL grant applies to.
 *
 * @since 0.1.0
 */
public enum GranteeType {
  /** Customer identified by e-mail address. */
  EMAIL_ADDRESS,
  /** Customer identified by canonical user id and display name. */
  CANONICAL_USER,
  /** Built-in group of every authenticated account holder. */
  ALL_AWS_USERS,
  /** Built-in group of everyone, including anonymous requests. */
  ALL_USERS
}
