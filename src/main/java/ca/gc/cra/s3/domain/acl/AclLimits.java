package ca.gc.cra.s3.domain.acl;

/**
 * Capacity of every bounded text field read while decoding an ACL document.
 *
 * <p>Each limit is a maximum character count. Text whose cumulative length exceeds the limit fails the decode
 * with the field's own status; nothing is truncated. The defaults leave room for a terminator in 128 and 32
 * byte C buffers.</p>
 *
 * @param maxEmailAddressLength grantee e-mail address
 * @param maxUserIdLength grantee canonical user id
 * @param maxUserDisplayNameLength grantee display name
 * @param maxGroupUriLength grantee group URI
 * @param maxPermissionLength permission token
 * @param maxOwnerIdLength owner canonical id
 * @param maxOwnerDisplayNameLength owner display name
 * @param maxDocumentLength whole XML document, in characters
 * @since 0.1.0
 */
public record AclLimits(
    int maxEmailAddressLength,
    int maxUserIdLength,
    int maxUserDisplayNameLength,
    int maxGroupUriLength,
    int maxPermissionLength,
    int maxOwnerIdLength,
    int maxOwnerDisplayNameLength,
    int maxDocumentLength) {

  /** Default e-mail address capacity. */
  public static final int DEFAULT_EMAIL_ADDRESS_LENGTH = 127;
  /** Default canonical user id capacity, shared by grantee and owner ids. */
  public static final int DEFAULT_USER_ID_LENGTH = 127;
  /** Default display name capacity, shared by grantee and owner display names. */
  public static final int DEFAULT_DISPLAY_NAME_LENGTH = 127;
  /** Default group URI capacity. */
  public static final int DEFAULT_GROUP_URI_LENGTH = 127;
  /** Default permission token capacity. */
  public static final int DEFAULT_PERMISSION_LENGTH = 31;
  /** Default document capacity (64 KiB). */
  public static final int DEFAULT_DOCUMENT_LENGTH = 64 * 1024;
  /** Default number of grants a caller allocates room for. */
  public static final int DEFAULT_MAX_GRANTS = 100;

  public AclLimits {
    requirePositive("maxEmailAddressLength", maxEmailAddressLength);
    requirePositive("maxUserIdLength", maxUserIdLength);
    requirePositive("maxUserDisplayNameLength", maxUserDisplayNameLength);
    requirePositive("maxGroupUriLength", maxGroupUriLength);
    requirePositive("maxPermissionLength", maxPermissionLength);
    requirePositive("maxOwnerIdLength", maxOwnerIdLength);
    requirePositive("maxOwnerDisplayNameLength", maxOwnerDisplayNameLength);
    requirePositive("maxDocumentLength", maxDocumentLength);
  }

  /**
   * Returns the limits used when no configuration overrides them.
   *
   * @return default limits
   */
  public static AclLimits defaults() {
    return new AclLimits(
        DEFAULT_EMAIL_ADDRESS_LENGTH,
        DEFAULT_USER_ID_LENGTH,
        DEFAULT_DISPLAY_NAME_LENGTH,
        DEFAULT_GROUP_URI_LENGTH,
        DEFAULT_PERMISSION_LENGTH,
        DEFAULT_USER_ID_LENGTH,
        DEFAULT_DISPLAY_NAME_LENGTH,
        DEFAULT_DOCUMENT_LENGTH);
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive (was " + value + ")");
    }
  }
}
