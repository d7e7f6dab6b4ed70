package ca.gc.cra.s3.domain.acl;

import ca.gc.cra.s3.domain.status.S3Status;
import java.util.Objects;
import java.util.Optional;

/**
 * Streaming decoder that turns path events of an {@code AccessControlPolicy} document into owner fields and
 * grants written to a caller-owned array.
 *
 * <p><strong>Input:</strong> {@link #onPath(String, CharSequence)} receives the slash-separated element path
 * and either a text chunk (text for one element may arrive in several chunks) or {@code null} when that
 * element has just closed.</p>
 * <p><strong>Memory:</strong> every accumulator is a {@link BoundedText} sized from {@link AclLimits}; the
 * grant array is never resized. A field overflow fails the decode with the field's own status.</p>
 * <p><strong>Grant resolution:</strong> on close of a {@code Grant} element the grantee is resolved in
 * priority order e-mail address, canonical user (id and display name), then group URI. The permission token
 * must be one of the five {@link Permission} literals. The five per-grant accumulators are cleared after each
 * committed grant; owner accumulators are cumulative for the whole document.</p>
 * <p><strong>Failure:</strong> the first failure is terminal. Later events return the same status and change
 * nothing, so {@link #grantCount()} reports only grants committed before the failure.</p>
 * <p><strong>Thread-safety:</strong> not thread-safe; create one decoder per document.</p>
 *
 * @since 0.1.0
 */
public final class AclGrantDecoder {
  static final String OWNER_ID = "AccessControlPolicy/Owner/ID";
  static final String OWNER_DISPLAY_NAME = "AccessControlPolicy/Owner/DisplayName";
  static final String GRANT = "AccessControlPolicy/AccessControlList/Grant";
  static final String GRANTEE_EMAIL_ADDRESS = GRANT + "/Grantee/EmailAddress";
  static final String GRANTEE_ID = GRANT + "/Grantee/ID";
  static final String GRANTEE_DISPLAY_NAME = GRANT + "/Grantee/DisplayName";
  static final String GRANTEE_URI = GRANT + "/Grantee/URI";
  static final String PERMISSION = GRANT + "/Permission";

  private final AclGrant[] grants;
  private int grantCount;

  private final BoundedText ownerId;
  private final BoundedText ownerDisplayName;

  private final BoundedText emailAddress;
  private final BoundedText userId;
  private final BoundedText userDisplayName;
  private final BoundedText groupUri;
  private final BoundedText permission;

  private S3Status failure = S3Status.OK;

  /**
   * Creates a decoder writing into {@code grants}; the array length is the grant capacity.
   *
   * @param grants caller-owned output array; entries {@code [0, grantCount())} are overwritten
   * @param limits capacity of each bounded field
   */
  public AclGrantDecoder(AclGrant[] grants, AclLimits limits) {
    this.grants = Objects.requireNonNull(grants, "grants");
    Objects.requireNonNull(limits, "limits");
    this.ownerId = new BoundedText(limits.maxOwnerIdLength());
    this.ownerDisplayName = new BoundedText(limits.maxOwnerDisplayNameLength());
    this.emailAddress = new BoundedText(limits.maxEmailAddressLength());
    this.userId = new BoundedText(limits.maxUserIdLength());
    this.userDisplayName = new BoundedText(limits.maxUserDisplayNameLength());
    this.groupUri = new BoundedText(limits.maxGroupUriLength());
    this.permission = new BoundedText(limits.maxPermissionLength());
  }

  /**
   * Consumes one path event.
   *
   * @param elementPath slash-separated path of local element names from the document root
   * @param data text chunk, or {@code null} when the element at {@code elementPath} closed
   * @return {@link S3Status#OK} to continue, otherwise the terminal failure
   */
  public S3Status onPath(String elementPath, CharSequence data) {
    Objects.requireNonNull(elementPath, "elementPath");
    if (!failure.isOk()) {
      return failure;
    }
    S3Status status = data != null ? accumulate(elementPath, data) : close(elementPath);
    if (!status.isOk()) {
      failure = status;
    }
    return status;
  }

  /**
   * Returns the number of grants committed so far.
   *
   * @return committed grant count; never exceeds the array length
   */
  public int grantCount() {
    return grantCount;
  }

  /**
   * Returns the owner fields accumulated so far.
   *
   * @return owner; fields are empty when the document carries none
   */
  public Owner owner() {
    return new Owner(ownerId.toString(), ownerDisplayName.toString());
  }

  /**
   * Returns the terminal failure, or {@link S3Status#OK} while decoding has not failed.
   *
   * @return first failure status
   */
  public S3Status failure() {
    return failure;
  }

  private S3Status accumulate(String elementPath, CharSequence data) {
    return switch (elementPath) {
      case OWNER_ID -> append(ownerId, data, S3Status.BAD_ACL_OWNER_ID_TOO_LONG);
      case OWNER_DISPLAY_NAME ->
          append(ownerDisplayName, data, S3Status.BAD_ACL_OWNER_DISPLAY_NAME_TOO_LONG);
      case GRANTEE_EMAIL_ADDRESS -> append(emailAddress, data, S3Status.BAD_ACL_EMAIL_ADDRESS_TOO_LONG);
      case GRANTEE_ID -> append(userId, data, S3Status.BAD_ACL_USER_ID_TOO_LONG);
      case GRANTEE_DISPLAY_NAME ->
          append(userDisplayName, data, S3Status.BAD_ACL_USER_DISPLAY_NAME_TOO_LONG);
      case GRANTEE_URI -> append(groupUri, data, S3Status.BAD_ACL_GROUP_URI_TOO_LONG);
      case PERMISSION -> append(permission, data, S3Status.BAD_ACL_PERMISSION_TOO_LONG);
      default -> S3Status.OK;
    };
  }

  private static S3Status append(BoundedText field, CharSequence data, S3Status overflow) {
    return field.append(data) ? S3Status.OK : overflow;
  }

  private S3Status close(String elementPath) {
    if (!GRANT.equals(elementPath)) {
      return S3Status.OK;
    }
    if (grantCount == grants.length) {
      return S3Status.TOO_MANY_ACL_GRANTS;
    }
    Optional<Grantee> grantee = resolveGrantee();
    if (grantee.isEmpty()) {
      return S3Status.BAD_ACL_GRANTEE;
    }
    Optional<Permission> resolved = Permission.fromWireName(permission);
    if (resolved.isEmpty()) {
      return S3Status.BAD_ACL_PERMISSION;
    }
    grants[grantCount++] = new AclGrant(grantee.get(), resolved.get());
    resetGrantFields();
    return S3Status.OK;
  }

  private Optional<Grantee> resolveGrantee() {
    if (!emailAddress.isEmpty()) {
      return Optional.of(new Grantee.EmailAddress(emailAddress.toString()));
    }
    if (!userId.isEmpty() && !userDisplayName.isEmpty()) {
      return Optional.of(new Grantee.CanonicalUser(userId.toString(), userDisplayName.toString()));
    }
    if (!groupUri.isEmpty()) {
      return Grantee.group(groupUri);
    }
    return Optional.empty();
  }

  private void resetGrantFields() {
    emailAddress.clear();
    userId.clear();
    userDisplayName.clear();
    groupUri.clear();
    permission.clear();
  }
}
