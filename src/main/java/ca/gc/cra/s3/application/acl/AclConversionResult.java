package ca.gc.cra.s3.application.acl;

import ca.gc.cra.s3.domain.acl.Owner;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import java.util.Objects;

/**
 * Outcome of one ACL conversion. Grants live in the caller's array; {@code grantCount} tells how many of its
 * leading entries were written, including on failure.
 *
 * @param status {@link S3Status#OK} or the first failure
 * @param owner owner fields accumulated before the conversion ended
 * @param grantCount number of committed grants
 * @since 0.1.0
 */
public record AclConversionResult(S3Status status, Owner owner, int grantCount) {
  public AclConversionResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(owner, "owner");
    if (grantCount < 0) {
      throw new IllegalArgumentException("grantCount must be >= 0");
    }
  }

  /**
   * Indicates whether every grant in the document was decoded.
   *
   * @return {@code true} when {@link #status()} is {@link S3Status#OK}
   */
  public boolean isOk() {
    return status.isOk();
  }

  /**
   * Returns this result when the conversion succeeded.
   *
   * @return this result
   * @throws S3Exception carrying {@link #status()} when the conversion failed
   */
  public AclConversionResult orThrow() throws S3Exception {
    if (!status.isOk()) {
      throw new S3Exception(status, "ACL conversion failed after " + grantCount + " grants");
    }
    return this;
  }
}
