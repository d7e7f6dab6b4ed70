package ca.gc.cra.s3.domain.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class S3StatusTest {

  @Test
  void onlyTransientFailuresAreRetryable() {
    Set<S3Status> retryable = EnumSet.noneOf(S3Status.class);
    for (S3Status status : S3Status.values()) {
      if (status.isRetryable()) {
        retryable.add(status);
      }
    }

    assertEquals(EnumSet.of(
        S3Status.NAME_LOOKUP_ERROR,
        S3Status.FAILED_TO_CONNECT,
        S3Status.CONNECTION_FAILED,
        S3Status.ERROR_INTERNAL_ERROR,
        S3Status.ERROR_OPERATION_ABORTED,
        S3Status.ERROR_REQUEST_TIMEOUT), retryable);
  }

  @Test
  void displayNamesAreCamelCase() {
    assertEquals("InvalidBucketNameTooLong", S3Status.INVALID_BUCKET_NAME_TOO_LONG.displayName());
    assertEquals("BadMD5", S3Status.BAD_MD5.displayName());
    assertEquals("OK", S3Status.OK.displayName());
  }

  @Test
  void fromNameAcceptsDisplayAndConstantNames() {
    assertEquals(Optional.of(S3Status.BAD_ACL_GRANTEE), S3Status.fromName("BadAclGrantee"));
    assertEquals(Optional.of(S3Status.BAD_ACL_GRANTEE), S3Status.fromName("bad_acl_grantee"));
    assertEquals(Optional.of(S3Status.INTERNAL_ERROR), S3Status.fromName("InternalError"));
    assertEquals(Optional.of(S3Status.ERROR_INTERNAL_ERROR), S3Status.fromName("ErrorInternalError"));
    assertTrue(S3Status.fromName("NoSuchStatus").isEmpty());
  }

  @Test
  void onlyOkIsOk() {
    assertTrue(S3Status.OK.isOk());
    assertFalse(S3Status.INTERNAL_ERROR.isOk());
    assertSame(S3Status.Category.SUCCESS, S3Status.OK.category());
  }

  @Test
  void exceptionCarriesFailureStatus() {
    S3Exception ex = new S3Exception(S3Status.FAILED_TO_CREATE_MUTEX, "boom");

    assertSame(S3Status.FAILED_TO_CREATE_MUTEX, ex.status());
    assertThrows(IllegalArgumentException.class, () -> new S3Exception(S3Status.OK));
  }
}
