package ca.gc.cra.s3.application.acl;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.s3.domain.acl.Owner;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import org.junit.jupiter.api.Test;

class AclConversionResultTest {

  @Test
  void orThrowReturnsSuccessfulResult() throws S3Exception {
    AclConversionResult result = new AclConversionResult(S3Status.OK, Owner.EMPTY, 0);

    assertSame(result, result.orThrow());
  }

  @Test
  void rejectsNegativeGrantCount() {
    assertThrows(IllegalArgumentException.class,
        () -> new AclConversionResult(S3Status.OK, Owner.EMPTY, -1));
  }
}
