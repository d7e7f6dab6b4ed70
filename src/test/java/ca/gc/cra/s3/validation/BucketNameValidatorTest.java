package ca.gc.cra.s3.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.s3.domain.bucket.UriStyle;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import org.junit.jupiter.api.Test;

class BucketNameValidatorTest {

  @Test
  void acceptsSimpleNamesInBothStyles() {
    assertEquals(S3Status.OK, BucketNameValidator.validate("abc", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.OK, BucketNameValidator.validate("my-bucket.logs", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.OK, BucketNameValidator.validate("Mixed-Case_1", UriStyle.PATH));
  }

  @Test
  void shortNamesAreRejected() {
    assertEquals(S3Status.INVALID_BUCKET_NAME_TOO_SHORT, BucketNameValidator.validate("ab", UriStyle.PATH));
    assertEquals(S3Status.INVALID_BUCKET_NAME_TOO_SHORT, BucketNameValidator.validate("", UriStyle.PATH));
  }

  @Test
  void maximumLengthDependsOnStyle() {
    String sixtyThree = "a".repeat(63);
    String sixtyFour = "a".repeat(64);

    assertEquals(S3Status.OK, BucketNameValidator.validate(sixtyThree, UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.INVALID_BUCKET_NAME_TOO_LONG,
        BucketNameValidator.validate(sixtyFour, UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.OK, BucketNameValidator.validate(sixtyFour, UriStyle.PATH));
    assertEquals(S3Status.OK, BucketNameValidator.validate("b".repeat(255), UriStyle.PATH));
    assertEquals(S3Status.INVALID_BUCKET_NAME_TOO_LONG,
        BucketNameValidator.validate("b".repeat(256), UriStyle.PATH));
  }

  @Test
  void firstCharacterMustBeAlphanumeric() {
    assertEquals(S3Status.INVALID_BUCKET_NAME_FIRST_CHARACTER,
        BucketNameValidator.validate("-abc", UriStyle.PATH));
    assertEquals(S3Status.INVALID_BUCKET_NAME_FIRST_CHARACTER,
        BucketNameValidator.validate(".abc", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.INVALID_BUCKET_NAME_FIRST_CHARACTER,
        BucketNameValidator.validate("_ab", UriStyle.PATH));
  }

  @Test
  void underscoreIsPathStyleOnly() {
    assertEquals(S3Status.OK, BucketNameValidator.validate("ab_cd", UriStyle.PATH));
    assertEquals(S3Status.INVALID_BUCKET_NAME_CHARACTER,
        BucketNameValidator.validate("abc_def", UriStyle.VIRTUAL_HOST));
  }

  @Test
  void otherCharactersAreRejected() {
    assertEquals(S3Status.INVALID_BUCKET_NAME_CHARACTER, BucketNameValidator.validate("ab cd", UriStyle.PATH));
    assertEquals(S3Status.INVALID_BUCKET_NAME_CHARACTER, BucketNameValidator.validate("abé", UriStyle.PATH));
  }

  @Test
  void dashDotSequencesAreRejectedForVirtualHostOnly() {
    assertEquals(S3Status.INVALID_BUCKET_NAME_CHARACTER_SEQUENCE,
        BucketNameValidator.validate("ab-.cd", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.INVALID_BUCKET_NAME_CHARACTER_SEQUENCE,
        BucketNameValidator.validate("ab.-cd", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.OK, BucketNameValidator.validate("ab-.cd", UriStyle.PATH));
  }

  @Test
  void consecutiveDotsAreAccepted() {
    assertEquals(S3Status.OK, BucketNameValidator.validate("ab..cd", UriStyle.VIRTUAL_HOST));
  }

  @Test
  void dottedNamesWithoutLettersLookLikeAddresses() {
    assertEquals(S3Status.INVALID_BUCKET_NAME_DOT_QUAD_NOTATION,
        BucketNameValidator.validate("192.168.1.1", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.OK, BucketNameValidator.validate("192.168.1.1a", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.OK, BucketNameValidator.validate("12345", UriStyle.VIRTUAL_HOST));
  }

  @Test
  void firstViolationWins() {
    assertEquals(S3Status.INVALID_BUCKET_NAME_CHARACTER,
        BucketNameValidator.validate("a_" + "b".repeat(100), UriStyle.VIRTUAL_HOST));
  }

  @Test
  void requireValidThrowsWithStatus() throws S3Exception {
    assertEquals("bucket", BucketNameValidator.requireValid("bucket", UriStyle.VIRTUAL_HOST));

    S3Exception ex = assertThrows(S3Exception.class,
        () -> BucketNameValidator.requireValid("ab", UriStyle.VIRTUAL_HOST));
    assertEquals(S3Status.INVALID_BUCKET_NAME_TOO_SHORT, ex.status());
  }
}
