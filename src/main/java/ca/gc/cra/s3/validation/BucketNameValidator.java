package ca.gc.cra.s3.validation;

import ca.gc.cra.s3.domain.bucket.UriStyle;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import java.util.Objects;

/**
 * <strong>What:</strong> Checks a bucket name against the storage provider's naming grammar.
 * <p><strong>Why:</strong> Rejecting malformed names locally avoids a round trip that would fail on the
 * service and keeps virtual-host style names usable as DNS labels.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Length: at most {@link UriStyle#maxBucketNameLength()} and at least three characters.</li>
 *   <li>Characters: ASCII letters and digits anywhere; the first character must be one of them.</li>
 *   <li>{@code _} is allowed only with {@link UriStyle#PATH}.</li>
 *   <li>{@code -} and {@code .} are allowed, except that {@link UriStyle#VIRTUAL_HOST} forbids the sequences
 *   {@code .-} and {@code -.}.</li>
 *   <li>A name containing a dot and no letter at all looks like an IPv4 address and is rejected.</li>
 * </ul>
 * Characters are checked in order and the first violation wins. Consecutive dots are accepted.
 * <p><strong>Thread-safety:</strong> stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class BucketNameValidator {
  private static final int MIN_LENGTH = 3;

  private BucketNameValidator() {
    // Utility
  }

  /**
   * Validates {@code bucketName}.
   *
   * @param bucketName candidate name; must not be {@code null}
   * @param style URI style the name will be used with
   * @return {@link S3Status#OK} or the first grammar violation
   */
  public static S3Status validate(String bucketName, UriStyle style) {
    Objects.requireNonNull(bucketName, "bucketName");
    Objects.requireNonNull(style, "style");
    boolean virtualHost = style == UriStyle.VIRTUAL_HOST;
    int maxLength = style.maxBucketNameLength();

    boolean sawLetter = false;
    boolean sawDot = false;
    char previous = 0;
    int length = bucketName.length();
    for (int i = 0; i < length; i++) {
      if (i >= maxLength) {
        return S3Status.INVALID_BUCKET_NAME_TOO_LONG;
      }
      char c = bucketName.charAt(i);
      if (isAsciiLetter(c)) {
        sawLetter = true;
      } else if (!isAsciiDigit(c)) {
        S3Status violation = checkPunctuation(c, i, previous, virtualHost);
        if (!violation.isOk()) {
          return violation;
        }
        sawDot |= c == '.';
      }
      previous = c;
    }

    if (length < MIN_LENGTH) {
      return S3Status.INVALID_BUCKET_NAME_TOO_SHORT;
    }
    if (sawDot && !sawLetter) {
      return S3Status.INVALID_BUCKET_NAME_DOT_QUAD_NOTATION;
    }
    return S3Status.OK;
  }

  /**
   * Validates {@code bucketName} and returns it unchanged.
   *
   * @param bucketName candidate name
   * @param style URI style the name will be used with
   * @return {@code bucketName}
   * @throws S3Exception carrying the first grammar violation
   */
  public static String requireValid(String bucketName, UriStyle style) throws S3Exception {
    S3Status status = validate(bucketName, style);
    if (!status.isOk()) {
      throw new S3Exception(status, "invalid bucket name for " + style + " style: " + bucketName);
    }
    return bucketName;
  }

  private static S3Status checkPunctuation(char c, int index, char previous, boolean virtualHost) {
    if (index == 0) {
      return S3Status.INVALID_BUCKET_NAME_FIRST_CHARACTER;
    }
    return switch (c) {
      case '_' -> virtualHost ? S3Status.INVALID_BUCKET_NAME_CHARACTER : S3Status.OK;
      case '-' -> virtualHost && previous == '.' ? S3Status.INVALID_BUCKET_NAME_CHARACTER_SEQUENCE : S3Status.OK;
      case '.' -> virtualHost && previous == '-' ? S3Status.INVALID_BUCKET_NAME_CHARACTER_SEQUENCE : S3Status.OK;
      default -> S3Status.INVALID_BUCKET_NAME_CHARACTER;
    };
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
