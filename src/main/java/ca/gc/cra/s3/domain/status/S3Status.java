package ca.gc.cra.s3.domain.status;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Status taxonomy shared by every S3 foundation component.
 * <p><strong>Why:</strong> The lock bridge, ACL decoder, and bucket validator report failures through one
 * vocabulary so callers can branch on a single enum regardless of which component failed.</p>
 * <p><strong>Role:</strong> Domain value type; returned by validators/decoders and carried by {@link S3Exception}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate library, request, XML, ACL, network, service, and HTTP outcomes.</li>
 *   <li>Expose the stable display name used in logs and CLI output.</li>
 *   <li>Classify statuses by {@link Category} and by whether a retry may succeed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 * <p><strong>Performance:</strong> Name lookups use a map built once at class initialization.</p>
 * <p><strong>Observability:</strong> {@link #displayName()} is the value logged and printed by the CLI.</p>
 *
 * @since 0.1.0
 */
public enum S3Status {
  OK("OK", Category.SUCCESS, false),
  INTERNAL_ERROR("InternalError", Category.INTERNAL, false),
  OUT_OF_MEMORY("OutOfMemory", Category.RESOURCE_EXHAUSTED, false),
  INTERRUPTED("Interrupted", Category.INTERRUPTED, false),
  FAILED_TO_CREATE_MUTEX("FailedToCreateMutex", Category.RESOURCE_EXHAUSTED, false),
  INVALID_BUCKET_NAME_TOO_LONG("InvalidBucketNameTooLong", Category.GRAMMAR_VIOLATION, false),
  INVALID_BUCKET_NAME_FIRST_CHARACTER("InvalidBucketNameFirstCharacter", Category.GRAMMAR_VIOLATION, false),
  INVALID_BUCKET_NAME_CHARACTER("InvalidBucketNameCharacter", Category.GRAMMAR_VIOLATION, false),
  INVALID_BUCKET_NAME_CHARACTER_SEQUENCE("InvalidBucketNameCharacterSequence", Category.GRAMMAR_VIOLATION, false),
  INVALID_BUCKET_NAME_TOO_SHORT("InvalidBucketNameTooShort", Category.GRAMMAR_VIOLATION, false),
  INVALID_BUCKET_NAME_DOT_QUAD_NOTATION("InvalidBucketNameDotQuadNotation", Category.GRAMMAR_VIOLATION, false),
  QUERY_PARAMS_TOO_LONG("QueryParamsTooLong", Category.INVALID_REQUEST, false),
  FAILED_TO_INITIALIZE_REQUEST("FailedToInitializeRequest", Category.INVALID_REQUEST, false),
  META_DATA_HEADERS_TOO_LONG("MetaDataHeadersTooLong", Category.INVALID_REQUEST, false),
  BAD_META_DATA("BadMetaData", Category.INVALID_REQUEST, false),
  BAD_CONTENT_TYPE("BadContentType", Category.INVALID_REQUEST, false),
  CONTENT_TYPE_TOO_LONG("ContentTypeTooLong", Category.INVALID_REQUEST, false),
  BAD_MD5("BadMD5", Category.INVALID_REQUEST, false),
  MD5_TOO_LONG("MD5TooLong", Category.INVALID_REQUEST, false),
  BAD_CACHE_CONTROL("BadCacheControl", Category.INVALID_REQUEST, false),
  CACHE_CONTROL_TOO_LONG("CacheControlTooLong", Category.INVALID_REQUEST, false),
  BAD_CONTENT_DISPOSITION_FILENAME("BadContentDispositionFilename", Category.INVALID_REQUEST, false),
  CONTENT_DISPOSITION_FILENAME_TOO_LONG("ContentDispositionFilenameTooLong", Category.INVALID_REQUEST, false),
  BAD_CONTENT_ENCODING("BadContentEncoding", Category.INVALID_REQUEST, false),
  CONTENT_ENCODING_TOO_LONG("ContentEncodingTooLong", Category.INVALID_REQUEST, false),
  BAD_IF_MATCH_ETAG("BadIfMatchETag", Category.INVALID_REQUEST, false),
  IF_MATCH_ETAG_TOO_LONG("IfMatchETagTooLong", Category.INVALID_REQUEST, false),
  BAD_IF_NOT_MATCH_ETAG("BadIfNotMatchETag", Category.INVALID_REQUEST, false),
  IF_NOT_MATCH_ETAG_TOO_LONG("IfNotMatchETagTooLong", Category.INVALID_REQUEST, false),
  HEADERS_TOO_LONG("HeadersTooLong", Category.INVALID_REQUEST, false),
  KEY_TOO_LONG("KeyTooLong", Category.INVALID_REQUEST, false),
  URI_TOO_LONG("UriTooLong", Category.INVALID_REQUEST, false),
  XML_PARSE_FAILURE("XmlParseFailure", Category.XML_FAILURE, false),
  BAD_ACL_EMAIL_ADDRESS_TOO_LONG("BadAclEmailAddressTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  BAD_ACL_USER_ID_TOO_LONG("BadAclUserIdTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  BAD_ACL_USER_DISPLAY_NAME_TOO_LONG("BadAclUserDisplayNameTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  BAD_ACL_GROUP_URI_TOO_LONG("BadAclGroupUriTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  BAD_ACL_PERMISSION_TOO_LONG("BadAclPermissionTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  BAD_ACL_OWNER_ID_TOO_LONG("BadAclOwnerIdTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  BAD_ACL_OWNER_DISPLAY_NAME_TOO_LONG("BadAclOwnerDisplayNameTooLong", Category.FIELD_CAPACITY_EXCEEDED, false),
  TOO_MANY_ACL_GRANTS("TooManyAclGrants", Category.STRUCTURAL_LIMIT_EXCEEDED, false),
  BAD_ACL_GRANTEE("BadAclGrantee", Category.RESOLUTION_FAILURE, false),
  BAD_ACL_PERMISSION("BadAclPermission", Category.RESOLUTION_FAILURE, false),
  ACL_XML_DOCUMENT_TOO_LARGE("AclXmlDocumentTooLarge", Category.STRUCTURAL_LIMIT_EXCEEDED, false),
  NAME_LOOKUP_ERROR("NameLookupError", Category.NETWORK_FAILURE, true),
  FAILED_TO_CONNECT("FailedToConnect", Category.NETWORK_FAILURE, true),
  SERVER_FAILED_VERIFICATION("ServerFailedVerification", Category.NETWORK_FAILURE, false),
  CONNECTION_FAILED("ConnectionFailed", Category.NETWORK_FAILURE, true),
  ABORTED_BY_CALLBACK("AbortedByCallback", Category.INTERRUPTED, false),

  // Errors reported by the storage service in an Error document.
  ERROR_ACCESS_DENIED("ErrorAccessDenied", Category.SERVICE_ERROR, false),
  ERROR_ACCOUNT_PROBLEM("ErrorAccountProblem", Category.SERVICE_ERROR, false),
  ERROR_AMBIGUOUS_GRANT_BY_EMAIL_ADDRESS("ErrorAmbiguousGrantByEmailAddress", Category.SERVICE_ERROR, false),
  ERROR_BAD_DIGEST("ErrorBadDigest", Category.SERVICE_ERROR, false),
  ERROR_BUCKET_ALREADY_EXISTS("ErrorBucketAlreadyExists", Category.SERVICE_ERROR, false),
  ERROR_BUCKET_ALREADY_OWNED_BY_YOU("ErrorBucketAlreadyOwnedByYou", Category.SERVICE_ERROR, false),
  ERROR_BUCKET_NOT_EMPTY("ErrorBucketNotEmpty", Category.SERVICE_ERROR, false),
  ERROR_CREDENTIALS_NOT_SUPPORTED("ErrorCredentialsNotSupported", Category.SERVICE_ERROR, false),
  ERROR_CROSS_LOCATION_LOGGING_PROHIBITED("ErrorCrossLocationLoggingProhibited", Category.SERVICE_ERROR, false),
  ERROR_ENTITY_TOO_SMALL("ErrorEntityTooSmall", Category.SERVICE_ERROR, false),
  ERROR_ENTITY_TOO_LARGE("ErrorEntityTooLarge", Category.SERVICE_ERROR, false),
  ERROR_EXPIRED_TOKEN("ErrorExpiredToken", Category.SERVICE_ERROR, false),
  ERROR_INCOMPLETE_BODY("ErrorIncompleteBody", Category.SERVICE_ERROR, false),
  ERROR_INCORRECT_NUMBER_OF_FILES_IN_POST_REQUEST("ErrorIncorrectNumberOfFilesInPostRequest", Category.SERVICE_ERROR, false),
  ERROR_INLINE_DATA_TOO_LARGE("ErrorInlineDataTooLarge", Category.SERVICE_ERROR, false),
  ERROR_INTERNAL_ERROR("ErrorInternalError", Category.SERVICE_ERROR, true),
  ERROR_INVALID_ACCESS_KEY_ID("ErrorInvalidAccessKeyId", Category.SERVICE_ERROR, false),
  ERROR_INVALID_ADDRESSING_HEADER("ErrorInvalidAddressingHeader", Category.SERVICE_ERROR, false),
  ERROR_INVALID_ARGUMENT("ErrorInvalidArgument", Category.SERVICE_ERROR, false),
  ERROR_INVALID_BUCKET_NAME("ErrorInvalidBucketName", Category.SERVICE_ERROR, false),
  ERROR_INVALID_DIGEST("ErrorInvalidDigest", Category.SERVICE_ERROR, false),
  ERROR_INVALID_LOCATION_CONSTRAINT("ErrorInvalidLocationConstraint", Category.SERVICE_ERROR, false),
  ERROR_INVALID_PAYER("ErrorInvalidPayer", Category.SERVICE_ERROR, false),
  ERROR_INVALID_POLICY_DOCUMENT("ErrorInvalidPolicyDocument", Category.SERVICE_ERROR, false),
  ERROR_INVALID_RANGE("ErrorInvalidRange", Category.SERVICE_ERROR, false),
  ERROR_INVALID_SECURITY("ErrorInvalidSecurity", Category.SERVICE_ERROR, false),
  ERROR_INVALID_SOAP_REQUEST("ErrorInvalidSOAPRequest", Category.SERVICE_ERROR, false),
  ERROR_INVALID_STORAGE_CLASS("ErrorInvalidStorageClass", Category.SERVICE_ERROR, false),
  ERROR_INVALID_TARGET_BUCKET_FOR_LOGGING("ErrorInvalidTargetBucketForLogging", Category.SERVICE_ERROR, false),
  ERROR_INVALID_TOKEN("ErrorInvalidToken", Category.SERVICE_ERROR, false),
  ERROR_INVALID_URI("ErrorInvalidURI", Category.SERVICE_ERROR, false),
  ERROR_KEY_TOO_LONG("ErrorKeyTooLong", Category.SERVICE_ERROR, false),
  ERROR_MALFORMED_ACL_ERROR("ErrorMalformedACLError", Category.SERVICE_ERROR, false),
  ERROR_MALFORMED_XML("ErrorMalformedXML", Category.SERVICE_ERROR, false),
  ERROR_MAX_MESSAGE_LENGTH_EXCEEDED("ErrorMaxMessageLengthExceeded", Category.SERVICE_ERROR, false),
  ERROR_MAX_POST_PRE_DATA_LENGTH_EXCEEDED_ERROR("ErrorMaxPostPreDataLengthExceededError", Category.SERVICE_ERROR, false),
  ERROR_METADATA_TOO_LARGE("ErrorMetadataTooLarge", Category.SERVICE_ERROR, false),
  ERROR_METHOD_NOT_ALLOWED("ErrorMethodNotAllowed", Category.SERVICE_ERROR, false),
  ERROR_MISSING_ATTACHMENT("ErrorMissingAttachment", Category.SERVICE_ERROR, false),
  ERROR_MISSING_CONTENT_LENGTH("ErrorMissingContentLength", Category.SERVICE_ERROR, false),
  ERROR_MISSING_SECURITY_ELEMENT("ErrorMissingSecurityElement", Category.SERVICE_ERROR, false),
  ERROR_MISSING_SECURITY_HEADER("ErrorMissingSecurityHeader", Category.SERVICE_ERROR, false),
  ERROR_NO_LOGGING_STATUS_FOR_KEY("ErrorNoLoggingStatusForKey", Category.SERVICE_ERROR, false),
  ERROR_NO_SUCH_BUCKET("ErrorNoSuchBucket", Category.SERVICE_ERROR, false),
  ERROR_NO_SUCH_KEY("ErrorNoSuchKey", Category.SERVICE_ERROR, false),
  ERROR_NOT_IMPLEMENTED("ErrorNotImplemented", Category.SERVICE_ERROR, false),
  ERROR_NOT_SIGNED_UP("ErrorNotSignedUp", Category.SERVICE_ERROR, false),
  ERROR_OPERATION_ABORTED("ErrorOperationAborted", Category.SERVICE_ERROR, true),
  ERROR_PERMANENT_REDIRECT("ErrorPermanentRedirect", Category.SERVICE_ERROR, false),
  ERROR_PRECONDITION_FAILED("ErrorPreconditionFailed", Category.SERVICE_ERROR, false),
  ERROR_REDIRECT("ErrorRedirect", Category.SERVICE_ERROR, false),
  ERROR_REQUEST_IS_NOT_MULTI_PART_CONTENT("ErrorRequestIsNotMultiPartContent", Category.SERVICE_ERROR, false),
  ERROR_REQUEST_TIMEOUT("ErrorRequestTimeout", Category.SERVICE_ERROR, true),
  ERROR_REQUEST_TIME_TOO_SKEWED("ErrorRequestTimeTooSkewed", Category.SERVICE_ERROR, false),
  ERROR_REQUEST_TORRENT_OF_BUCKET_ERROR("ErrorRequestTorrentOfBucketError", Category.SERVICE_ERROR, false),
  ERROR_SIGNATURE_DOES_NOT_MATCH("ErrorSignatureDoesNotMatch", Category.SERVICE_ERROR, false),
  ERROR_SLOW_DOWN("ErrorSlowDown", Category.SERVICE_ERROR, false),
  ERROR_TEMPORARY_REDIRECT("ErrorTemporaryRedirect", Category.SERVICE_ERROR, false),
  ERROR_TOKEN_REFRESH_REQUIRED("ErrorTokenRefreshRequired", Category.SERVICE_ERROR, false),
  ERROR_TOO_MANY_BUCKETS("ErrorTooManyBuckets", Category.SERVICE_ERROR, false),
  ERROR_UNEXPECTED_CONTENT("ErrorUnexpectedContent", Category.SERVICE_ERROR, false),
  ERROR_UNRESOLVABLE_GRANT_BY_EMAIL_ADDRESS("ErrorUnresolvableGrantByEmailAddress", Category.SERVICE_ERROR, false),
  ERROR_USER_KEY_MUST_BE_SPECIFIED("ErrorUserKeyMustBeSpecified", Category.SERVICE_ERROR, false),
  ERROR_UNKNOWN("ErrorUnknown", Category.SERVICE_ERROR, false),

  // HTTP status codes returned without an Error document.
  HTTP_ERROR_MOVED_TEMPORARILY("HttpErrorMovedTemporarily", Category.HTTP_ERROR, false),
  HTTP_ERROR_BAD_REQUEST("HttpErrorBadRequest", Category.HTTP_ERROR, false),
  HTTP_ERROR_FORBIDDEN("HttpErrorForbidden", Category.HTTP_ERROR, false),
  HTTP_ERROR_NOT_FOUND("HttpErrorNotFound", Category.HTTP_ERROR, false),
  HTTP_ERROR_CONFLICT("HttpErrorConflict", Category.HTTP_ERROR, false),
  HTTP_ERROR_UNKNOWN("HttpErrorUnknown", Category.HTTP_ERROR, false);

  private static final Map<String, S3Status> BY_DISPLAY_NAME = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(
          status -> status.displayName.toLowerCase(Locale.ROOT), Function.identity()));

  private final String displayName;
  private final Category category;
  private final boolean retryable;

  S3Status(String displayName, Category category, boolean retryable) {
    this.displayName = displayName;
    this.category = category;
    this.retryable = retryable;
  }

  /**
   * Returns the CamelCase name of this status (e.g., {@code InvalidBucketNameTooLong}).
   *
   * @return display name; never {@code null}
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Returns the failure family this status belongs to.
   *
   * @return status category
   */
  public Category category() {
    return category;
  }

  /**
   * Indicates whether repeating the failed operation may succeed.
   *
   * <p>Only transient network failures and the service's internal error, aborted operation, and request
   * timeout codes are retryable. Retry scheduling itself is the caller's concern.</p>
   *
   * @return {@code true} when a retry may succeed
   */
  public boolean isRetryable() {
    return retryable;
  }

  /**
   * Indicates whether this status represents success.
   *
   * @return {@code true} only for {@link #OK}
   */
  public boolean isOk() {
    return this == OK;
  }

  /**
   * Resolves a status from its display name or enum constant name, ignoring case.
   *
   * @param name candidate name such as {@code BadAclGrantee} or {@code BAD_ACL_GRANTEE}
   * @return matching status, or empty when the name is unknown
   */
  public static Optional<S3Status> fromName(String name) {
    Objects.requireNonNull(name, "name");
    String normalized = name.trim();
    S3Status byDisplay = BY_DISPLAY_NAME.get(normalized.toLowerCase(Locale.ROOT));
    if (byDisplay != null) {
      return Optional.of(byDisplay);
    }
    try {
      return Optional.of(valueOf(normalized.toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  /** Failure families used to group statuses. */
  public enum Category {
    /** Operation completed. */
    SUCCESS,
    /** Unexpected library failure. */
    INTERNAL,
    /** Operation interrupted or aborted by a caller callback. */
    INTERRUPTED,
    /** Memory or mutex resources could not be obtained. */
    RESOURCE_EXHAUSTED,
    /** Bucket name violates the provider naming grammar. */
    GRAMMAR_VIOLATION,
    /** Request parameters or headers could not be composed. */
    INVALID_REQUEST,
    /** XML input was not well formed. */
    XML_FAILURE,
    /** A bounded ACL text field overflowed. */
    FIELD_CAPACITY_EXCEEDED,
    /** A structural limit such as grant count or document size was exceeded. */
    STRUCTURAL_LIMIT_EXCEEDED,
    /** Grantee or permission could not be resolved. */
    RESOLUTION_FAILURE,
    /** Connection-level failure. */
    NETWORK_FAILURE,
    /** Error document returned by the storage service. */
    SERVICE_ERROR,
    /** HTTP failure without an error document. */
    HTTP_ERROR
  }
}
