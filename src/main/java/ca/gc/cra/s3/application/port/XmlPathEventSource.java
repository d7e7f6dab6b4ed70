package ca.gc.cra.s3.application.port;

import ca.gc.cra.s3.domain.status.S3Status;

/**
 * <strong>What:</strong> Streaming XML reader that reports leaf text and element closes by element path.
 * <p><strong>Contract:</strong> for every text node the handler receives the slash-separated path of local
 * element names from the root (e.g., {@code AccessControlPolicy/Owner/ID}) and a text chunk; one element's text
 * may arrive in several chunks. When an element closes the handler receives its path with {@code null} data.
 * A non-OK handler status stops the parse and is returned unchanged.</p>
 * <p><strong>Thread-safety:</strong> implementations keep per-call state only; concurrent parses of
 * independent documents are safe.</p>
 *
 * @since 0.1.0
 */
public interface XmlPathEventSource {
  /**
   * Parses {@code document} and forwards path events to {@code handler}.
   *
   * @param document complete XML document text
   * @param handler receiver of path events
   * @return {@link S3Status#OK} when the whole document was consumed, the handler's first failure, or
   *     {@link S3Status#XML_PARSE_FAILURE} when the document is malformed
   */
  S3Status parse(String document, Handler handler);

  /** Receiver of path events. */
  @FunctionalInterface
  interface Handler {
    /**
     * Consumes one path event.
     *
     * @param elementPath slash-separated element path
     * @param data text chunk, or {@code null} when the element closed
     * @return {@link S3Status#OK} to continue, anything else to stop
     */
    S3Status onPath(String elementPath, CharSequence data);
  }
}
