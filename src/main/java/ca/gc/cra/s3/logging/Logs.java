package ca.gc.cra.s3.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for XML documents and identifiers that reach operator logs.
 * <p><strong>Why:</strong> ACL documents can be up to the configured document limit and carry e-mail addresses;
 * logs keep a short preview and mask owner identifiers.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Truncation allocates transient buffers proportional to {@code maxBytes}.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int VISIBLE_SUFFIX = 4;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Masks all but the last four characters of an identifier such as a canonical user id.
   *
   * @param value identifier; {@code null} results in {@code "<null>"}
   * @return masked identifier, e.g. {@code "****1a2b"}; values of four characters or fewer are fully masked
   */
  public static String mask(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int length = value.length();
    if (length <= VISIBLE_SUFFIX) {
      return "*".repeat(length);
    }
    return "*".repeat(length - VISIBLE_SUFFIX) + value.substring(length - VISIBLE_SUFFIX);
  }
}
