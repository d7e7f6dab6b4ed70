package ca.gc.cra.s3.domain.acl;

import java.util.Objects;

/**
 * Fixed-capacity text accumulator. The backing array is sized once and never grows.
 *
 * <p>{@link #append(CharSequence)} either stores the whole chunk or nothing: a chunk that would take the
 * cumulative length past capacity is rejected and the buffer keeps its previous content.</p>
 *
 * <p>Not thread-safe; one instance belongs to one decode.</p>
 *
 * @since 0.1.0
 */
public final class BoundedText implements CharSequence {
  private final char[] chars;
  private int length;

  /**
   * Creates an empty accumulator.
   *
   * @param capacity maximum number of characters; must be positive
   */
  public BoundedText(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.chars = new char[capacity];
  }

  /**
   * Appends a chunk when it fits.
   *
   * @param chunk text to append; must not be {@code null}
   * @return {@code true} when the chunk was stored, {@code false} on overflow
   */
  public boolean append(CharSequence chunk) {
    Objects.requireNonNull(chunk, "chunk");
    int n = chunk.length();
    if (n > chars.length - length) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      chars[length + i] = chunk.charAt(i);
    }
    length += n;
    return true;
  }

  /** Discards the accumulated text. Capacity is unchanged. */
  public void clear() {
    length = 0;
  }

  /**
   * Returns the fixed capacity.
   *
   * @return maximum number of characters
   */
  public int capacity() {
    return chars.length;
  }

  @Override
  public int length() {
    return length;
  }

  @Override
  public boolean isEmpty() {
    return length == 0;
  }

  @Override
  public char charAt(int index) {
    Objects.checkIndex(index, length);
    return chars[index];
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    Objects.checkFromToIndex(start, end, length);
    return new String(chars, start, end - start);
  }

  @Override
  public String toString() {
    return new String(chars, 0, length);
  }
}
