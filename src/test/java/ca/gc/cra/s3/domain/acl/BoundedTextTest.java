package ca.gc.cra.s3.domain.acl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BoundedTextTest {

  @Test
  void appendAccumulatesChunksUpToCapacity() {
    BoundedText text = new BoundedText(6);

    assertTrue(text.append("abc"));
    assertTrue(text.append("def"));

    assertEquals("abcdef", text.toString());
    assertEquals(6, text.length());
  }

  @Test
  void overflowingChunkIsRejectedWholeAndContentKept() {
    BoundedText text = new BoundedText(4);
    text.append("abc");

    assertFalse(text.append("de"));
    assertEquals("abc", text.toString());
  }

  @Test
  void clearKeepsCapacity() {
    BoundedText text = new BoundedText(3);
    text.append("xyz");

    text.clear();

    assertTrue(text.isEmpty());
    assertEquals(3, text.capacity());
    assertTrue(text.append("123"));
  }

  @Test
  void charAccessIsBoundedByLengthNotCapacity() {
    BoundedText text = new BoundedText(10);
    text.append("READ");

    assertEquals('E', text.charAt(1));
    assertEquals("EA", text.subSequence(1, 3).toString());
    assertThrows(IndexOutOfBoundsException.class, () -> text.charAt(4));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedText(0));
  }
}
