package ca.gc.cra.s3.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("abc", Strings.requireNonBlank("name", "  abc "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControl() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("service.name=s3", Strings.requirePrintableAscii("attrs", "service.name=s3", 64));

    IllegalArgumentException tooLong = assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertEquals("attrs length must be <= 3", tooLong.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x", 0));
  }
}
