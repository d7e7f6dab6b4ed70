package ca.gc.cra.s3.domain.bucket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UriStyleTest {

  @Test
  void parseAcceptsCommonSpellings() {
    assertEquals(UriStyle.PATH, UriStyle.parse("Path"));
    assertEquals(UriStyle.VIRTUAL_HOST, UriStyle.parse("virtualhost"));
    assertEquals(UriStyle.VIRTUAL_HOST, UriStyle.parse("virtual-host"));
    assertEquals(UriStyle.VIRTUAL_HOST, UriStyle.parse("VHOST"));
  }

  @Test
  void parseRejectsUnknownStyle() {
    assertThrows(IllegalArgumentException.class, () -> UriStyle.parse("dns"));
  }
}
