package ca.gc.cra.s3.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreReturnedUnchanged() {
    assertEquals("<Owner/>", Logs.truncate("<Owner/>", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void longValuesCarryLengthMetadata() {
    assertEquals("abcd... (truncated, 4 of 10 bytes)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncateRequiresPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void maskKeepsLastFourCharacters() {
    assertEquals("****1a2b", Logs.mask("abcd1a2b"));
    assertEquals("***", Logs.mask("abc"));
    assertEquals("<null>", Logs.mask(null));
  }
}
