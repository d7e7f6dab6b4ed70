package ca.gc.cra.s3.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dispatchesToBucketCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"bucket", "name=logs"}));
    assertEquals("OK", buffer.toString().trim());
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: s3-foundation"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: s3-foundation"));
  }

  @Test
  void globalHelpWins() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help", "bucket"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }
}
