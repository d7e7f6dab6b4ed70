package ca.gc.cra.s3.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class BucketCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(BucketCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void validNamePrintsOk() {
    ExitCode code = BucketCli.run(new String[] {"name=my-bucket"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("OK", buffer.toString().trim());
  }

  @Test
  void rejectedNamePrintsViolation() {
    ExitCode code = BucketCli.run(new String[] {"name=abc_def"});

    assertEquals(ExitCode.REJECTED, code);
    assertEquals("InvalidBucketNameCharacter", buffer.toString().trim());
  }

  @Test
  void pathStyleAllowsUnderscore() {
    ExitCode code = BucketCli.run(new String[] {"name=abc_def", "style=path"});

    assertEquals(ExitCode.SUCCESS, code);
  }

  @Test
  void styleFromYamlApplies() throws Exception {
    Path config = Files.writeString(tempDir.resolve("s3.yaml"), """
        bucket:
          style: path
        """);

    ExitCode code = BucketCli.run(new String[] {"name=" + "a".repeat(100), "config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
  }

  @Test
  void missingNameReturnsInvalidArgs() {
    ExitCode code = BucketCli.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: bucket"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("Missing required argument: name")));
  }

  @Test
  void unknownStyleReturnsInvalidArgs() {
    ExitCode code = BucketCli.run(new String[] {"name=abc", "style=dns"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: bucket"));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = BucketCli.run(new String[] {"name=abc", "config=" + tempDir.resolve("none.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void unknownFlagReturnsInvalidArgs() {
    ExitCode code = BucketCli.run(new String[] {"name=abc", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
