package ca.gc.cra.s3.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void readableFileIsNormalized() throws Exception {
    Path file = Files.writeString(tempDir.resolve("acl.xml"), "<AccessControlPolicy/>");

    Path resolved = Paths.requireReadableFile(tempDir.resolve("sub/../acl.xml"));

    assertEquals(file.toAbsolutePath().normalize(), resolved);
  }

  @Test
  void missingFileAndDirectoryAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir.resolve("none.xml")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir));
  }
}
