package ca.gc.cra.s3.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void mergesCommonAndModeSectionsWithDottedKeys() throws Exception {
    Path config = tempDir.resolve("s3.yaml");
    Files.writeString(config, """
        common:
          metricsExporter: none
        acl:
          maxGrants: 50
          limits:
            emailAddress: 64
            document: 8192
        bucket:
          style: path
        """);

    Optional<Map<String, String>> loaded = YamlConfigLoader.load(config, "ACL");

    assertTrue(loaded.isPresent());
    Map<String, String> values = loaded.orElseThrow();
    assertEquals("none", values.get("metricsExporter"));
    assertEquals("50", values.get("maxGrants"));
    assertEquals("64", values.get("limits.emailAddress"));
    assertEquals("8192", values.get("limits.document"));
    assertFalse(values.containsKey("style"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "bucket").isEmpty());
  }

  @Test
  void emptyFileYieldsEmptyMap() throws Exception {
    Path config = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(config, "bucket"));
  }

  @Test
  void arraysAreRejected() throws Exception {
    Path config = Files.writeString(tempDir.resolve("list.yaml"), """
        bucket:
          name:
            - a
            - b
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "bucket"));
  }

  @Test
  void invalidYamlIsReportedAsIllegalArgument() throws Exception {
    Path config = Files.writeString(tempDir.resolve("bad.yaml"), "bucket: [unclosed");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "bucket"));
    assertTrue(ex.getMessage().startsWith("Failed to parse YAML config"));
  }

  @Test
  void misspeltSectionIsRejected() throws Exception {
    Path config = Files.writeString(tempDir.resolve("typo.yaml"), """
        common:
          metricsExporter: none
        buckets:
          style: path
        """);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "bucket"));
    assertTrue(ex.getMessage().contains("buckets"));
  }

  @Test
  void sectionNamesAreCaseInsensitiveButMustBeUnique() throws Exception {
    Path config = Files.writeString(tempDir.resolve("dup.yaml"), """
        Bucket:
          style: path
        bucket:
          style: virtualhost
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "bucket"));
  }

  @Test
  void commandSectionOverridesCommon() throws Exception {
    Path config = Files.writeString(tempDir.resolve("layered.yaml"), """
        common:
          style: virtualhost
        BUCKET:
          style: path
        """);

    assertEquals(Optional.of(Map.of("style", "path")), YamlConfigLoader.load(config, "bucket"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "object"));
  }
}
