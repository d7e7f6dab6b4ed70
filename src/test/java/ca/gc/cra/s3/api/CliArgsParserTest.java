package ca.gc.cra.s3.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"name=logs", " style = path ", "limits.ownerId=64"});

    assertEquals(Map.of("name", "logs", "style", "path", "limits.ownerId", "64"), map);
  }

  @Test
  void valueMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=test,team=s3"});

    assertEquals("env=test,team=s3", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMissingValuesAndBadKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"name="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"name"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"na me=x"}));
  }

  @Test
  void repeatedOptionIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"name=first", "style=path", "name=second"}));

    assertEquals("option name given more than once", ex.getMessage());
  }

  @Test
  void blankAndNullArgumentsAreSkipped() {
    assertEquals(Map.of("name", "logs"), CliArgsParser.toMap(new String[] {null, "  ", "name=logs"}));
    assertEquals(Map.of(), CliArgsParser.toMap(null));
  }
}
