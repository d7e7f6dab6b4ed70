package ca.gc.cra.s3.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.s3.domain.bucket.UriStyle;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BucketConfigTest {

  @Test
  void fromMapParsesStyle() {
    BucketConfig config = BucketConfig.fromMap(Map.of("name", "logs", "style", "path"));

    assertEquals("logs", config.name());
    assertEquals(UriStyle.PATH, config.style());
  }

  @Test
  void unknownStyleIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> BucketConfig.fromMap(Map.of("style", "dns")));
  }
}
