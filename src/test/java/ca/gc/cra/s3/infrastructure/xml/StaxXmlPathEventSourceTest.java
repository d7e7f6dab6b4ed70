package ca.gc.cra.s3.infrastructure.xml;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.s3.domain.status.S3Status;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StaxXmlPathEventSourceTest {
  private final StaxXmlPathEventSource source = new StaxXmlPathEventSource();

  @Test
  void emitsTextAndCloseEventsWithLocalNamePaths() {
    List<String> events = new ArrayList<>();

    S3Status status = source.parse(
        "<p:Root xmlns:p=\"urn:x\"><p:Child>text</p:Child><Empty/></p:Root>",
        (path, data) -> {
          events.add(data == null ? "close " + path : path + "=" + data);
          return S3Status.OK;
        });

    assertEquals(S3Status.OK, status);
    assertEquals(List.of("Root/Child=text", "close Root/Child", "close Root/Empty", "close Root"), events);
  }

  @Test
  void handlerFailureStopsTheWalk() {
    List<String> events = new ArrayList<>();

    S3Status status = source.parse("<A><B>1</B><C>2</C></A>", (path, data) -> {
      events.add(path);
      return data != null ? S3Status.BAD_ACL_GRANTEE : S3Status.OK;
    });

    assertEquals(S3Status.BAD_ACL_GRANTEE, status);
    assertEquals(List.of("A/B"), events);
  }

  @Test
  void entitiesAreDecoded() {
    StringBuilder text = new StringBuilder();

    source.parse("<A>x&amp;y</A>", (path, data) -> {
      if (data != null) {
        text.append(data);
      }
      return S3Status.OK;
    });

    assertEquals("x&y", text.toString());
  }

  @Test
  void malformedDocumentIsParseFailure() {
    assertEquals(S3Status.XML_PARSE_FAILURE, source.parse("<A><B></A>", (path, data) -> S3Status.OK));
    assertEquals(S3Status.XML_PARSE_FAILURE, source.parse("", (path, data) -> S3Status.OK));
  }
}
