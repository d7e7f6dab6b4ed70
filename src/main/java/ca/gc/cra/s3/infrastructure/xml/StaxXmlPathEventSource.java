package ca.gc.cra.s3.infrastructure.xml;

import ca.gc.cra.s3.application.port.XmlPathEventSource;
import ca.gc.cra.s3.domain.status.S3Status;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Objects;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link XmlPathEventSource} backed by the JDK StAX pull parser.
 * <p><strong>Paths:</strong> built from local names only, so namespace prefixes and default namespaces do not
 * change the paths a handler sees.</p>
 * <p><strong>Text:</strong> character and CDATA events are forwarded as they arrive; the factory does not
 * coalesce, so one element's text may reach the handler in several chunks. Whitespace between elements is
 * forwarded like any other text; handlers ignore paths they do not track.</p>
 * <p><strong>Security:</strong> DTDs and external entities are disabled.</p>
 * <p><strong>Thread-safety:</strong> the factory is configured once and only used to create readers; each parse
 * owns its reader and path stack.</p>
 *
 * @since 0.1.0
 */
public final class StaxXmlPathEventSource implements XmlPathEventSource {
  private static final Logger log = LoggerFactory.getLogger(StaxXmlPathEventSource.class);

  private final XMLInputFactory factory;

  /** Creates a source with a hardened, non-coalescing StAX factory. */
  public StaxXmlPathEventSource() {
    XMLInputFactory f = XMLInputFactory.newFactory();
    f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.FALSE);
    f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
    this.factory = f;
  }

  @Override
  public S3Status parse(String document, Handler handler) {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(handler, "handler");
    XMLStreamReader reader;
    try {
      reader = factory.createXMLStreamReader(new StringReader(document));
    } catch (XMLStreamException ex) {
      log.debug("Unable to open XML reader", ex);
      return S3Status.XML_PARSE_FAILURE;
    }
    try {
      return walk(reader, handler);
    } catch (XMLStreamException ex) {
      log.debug("Malformed XML at {}: {}", ex.getLocation(), ex.getMessage());
      return S3Status.XML_PARSE_FAILURE;
    } finally {
      close(reader);
    }
  }

  private static S3Status walk(XMLStreamReader reader, Handler handler) throws XMLStreamException {
    ElementPath path = new ElementPath();
    while (reader.hasNext()) {
      int event = reader.next();
      S3Status status = switch (event) {
        case XMLStreamConstants.START_ELEMENT -> {
          path.push(reader.getLocalName());
          yield S3Status.OK;
        }
        case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE ->
            path.isEmpty() ? S3Status.OK : handler.onPath(path.toString(), text(reader));
        case XMLStreamConstants.END_ELEMENT -> {
          S3Status closed = handler.onPath(path.toString(), null);
          path.pop();
          yield closed;
        }
        default -> S3Status.OK;
      };
      if (!status.isOk()) {
        return status;
      }
    }
    return S3Status.OK;
  }

  private static CharSequence text(XMLStreamReader reader) {
    return new String(reader.getTextCharacters(), reader.getTextStart(), reader.getTextLength());
  }

  private static void close(XMLStreamReader reader) {
    try {
      reader.close();
    } catch (XMLStreamException ex) {
      log.debug("Failed to close XML reader", ex);
    }
  }

  /** Slash-joined stack of local element names. */
  private static final class ElementPath {
    private final StringBuilder joined = new StringBuilder();
    private final ArrayDeque<Integer> marks = new ArrayDeque<>();

    void push(String localName) {
      marks.push(joined.length());
      if (joined.length() > 0) {
        joined.append('/');
      }
      joined.append(localName);
    }

    void pop() {
      joined.setLength(marks.pop());
    }

    boolean isEmpty() {
      return marks.isEmpty();
    }

    @Override
    public String toString() {
      return joined.toString();
    }
  }
}
