package ca.gc.cra.s3.application.acl;

import ca.gc.cra.s3.application.port.MetricsPort;
import ca.gc.cra.s3.application.port.XmlPathEventSource;
import ca.gc.cra.s3.domain.acl.AclGrant;
import ca.gc.cra.s3.domain.acl.AclGrantDecoder;
import ca.gc.cra.s3.domain.acl.AclLimits;
import ca.gc.cra.s3.domain.acl.Owner;
import ca.gc.cra.s3.domain.status.S3Status;
import ca.gc.cra.s3.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts an {@code AccessControlPolicy} XML document into owner fields and a
 * caller-owned grant array.
 * <p><strong>Why:</strong> Bucket and object ACL responses must be decoded with memory bounded by configured
 * limits regardless of document content.</p>
 * <p><strong>Role:</strong> Application use case wiring an {@link XmlPathEventSource} to a fresh
 * {@link AclGrantDecoder} per call.</p>
 * <p><strong>Thread-safety:</strong> stateless between calls; concurrent conversions into distinct arrays are
 * safe.</p>
 * <p><strong>Observability:</strong> increments {@code acl.convert.success} or {@code acl.convert.failure} and
 * observes {@code acl.convert.grants}.</p>
 *
 * @since 0.1.0
 */
public final class AclXmlConverter {
  private static final Logger log = LoggerFactory.getLogger(AclXmlConverter.class);
  private static final int LOG_PREVIEW_BYTES = 256;

  private final XmlPathEventSource source;
  private final AclLimits limits;
  private final MetricsPort metrics;

  /**
   * Creates a converter.
   *
   * @param source XML path event source
   * @param limits field and document limits
   * @param metrics metrics sink
   */
  public AclXmlConverter(XmlPathEventSource source, AclLimits limits, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.limits = Objects.requireNonNull(limits, "limits");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Decodes {@code xml} into {@code grants}.
   *
   * @param xml document text
   * @param grants caller-owned output array; its length is the grant capacity
   * @return status, owner and committed grant count; on failure the leading {@code grantCount} entries still
   *     hold the grants committed before the failure
   */
  public AclConversionResult convert(String xml, AclGrant[] grants) {
    Objects.requireNonNull(xml, "xml");
    Objects.requireNonNull(grants, "grants");

    if (xml.length() > limits.maxDocumentLength()) {
      return finish(new AclConversionResult(S3Status.ACL_XML_DOCUMENT_TOO_LARGE, Owner.EMPTY, 0), xml);
    }

    AclGrantDecoder decoder = new AclGrantDecoder(grants, limits);
    S3Status status = source.parse(xml, decoder::onPath);
    return finish(new AclConversionResult(status, decoder.owner(), decoder.grantCount()), xml);
  }

  private AclConversionResult finish(AclConversionResult result, String xml) {
    metrics.observe("acl.convert.grants", result.grantCount());
    if (result.isOk()) {
      metrics.increment("acl.convert.success");
      log.debug("Decoded {} ACL grants for owner {}", result.grantCount(), Logs.mask(result.owner().id()));
    } else {
      metrics.increment("acl.convert.failure");
      log.warn("ACL conversion failed with {} after {} grants; document {}",
          result.status().displayName(), result.grantCount(), Logs.truncate(xml, LOG_PREVIEW_BYTES));
    }
    return result;
  }
}
