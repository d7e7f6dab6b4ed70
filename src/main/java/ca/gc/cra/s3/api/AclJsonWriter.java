package ca.gc.cra.s3.api;

import ca.gc.cra.s3.application.acl.AclConversionResult;
import ca.gc.cra.s3.domain.acl.AclGrant;
import ca.gc.cra.s3.domain.acl.Grantee;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;

/**
 * Renders a converted ACL as a JSON document.
 */
final class AclJsonWriter {
  private final JsonFactory factory = new JsonFactory();

  String write(AclConversionResult result, AclGrant[] grants) throws IOException {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("status", result.status().displayName());
      gen.writeObjectFieldStart("owner");
      gen.writeStringField("id", result.owner().id());
      gen.writeStringField("displayName", result.owner().displayName());
      gen.writeEndObject();
      gen.writeArrayFieldStart("grants");
      for (int i = 0; i < result.grantCount(); i++) {
        writeGrant(gen, grants[i]);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    return out.toString();
  }

  private static void writeGrant(JsonGenerator gen, AclGrant grant) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("granteeType", grant.granteeType().name());
    Grantee grantee = grant.grantee();
    if (grantee instanceof Grantee.EmailAddress email) {
      gen.writeStringField("emailAddress", email.emailAddress());
    } else if (grantee instanceof Grantee.CanonicalUser user) {
      gen.writeStringField("id", user.id());
      gen.writeStringField("displayName", user.displayName());
    }
    gen.writeStringField("permission", grant.permission().wireName());
    gen.writeEndObject();
  }
}
