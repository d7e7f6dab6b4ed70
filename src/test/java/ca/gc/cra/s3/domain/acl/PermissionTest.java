package ca.gc.cra.s3.domain.acl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class PermissionTest {

  @Test
  void everyWireNameResolves() {
    for (Permission permission : Permission.values()) {
      assertEquals(Optional.of(permission), Permission.fromWireName(permission.wireName()));
    }
  }

  @Test
  void emptyAndUnknownTokensDoNotResolve() {
    assertTrue(Permission.fromWireName("").isEmpty());
    assertTrue(Permission.fromWireName("FULL-CONTROL").isEmpty());
    assertTrue(Permission.fromWireName(" READ").isEmpty());
  }

  @Test
  void groupUrisMapToTheirGrantees() {
    assertEquals(Optional.of(Grantee.ALL_AWS_USERS), Grantee.group(Grantee.AUTHENTICATED_USERS_URI));
    assertEquals(Optional.of(Grantee.ALL_USERS), Grantee.group(Grantee.ALL_USERS_URI));
    assertTrue(Grantee.group("http://acs.amazonaws.com/groups/s3/LogDelivery").isEmpty());
  }
}
