package ca.gc.cra.s3.infrastructure.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.s3.application.lock.ThirdPartyThreadSafetyBridge;
import ca.gc.cra.s3.application.port.CryptoLockingPort;
import ca.gc.cra.s3.application.port.MutexCallbacks;
import ca.gc.cra.s3.application.port.ThreadSelfCallback;
import org.junit.jupiter.api.Test;

class CryptoLockingPortsTest {

  @Test
  void detectAlwaysReturnsUsablePort() {
    CryptoLockingPort port = CryptoLockingPorts.detect();

    assertNotNull(port);
    assertTrue(port.numLocks() >= 0);
  }

  @Test
  void disabledPortKeepsRegistrationsUntilCleared() throws Exception {
    DisabledCryptoLocking port = new DisabledCryptoLocking();
    ThirdPartyThreadSafetyBridge bridge =
        new ThirdPartyThreadSafetyBridge(port, MutexCallbacks.singleThreaded(), ThreadSelfCallback.CURRENT_THREAD_ID);

    bridge.initialize();
    assertEquals(0, bridge.lockCount());
    assertEquals(5, port.registeredHookCount());

    bridge.deinitialize();
    assertEquals(0, port.registeredHookCount());
  }
}
