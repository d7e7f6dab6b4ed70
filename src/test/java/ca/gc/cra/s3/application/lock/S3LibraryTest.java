package ca.gc.cra.s3.application.lock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.s3.application.port.FakeCryptoLockingPort;
import ca.gc.cra.s3.application.port.MetricsPort;
import ca.gc.cra.s3.application.port.MutexCallbacks;
import ca.gc.cra.s3.application.port.RecordingMutexHost;
import ca.gc.cra.s3.application.port.RequestApiPort;
import ca.gc.cra.s3.domain.status.S3Exception;
import ca.gc.cra.s3.domain.status.S3Status;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class S3LibraryTest {
  private final List<String> events = new ArrayList<>();

  @AfterEach
  void tearDown() {
    S3Library.deinitialize();
  }

  @Test
  void initializeThenDeinitializeRunsInReverseOrder() throws S3Exception {
    FakeCryptoLockingPort crypto = new FakeCryptoLockingPort(2, events);
    RecordingMutexHost host = new RecordingMutexHost(events);

    S3Library.initialize("agent/1.0", crypto, host.callbacks(), null, journaling("OK"), MetricsPort.NO_OP);
    assertTrue(S3Library.isInitialized());
    assertEquals("request init agent/1.0", events.get(events.size() - 1));
    events.clear();

    S3Library.deinitialize();

    assertEquals("request deinit", events.get(0));
    assertEquals("destroy 1", events.get(events.size() - 1));
    assertFalse(S3Library.isInitialized());
  }

  @Test
  void requestSubsystemFailureReleasesLocks() {
    FakeCryptoLockingPort crypto = new FakeCryptoLockingPort(3, events);
    RecordingMutexHost host = new RecordingMutexHost(events);

    S3Exception ex = assertThrows(S3Exception.class, () -> S3Library.initialize(
        null, crypto, host.callbacks(), null, journaling("FailedToInitializeRequest"), MetricsPort.NO_OP));

    assertEquals(S3Status.FAILED_TO_INITIALIZE_REQUEST, ex.status());
    assertEquals(3, host.count("destroy"));
    assertFalse(crypto.anyRegistered());
    assertFalse(S3Library.isInitialized());
  }

  @Test
  void throwingRequestSubsystemReleasesLocksAndRethrows() {
    FakeCryptoLockingPort crypto = new FakeCryptoLockingPort(2, events);
    RecordingMutexHost host = new RecordingMutexHost(events);
    IllegalStateException boom = new IllegalStateException("curl global init failed");
    RequestApiPort throwing = new RequestApiPort() {
      @Override
      public S3Status initialize(String userAgentInfo) {
        throw boom;
      }

      @Override
      public void deinitialize() {
        events.add("request deinit");
      }
    };

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> S3Library.initialize(
        null, crypto, host.callbacks(), null, throwing, MetricsPort.NO_OP));

    assertSame(boom, ex);
    assertFalse(crypto.anyRegistered());
    assertEquals(2, host.count("destroy"));
    assertEquals(0, host.count("request deinit"));
    assertFalse(S3Library.isInitialized());
  }

  @Test
  void lockFailureSkipsRequestSubsystem() {
    FakeCryptoLockingPort crypto = new FakeCryptoLockingPort(3, events);
    RecordingMutexHost host = new RecordingMutexHost(events, 1);

    assertThrows(S3Exception.class, () -> S3Library.initialize(
        null, crypto, host.callbacks(), null, journaling("OK"), MetricsPort.NO_OP));

    assertEquals(0, events.stream().filter(e -> e.startsWith("request")).count());
  }

  @Test
  void secondInitializeIsRejected() throws S3Exception {
    S3Library.initialize(null, new FakeCryptoLockingPort(0), MutexCallbacks.singleThreaded(), null,
        RequestApiPort.NONE, MetricsPort.NO_OP);

    assertThrows(IllegalStateException.class, () -> S3Library.initialize(null, new FakeCryptoLockingPort(0),
        MutexCallbacks.singleThreaded(), null, RequestApiPort.NONE, MetricsPort.NO_OP));
  }

  private RequestApiPort journaling(String initStatus) {
    S3Status status = S3Status.fromName(initStatus).orElseThrow();
    return new RequestApiPort() {
      @Override
      public S3Status initialize(String userAgentInfo) {
        events.add("request init " + userAgentInfo);
        return status;
      }

      @Override
      public void deinitialize() {
        events.add("request deinit");
      }
    };
  }
}
