package ca.gc.cra.s3.application.port;

import ca.gc.cra.s3.domain.status.S3Status;

/**
 * Lifecycle of the external request-execution subsystem (transport, signing, retries).
 *
 * @since 0.1.0
 */
public interface RequestApiPort {
  /** Request subsystem with nothing to set up. */
  RequestApiPort NONE = new RequestApiPort() {
    @Override
    public S3Status initialize(String userAgentInfo) {
      return S3Status.OK;
    }

    @Override
    public void deinitialize() {}
  };

  /**
   * Prepares the request subsystem.
   *
   * @param userAgentInfo product token appended to the User-Agent header; may be {@code null}
   * @return {@link S3Status#OK} on success, otherwise the failure
   */
  S3Status initialize(String userAgentInfo);

  /** Releases request subsystem resources. */
  void deinitialize();
}
