package ca.gc.cra.s3.application.port;

/**
 * Host-supplied thread identity function registered verbatim with the crypto library.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ThreadSelfCallback {
  /** Identity derived from {@link Thread#getId()}; suitable when the crypto library runs on JVM threads. */
  ThreadSelfCallback CURRENT_THREAD_ID = () -> Thread.currentThread().getId();

  /**
   * Returns an identifier unique to the calling thread for the thread's lifetime.
   *
   * @return thread identifier
   */
  long threadId();
}
