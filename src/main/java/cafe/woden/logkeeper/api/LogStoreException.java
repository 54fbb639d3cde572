package cafe.woden.logkeeper.api;

/**
 * Base type of every failure raised by the logkeeper library.
 *
 * <p>Never thrown directly: callers branch on {@link LogPersistenceException},
 * {@link MalformedRecordException} or {@link LogConfigurationException}.
 */
public abstract class LogStoreException extends RuntimeException {

  protected LogStoreException(String message) {
    super(message);
  }

  protected LogStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
