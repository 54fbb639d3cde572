package cafe.woden.logkeeper.api;

/** The backend could not be written to or read from (permissions, disk full, broken connection). */
public class LogPersistenceException extends LogStoreException {

  public LogPersistenceException(String message) {
    super(message);
  }

  public LogPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
