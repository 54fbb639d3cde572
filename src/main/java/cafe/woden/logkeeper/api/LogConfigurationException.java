package cafe.woden.logkeeper.api;

/** Invalid backend or logger configuration, detected when the component is built. */
public class LogConfigurationException extends LogStoreException {

  public LogConfigurationException(String message) {
    super(message);
  }

  public LogConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
