package cafe.woden.logkeeper.config;

import cafe.woden.logkeeper.api.HandlerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Log persistence configuration, bound from {@code logkeeper.*}. */
@ConfigurationProperties(prefix = "logkeeper")
public record LogkeeperProperties(
    /** Storage backend. Default: JSON (JSON Lines). */
    LogBackend backend,

    /**
     * File location, or for {@code JDBC} either a database base path or a full {@code jdbc:} URL.
     *
     * <p>Default: {@code logs/logkeeper} plus the backend's file extension.
     */
    String path,

    /** Text encoding of the file backends. Default: UTF-8. */
    String encoding,

    /** Entries below this level are not written. Default: INFO. */
    String minimumLevel
) {

  public static final String DEFAULT_BASE_PATH = "logs/logkeeper";

  public LogkeeperProperties {
    if (backend == null) backend = LogBackend.JSON;
    if (path == null || path.isBlank()) path = DEFAULT_BASE_PATH + backend.defaultExtension();
    if (encoding == null || encoding.isBlank()) encoding = "UTF-8";
    if (minimumLevel == null || minimumLevel.isBlank()) minimumLevel = "INFO";
  }

  /** @throws cafe.woden.logkeeper.api.LogConfigurationException for an unsupported encoding */
  public HandlerSettings handlerSettings() {
    return HandlerSettings.of(path, encoding);
  }
}
