package cafe.woden.logkeeper.config;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.handler.CsvLogHandler;
import cafe.woden.logkeeper.handler.JdbcLogHandler;
import cafe.woden.logkeeper.handler.JsonLinesLogHandler;
import cafe.woden.logkeeper.handler.TextFileLogHandler;
import java.util.Objects;

/** Builds the {@link LogHandler} for a backend. The only place that branches on backend kind. */
public final class LogHandlerFactory {

  private LogHandlerFactory() {}

  public static LogHandler create(LogBackend backend, HandlerSettings settings) {
    return create(backend, settings, MalformedRecordListener.IGNORE);
  }

  public static LogHandler create(
      LogBackend backend, HandlerSettings settings, MalformedRecordListener listener) {
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(settings, "settings");
    return switch (backend) {
      case TEXT -> new TextFileLogHandler(settings, listener);
      case JSON -> new JsonLinesLogHandler(settings, listener);
      case CSV -> new CsvLogHandler(settings, listener);
      case JDBC -> new JdbcLogHandler(settings, listener);
    };
  }

  public static LogHandler create(LogkeeperProperties props, MalformedRecordListener listener) {
    Objects.requireNonNull(props, "props");
    return create(props.backend(), props.handlerSettings(), listener);
  }
}
