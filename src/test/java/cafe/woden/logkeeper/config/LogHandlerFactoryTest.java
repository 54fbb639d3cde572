package cafe.woden.logkeeper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.handler.TextFileLogHandler;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import cafe.woden.logkeeper.reader.LogReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogHandlerFactoryTest {

  @TempDir Path tempDir;

  @Test
  void readerBehavesTheSameOverEveryFileBackend() {
    Instant t = Instant.parse("2024-01-01T00:00:00Z");
    List<LogEntry> entries =
        List.of(
            new LogEntry(t, LogLevel.INFO, "e0"),
            new LogEntry(t.plusSeconds(1), LogLevel.ERROR, "e1"),
            new LogEntry(t.plusSeconds(2), LogLevel.INFO, "e2"),
            new LogEntry(t.plusSeconds(3), LogLevel.DEBUG, "e3"));

    for (LogBackend backend : List.of(LogBackend.TEXT, LogBackend.JSON, LogBackend.CSV)) {
      LogHandler handler =
          LogHandlerFactory.create(
              backend, HandlerSettings.of(tempDir.resolve("app" + backend.defaultExtension())));
      entries.forEach(handler::persist);

      assertEquals(
          Map.of(
              LogLevel.INFO, List.of(entries.get(0), entries.get(2)),
              LogLevel.ERROR, List.of(entries.get(1)),
              LogLevel.DEBUG, List.of(entries.get(3))),
          new LogReader(handler).groupByLevel(),
          backend.name());
    }
  }

  @Test
  void settingsCarryEncoding() {
    LogHandler handler =
        LogHandlerFactory.create(
            LogBackend.TEXT,
            new HandlerSettings(tempDir.resolve("x.log").toString(), StandardCharsets.ISO_8859_1));

    assertInstanceOf(TextFileLogHandler.class, handler);
  }

  @Test
  void blankTargetIsRejected() {
    assertThrows(LogConfigurationException.class, () -> HandlerSettings.of("  "));
  }

  @Test
  void unknownEncodingIsRejected() {
    assertThrows(
        LogConfigurationException.class,
        () -> HandlerSettings.of(tempDir.resolve("x.log").toString(), "klingon-8"));
  }
}
