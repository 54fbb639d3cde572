package cafe.woden.logkeeper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.handler.CsvLogHandler;
import cafe.woden.logkeeper.handler.JdbcLogHandler;
import cafe.woden.logkeeper.handler.JsonLinesLogHandler;
import cafe.woden.logkeeper.handler.TextFileLogHandler;
import cafe.woden.logkeeper.logger.LevelLogger;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import cafe.woden.logkeeper.reader.LogReader;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class LogkeeperConfigTest {

  @TempDir Path tempDir;

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(LogkeeperConfig.class);

  @Test
  void eachBackendNameSelectsItsHandler() {
    assertBackend("text", tempDir.resolve("app.log").toString(), TextFileLogHandler.class);
    assertBackend("json", tempDir.resolve("app.jsonl").toString(), JsonLinesLogHandler.class);
    assertBackend("csv", tempDir.resolve("app.csv").toString(), CsvLogHandler.class);
    assertBackend("jdbc", "jdbc:hsqldb:mem:cfg-" + UUID.randomUUID(), JdbcLogHandler.class);
  }

  private void assertBackend(String backend, String path, Class<?> expected) {
    runner
        .withPropertyValues("logkeeper.backend=" + backend, "logkeeper.path=" + path)
        .run(
            ctx -> {
              LogHandler handler = ctx.getBean(LogHandler.class);
              assertInstanceOf(expected, handler);
              assertTrue(handler.readAll().isEmpty());
            });
  }

  @Test
  void loggerAndReaderShareTheConfiguredHandler() {
    runner
        .withPropertyValues(
            "logkeeper.backend=csv",
            "logkeeper.path=" + tempDir.resolve("shared.csv"),
            "logkeeper.minimum-level=warning")
        .run(
            ctx -> {
              LevelLogger logger = ctx.getBean(LevelLogger.class);
              LogReader reader = ctx.getBean(LogReader.class);
              assertEquals(LogLevel.WARNING, logger.minimumLevel());

              logger.info("filtered");
              logger.error("kept, with a comma");

              List<LogEntry> errors = reader.findByLevel(LogLevel.ERROR);
              assertEquals(1, errors.size());
              assertEquals("kept, with a comma", errors.get(0).message());
              assertTrue(reader.findByLevel(LogLevel.INFO).isEmpty());
            });
  }

  @Test
  void defaultsToJsonLinesAtInfo() {
    LogkeeperProperties props = new LogkeeperProperties(null, null, null, null);

    assertEquals(LogBackend.JSON, props.backend());
    assertEquals("logs/logkeeper.jsonl", props.path());
    assertEquals("UTF-8", props.encoding());
    assertEquals("INFO", props.minimumLevel());
  }

  @Test
  void applicationHandlerReplacesConfiguredOne() {
    LogHandler custom = Mockito.mock(LogHandler.class);
    runner
        .withBean(LogHandler.class, () -> custom)
        .run(
            ctx -> {
              assertSame(custom, ctx.getBean(LogHandler.class));
              ctx.getBean(LevelLogger.class).critical("to custom");
              Mockito.verify(custom).persist(Mockito.any());
            });
  }

  @Test
  void unsupportedEncodingFailsStartup() {
    runner
        .withPropertyValues(
            "logkeeper.backend=text",
            "logkeeper.path=" + tempDir.resolve("bad.log"),
            "logkeeper.encoding=NOT-A-CHARSET")
        .run(
            ctx -> {
              Throwable failure = ctx.getStartupFailure();
              assertNotNull(failure);
              assertTrue(hasCause(failure, LogConfigurationException.class), failure.toString());
            });
  }

  @Test
  void unknownMinimumLevelFailsStartup() {
    runner
        .withPropertyValues(
            "logkeeper.backend=json",
            "logkeeper.path=" + tempDir.resolve("app.jsonl"),
            "logkeeper.minimum-level=LOUD")
        .run(
            ctx -> {
              Throwable failure = ctx.getStartupFailure();
              assertNotNull(failure);
              assertTrue(hasCause(failure, LogConfigurationException.class), failure.toString());
            });
  }

  private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (type.isInstance(c)) return true;
    }
    return false;
  }
}
