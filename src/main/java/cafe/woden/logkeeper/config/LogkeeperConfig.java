package cafe.woden.logkeeper.config;

import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.logger.LevelLogger;
import cafe.woden.logkeeper.reader.LogReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for a handler, a logger and a reader built from {@link LogkeeperProperties}.
 *
 * <p>Applications can replace the handler by declaring their own {@link LogHandler} bean.
 */
@Configuration
@EnableConfigurationProperties(LogkeeperProperties.class)
public class LogkeeperConfig {

  private static final Logger log = LoggerFactory.getLogger(LogkeeperConfig.class);

  @Bean
  @ConditionalOnMissingBean(LogHandler.class)
  public LogHandler logkeeperHandler(
      LogkeeperProperties props, ObjectProvider<MalformedRecordListener> listener) {
    LogHandler handler =
        LogHandlerFactory.create(
            props, listener.getIfAvailable(() -> MalformedRecordListener.IGNORE));
    log.info("[logkeeper] Persisting log entries to {} ({})", handler.describe(), props.backend());
    return handler;
  }

  @Bean
  @ConditionalOnMissingBean(LevelLogger.class)
  public LevelLogger levelLogger(LogHandler handler, LogkeeperProperties props) {
    LevelLogger logger = new LevelLogger(handler);
    logger.setMinimumLevel(props.minimumLevel());
    return logger;
  }

  @Bean
  @ConditionalOnMissingBean(LogReader.class)
  public LogReader logReader(LogHandler handler) {
    return new LogReader(handler);
  }
}
