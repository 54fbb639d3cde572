package cafe.woden.logkeeper.handler;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.api.LogPersistenceException;
import cafe.woden.logkeeper.api.MalformedRecordException;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.model.LogEntry;
import com.google.common.util.concurrent.Striped;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only file storage shared by the text, JSON Lines and CSV backends.
 *
 * <p>Each {@link #persist} opens the file in append mode, takes an exclusive advisory lock,
 * writes one encoded record and closes the channel. Each {@link #readAll} opens, decodes the
 * whole file in a single pass and closes.
 */
abstract class AbstractFileLogHandler implements LogHandler {

  private static final Logger log = LoggerFactory.getLogger(AbstractFileLogHandler.class);

  // FileLock is held per JVM, so threads appending to the same path also need an in-process lock.
  private static final Striped<Lock> APPEND_LOCKS = Striped.lock(64);

  protected final Path path;
  protected final Charset charset;
  private final MalformedRecordListener listener;

  protected AbstractFileLogHandler(HandlerSettings settings, MalformedRecordListener listener) {
    Objects.requireNonNull(settings, "settings");
    this.path = settings.path();
    this.charset = settings.encoding();
    this.listener = listener != null ? listener : MalformedRecordListener.IGNORE;

    if (Files.isDirectory(path)) {
      throw new LogConfigurationException("Log path '" + path + "' is a directory");
    }
    Path parent = path.getParent();
    if (parent != null) {
      try {
        Files.createDirectories(parent);
      } catch (IOException ex) {
        throw new LogConfigurationException("Cannot create log directory '" + parent + "'", ex);
      }
    }
    log.debug("[logkeeper] {} ready at {} ({})", getClass().getSimpleName(), path, charset);
  }

  /** Encodes one entry as a complete record, including its line terminator. */
  protected abstract String encode(LogEntry entry);

  /**
   * Decodes every record from {@code in}, passing good entries to {@code out} and undecodable
   * ones to {@code skipped}.
   */
  protected abstract void decodeAll(
      BufferedReader in, Consumer<LogEntry> out, Consumer<MalformedRecordException> skipped)
      throws IOException;

  /** Whether {@link #charset} can encode every Unicode code point. */
  protected boolean charsetCoversUnicode() {
    String name = charset.name().toUpperCase(Locale.ROOT);
    return name.startsWith("UTF-") || name.contains("-UTF-") || name.equals("GB18030");
  }

  /** Text written once before the first record of an empty file, or {@code null}. */
  protected String header() {
    return null;
  }

  @Override
  public final void persist(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    append(encode(entry));
  }

  @Override
  public final List<LogEntry> readAll() {
    if (!Files.exists(path)) return List.of();

    List<LogEntry> out = new ArrayList<>();
    int[] skippedCount = {0};
    Consumer<MalformedRecordException> skipped =
        ex -> {
          skippedCount[0]++;
          log.debug("[logkeeper] {}", ex.getMessage());
          listener.skipped(ex);
        };

    // Decoding replaces invalid byte sequences so one damaged record stays a per-record problem.
    try (BufferedReader in =
        new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset))) {
      decodeAll(in, out::add, skipped);
    } catch (NoSuchFileException ex) {
      return List.of();
    } catch (IOException ex) {
      throw new LogPersistenceException("Cannot read log file '" + path + "'", ex);
    }

    if (skippedCount[0] > 0) {
      log.warn(
          "[logkeeper] Skipped {} malformed record(s) while reading {}", skippedCount[0], path);
    }
    return Collections.unmodifiableList(out);
  }

  @Override
  public String describe() {
    return path.toString();
  }

  private void append(String record) {
    Lock lock = APPEND_LOCKS.get(path);
    lock.lock();
    try (FileChannel channel =
            FileChannel.open(
                path,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        FileLock fileLock = channel.lock()) {
      String head = header();
      String payload = head != null && channel.size() == 0 ? head + record : record;
      ByteBuffer bytes =
          charset
              .newEncoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .encode(CharBuffer.wrap(payload));
      while (bytes.hasRemaining()) {
        channel.write(bytes);
      }
    } catch (IOException | OverlappingFileLockException ex) {
      throw new LogPersistenceException("Cannot append to log file '" + path + "'", ex);
    } finally {
      lock.unlock();
    }
  }
}
