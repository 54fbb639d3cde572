package cafe.woden.logkeeper.handler;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.MalformedRecordException;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.model.LogEntry;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.function.Consumer;

/** File backend storing exactly one record per line. Blank lines are ignored. */
abstract class AbstractLineLogHandler extends AbstractFileLogHandler {

  protected AbstractLineLogHandler(HandlerSettings settings, MalformedRecordListener listener) {
    super(settings, listener);
  }

  /** Encodes {@code entry} as a single line without terminator. */
  protected abstract String encodeLine(LogEntry entry);

  /** @throws MalformedRecordException if the line does not hold a valid entry */
  protected abstract LogEntry decodeLine(String line, long lineNumber);

  @Override
  protected final String encode(LogEntry entry) {
    return encodeLine(entry) + "\n";
  }

  @Override
  protected final void decodeAll(
      BufferedReader in, Consumer<LogEntry> out, Consumer<MalformedRecordException> skipped)
      throws IOException {
    long lineNumber = 0;
    String line;
    while ((line = in.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) continue;
      try {
        out.accept(decodeLine(line, lineNumber));
      } catch (MalformedRecordException ex) {
        skipped.accept(ex);
      }
    }
  }

  protected MalformedRecordException malformed(long lineNumber, String reason) {
    return new MalformedRecordException(describe(), lineNumber, reason);
  }

  protected MalformedRecordException malformed(long lineNumber, String reason, Throwable cause) {
    return new MalformedRecordException(describe(), lineNumber, reason, cause);
  }
}
