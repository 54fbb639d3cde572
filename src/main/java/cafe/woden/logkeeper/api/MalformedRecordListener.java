package cafe.woden.logkeeper.api;

/**
 * Warning channel for records skipped during a read.
 *
 * <p>Called once per skipped record, on the reading thread, before the read returns.
 */
@FunctionalInterface
public interface MalformedRecordListener {

  MalformedRecordListener IGNORE = ex -> {
    // counted and logged by the handler itself
  };

  void skipped(MalformedRecordException ex);
}
