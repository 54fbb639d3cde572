package cafe.woden.logkeeper.config;

/** Storage backend selected by {@code logkeeper.backend}. */
public enum LogBackend {
  TEXT(".log"),
  JSON(".jsonl"),
  CSV(".csv"),
  /** HSQLDB adds its own .script/.properties/.data suffixes to the base name. */
  JDBC("");

  private final String defaultExtension;

  LogBackend(String defaultExtension) {
    this.defaultExtension = defaultExtension;
  }

  public String defaultExtension() {
    return defaultExtension;
  }
}
