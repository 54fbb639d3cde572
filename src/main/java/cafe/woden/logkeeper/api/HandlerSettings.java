package cafe.woden.logkeeper.api;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Construction bundle shared by every backend.
 *
 * <p>{@code target} is a file location for the file backends. The relational backend also
 * accepts a full {@code jdbc:} URL.
 */
public record HandlerSettings(String target, Charset encoding) {

  public HandlerSettings {
    if (target == null || target.isBlank()) {
      throw new LogConfigurationException("Handler target must not be blank");
    }
    target = target.trim();
    if (encoding == null) encoding = StandardCharsets.UTF_8;
  }

  public static HandlerSettings of(Path path) {
    Objects.requireNonNull(path, "path");
    return new HandlerSettings(path.toString(), StandardCharsets.UTF_8);
  }

  public static HandlerSettings of(String target) {
    return new HandlerSettings(target, StandardCharsets.UTF_8);
  }

  /** Resolves {@code encodingName} eagerly; a blank name means UTF-8. */
  public static HandlerSettings of(String target, String encodingName) {
    if (encodingName == null || encodingName.isBlank()) {
      return new HandlerSettings(target, StandardCharsets.UTF_8);
    }
    try {
      return new HandlerSettings(target, Charset.forName(encodingName.trim()));
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new LogConfigurationException("Unsupported encoding '" + encodingName + "'", ex);
    }
  }

  public boolean isJdbcUrl() {
    return target.regionMatches(true, 0, "jdbc:", 0, 5);
  }

  /** The target as a filesystem path. */
  public Path path() {
    try {
      return Paths.get(target).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new LogConfigurationException("Invalid path '" + target + "'", ex);
    }
  }
}
