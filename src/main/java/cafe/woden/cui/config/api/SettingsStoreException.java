package cafe.woden.cui.config.api;

import java.nio.file.Path;
import java.util.Objects;

/** Failure of a settings store operation. The committed settings are unchanged when thrown. */
public class SettingsStoreException extends RuntimeException {

  public enum ErrorKind {
    /** An accessor was called before {@code initialize()} completed. */
    NOT_INITIALIZED,
    /** The settings file exists but could not be read. */
    READ_FAILED,
    /** The settings file could not be written. */
    WRITE_FAILED
  }

  private final ErrorKind kind;
  private final Path file;

  public SettingsStoreException(ErrorKind kind, Path file, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.file = file;
  }

  public static SettingsStoreException notInitialized(Path file) {
    return new SettingsStoreException(
        ErrorKind.NOT_INITIALIZED, file, "Settings store for '" + file + "' is not initialized", null);
  }

  public static SettingsStoreException readFailed(Path file, Throwable cause) {
    return new SettingsStoreException(
        ErrorKind.READ_FAILED, file, "Could not read settings file '" + file + "'", cause);
  }

  public ErrorKind kind() {
    return kind;
  }

  public Path file() {
    return file;
  }
}
