package cafe.woden.cui.config.api;

import java.io.IOException;
import java.nio.file.Path;

/** The settings file could not be written; the update that caused the write was rejected. */
public class SettingsWriteException extends SettingsStoreException {

  public SettingsWriteException(Path file, IOException cause) {
    super(ErrorKind.WRITE_FAILED, file, "Could not write settings file '" + file + "'", cause);
  }
}
