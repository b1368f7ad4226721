package cafe.woden.cui.config;

import cafe.woden.cui.config.api.SettingsWriteException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the settings document as pretty-printed JSON.
 *
 * <p>The content goes to a temporary file in the target's directory, is forced to disk, and is
 * then renamed over the target, so readers see either the old or the new file.
 */
public class SettingsFileWriter {

  private static final Logger log = LoggerFactory.getLogger(SettingsFileWriter.class);

  public void write(Path file, JsonNode document) {
    Path target = file.toAbsolutePath();
    Path parent = target.getParent();
    Path tmp = null;
    try {
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      byte[] bytes = (SettingsJson.PRETTY.writeValueAsString(document) + "\n")
          .getBytes(StandardCharsets.UTF_8);

      tmp = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");
      try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        while (buf.hasRemaining()) {
          ch.write(buf);
        }
        ch.force(true);
      }

      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("[cui] Atomic move unsupported for '{}', replacing in place", target);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      tmp = null;
    } catch (IOException e) {
      log.warn("[cui] Could not write settings file '{}'", target, e);
      throw new SettingsWriteException(file, e);
    } finally {
      if (tmp != null) deleteQuietly(tmp);
    }
  }

  private static void deleteQuietly(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.debug("[cui] Could not remove temporary settings file '{}'", tmp, e);
    }
  }
}
