package cafe.woden.cui.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Outcome of loading the settings file.
 *
 * @param document merged document, complete with respect to {@link SettingsDefaults}
 * @param migrated true when {@code document} differs from what was on disk and must be written
 * @param origin what was found at the path
 */
public record LoadResult(ObjectNode document, boolean migrated, Origin origin) {

  public enum Origin {
    /** No file; the document is all defaults. */
    MISSING,
    /** Zero-length or whitespace-only file, read as {@code {}}. */
    EMPTY,
    /** A JSON object was read and merged onto the defaults. */
    PARSED,
    /** Not JSON, or JSON that is not an object; read as {@code {}}. */
    MALFORMED
  }

  public LoadResult {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(origin, "origin");
  }
}
