package cafe.woden.cui.config;

import cafe.woden.cui.config.api.SettingsStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the settings file and brings it up to the current shape by merging it onto
 * {@link SettingsDefaults}.
 *
 * <p>Bad content never fails a load: a file that is not a JSON object is read as {@code {}} and
 * reported as {@link LoadResult.Origin#MALFORMED}. Only an I/O error on an existing file throws.
 */
public class SettingsFileLoader {

  private static final Logger log = LoggerFactory.getLogger(SettingsFileLoader.class);
  private static final DateTimeFormatter BACKUP_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

  private final MachineIdGenerator machineIds;
  private final boolean backupMalformed;
  private final Clock clock;

  public SettingsFileLoader(MachineIdGenerator machineIds, boolean backupMalformed) {
    this(machineIds, backupMalformed, Clock.systemDefaultZone());
  }

  SettingsFileLoader(MachineIdGenerator machineIds, boolean backupMalformed, Clock clock) {
    this.machineIds = Objects.requireNonNull(machineIds, "machineIds");
    this.backupMalformed = backupMalformed;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public LoadResult load(Path file) {
    if (!Files.exists(file)) {
      return new LoadResult(complete(SettingsDefaults.newDocument()), true, LoadResult.Origin.MISSING);
    }

    byte[] raw;
    try {
      raw = Files.readAllBytes(file);
    } catch (IOException e) {
      throw SettingsStoreException.readFailed(file, e);
    }

    LoadResult.Origin origin;
    ObjectNode loaded;
    if (new String(raw, StandardCharsets.UTF_8).isBlank()) {
      origin = LoadResult.Origin.EMPTY;
      loaded = JsonNodeFactory.instance.objectNode();
    } else {
      loaded = parseObject(file, raw);
      origin = loaded != null ? LoadResult.Origin.PARSED : LoadResult.Origin.MALFORMED;
      if (loaded == null) {
        if (backupMalformed) backup(file);
        loaded = JsonNodeFactory.instance.objectNode();
      }
    }

    ObjectNode merged = complete(SettingsMerge.merge(SettingsDefaults.newDocument(), loaded));
    boolean migrated = !merged.equals(loaded);
    if (migrated) {
      log.debug("[cui] Settings file '{}' needs migration (origin={})", file, origin);
    }
    return new LoadResult(merged, migrated, origin);
  }

  /** Parses the bytes as UTF-8 JSON; bad encoding counts as bad content. */
  private static ObjectNode parseObject(Path file, byte[] raw) {
    try {
      JsonNode node = SettingsJson.MAPPER.readTree(raw);
      if (node instanceof ObjectNode o) return o;
      log.warn(
          "[cui] Settings file '{}' holds a JSON {} instead of an object; using defaults",
          file,
          node == null ? "nothing" : node.getNodeType());
    } catch (JsonProcessingException e) {
      log.warn(
          "[cui] Settings file '{}' is not valid JSON; using defaults: {}",
          file,
          e.getOriginalMessage());
    } catch (IOException e) {
      log.warn(
          "[cui] Settings file '{}' is not readable as UTF-8 JSON; using defaults: {}",
          file,
          e.getMessage());
    }
    return null;
  }

  private ObjectNode complete(ObjectNode doc) {
    JsonNode id = doc.get("machineId");
    boolean missing = id == null || id.isNull() || (id.isTextual() && id.asText().isBlank());
    if (missing) {
      doc.put("machineId", machineIds.generate());
    }
    return doc;
  }

  private void backup(Path file) {
    String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);
    Path copy = file.resolveSibling(file.getFileName() + ".corrupt-" + stamp);
    try {
      Files.copy(file, copy, StandardCopyOption.REPLACE_EXISTING);
      log.warn("[cui] Kept unreadable settings file as '{}'", copy);
    } catch (IOException e) {
      log.warn("[cui] Could not back up unreadable settings file '{}'", file, e);
    }
  }
}
