package cafe.woden.cui.config;

import cafe.woden.cui.config.api.SettingsCommandPort;
import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.config.api.SettingsStoreException;
import cafe.woden.cui.model.InterfacePatch;
import cafe.woden.cui.model.InterfaceSettings;
import cafe.woden.cui.model.SettingsDocument;
import cafe.woden.cui.model.SettingsPatch;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Owns the settings file and the in-memory copy of it.
 *
 * <p>The store starts {@link State#UNINITIALIZED}. {@link #initialize()} loads the file, writes it
 * back if loading had to fill in defaults, and moves to {@link State#READY}. Loads and updates run
 * one at a time on the settings executor in submission order; each update merges onto the latest
 * committed document and commits only after the file was written. Reads see the last committed
 * document and never wait for an update.
 */
@Component
@ApplicationLayer
public class SettingsStore implements SettingsQueryPort, SettingsCommandPort {

  private static final Logger log = LoggerFactory.getLogger(SettingsStore.class);

  public enum State {
    UNINITIALIZED,
    READY
  }

  private final Path file;
  private final SettingsFileLoader loader;
  private final SettingsFileWriter writer;
  private final ExecutorService executor;

  /** Never mutated once published; {@code null} while uninitialized. */
  private volatile ObjectNode committed;
  private volatile LoadResult.Origin lastLoadOrigin;

  @Autowired
  public SettingsStore(
      SettingsProperties properties,
      MachineIdGenerator machineIds,
      @Qualifier(ExecutorConfig.SETTINGS_PERSIST_EXECUTOR) ExecutorService executor) {
    this(
        properties.path(),
        new SettingsFileLoader(machineIds, properties.backupMalformed()),
        new SettingsFileWriter(),
        executor);
  }

  public SettingsStore(
      Path file, SettingsFileLoader loader, SettingsFileWriter writer, ExecutorService executor) {
    this.file = Objects.requireNonNull(file, "file");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public Path settingsFile() {
    return file;
  }

  public State state() {
    return committed == null ? State.UNINITIALIZED : State.READY;
  }

  /** How the file looked at the last load, or {@code null} before the first one. */
  public LoadResult.Origin lastLoadOrigin() {
    return lastLoadOrigin;
  }

  /** Loads the file once. A no-op when already {@link State#READY}. */
  public CompletableFuture<Void> initialize() {
    return submit(
        () -> {
          if (committed != null) return null;

          LoadResult loaded = loader.load(file);
          if (loaded.migrated()) {
            writer.write(file, loaded.document());
            if (loaded.origin() == LoadResult.Origin.MISSING) {
              log.info("[cui] Created settings file '{}' with defaults", file);
            } else {
              log.info("[cui] Migrated settings file '{}' (origin={})", file, loaded.origin());
            }
          }
          lastLoadOrigin = loaded.origin();
          committed = loaded.document();
          return null;
        });
  }

  /**
   * Drops the in-memory document so the next {@link #initialize()} re-reads the file.
   *
   * <p>Waits for updates already submitted.
   */
  public void reset() {
    submit(
            () -> {
              committed = null;
              lastLoadOrigin = null;
              return null;
            })
        .join();
  }

  @Override
  public SettingsDocument getConfig() {
    return toDocument(requireCommitted());
  }

  @Override
  public JsonNode getConfigJson() {
    return requireCommitted().deepCopy();
  }

  @Override
  public InterfaceSettings getInterface() {
    return getConfig().interfaceSettings();
  }

  @Override
  public CompletableFuture<SettingsDocument> updateConfig(SettingsPatch patch) {
    return submit(() -> toDocument(apply(patch)));
  }

  @Override
  public CompletableFuture<JsonNode> updateConfigJson(SettingsPatch patch) {
    return submit(() -> apply(patch).deepCopy());
  }

  @Override
  public CompletableFuture<InterfaceSettings> updateInterface(InterfacePatch patch) {
    InterfacePatch p = patch == null ? new InterfacePatch(null, null, null) : patch;
    return updateConfig(SettingsPatch.ofInterface(p))
        .thenApply(SettingsDocument::interfaceSettings);
  }

  /** Runs on the settings executor. Returns the document this update committed. */
  private ObjectNode apply(SettingsPatch patch) {
    ObjectNode current = requireCommitted();
    JsonNode override = patch == null ? null : SettingsJson.MAPPER.valueToTree(patch);
    ObjectNode next = SettingsMerge.merge(current, override);

    writer.write(file, next);
    committed = next;
    log.debug("[cui] Updated settings file '{}'", file);
    return next;
  }

  private ObjectNode requireCommitted() {
    ObjectNode doc = committed;
    if (doc == null) throw SettingsStoreException.notInitialized(file);
    return doc;
  }

  private static SettingsDocument toDocument(ObjectNode doc) {
    return SettingsJson.MAPPER.convertValue(doc, SettingsDocument.class);
  }

  private <T> CompletableFuture<T> submit(Supplier<T> task) {
    return CompletableFuture.supplyAsync(task, executor);
  }
}
