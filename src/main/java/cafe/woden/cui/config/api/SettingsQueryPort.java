package cafe.woden.cui.config.api;

import cafe.woden.cui.model.InterfaceSettings;
import cafe.woden.cui.model.SettingsDocument;
import com.fasterxml.jackson.databind.JsonNode;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Read operations over the committed settings.
 *
 * <p>Reads never block on an in-flight update. Every method throws {@link SettingsStoreException}
 * with kind {@code NOT_INITIALIZED} until the store has loaded its file.
 */
@ApplicationLayer
public interface SettingsQueryPort {

  SettingsDocument getConfig();

  /** Detached copy of the whole document, including keys this version does not know about. */
  JsonNode getConfigJson();

  InterfaceSettings getInterface();
}
