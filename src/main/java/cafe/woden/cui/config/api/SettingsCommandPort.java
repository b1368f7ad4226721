package cafe.woden.cui.config.api;

import cafe.woden.cui.model.InterfacePatch;
import cafe.woden.cui.model.InterfaceSettings;
import cafe.woden.cui.model.SettingsDocument;
import cafe.woden.cui.model.SettingsPatch;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Update operations over the settings.
 *
 * <p>Updates apply in submission order. A returned future completes only after the file was
 * written; it fails with {@link SettingsWriteException} when the write fails, in which case the
 * committed settings are left as they were.
 */
@ApplicationLayer
public interface SettingsCommandPort {

  CompletableFuture<SettingsDocument> updateConfig(SettingsPatch patch);

  /** Like {@link #updateConfig}, completing with the full stored document this update committed. */
  CompletableFuture<JsonNode> updateConfigJson(SettingsPatch patch);

  CompletableFuture<InterfaceSettings> updateInterface(InterfacePatch patch);
}
