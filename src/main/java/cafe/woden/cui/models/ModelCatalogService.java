package cafe.woden.cui.models;

import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.config.api.SettingsStoreException;
import cafe.woden.cui.model.ModelInfo;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serves the model list from {@code models["claude-code"]} in the settings, or a built-in list
 * when none is configured.
 */
@Component
public class ModelCatalogService {

  private static final Logger log = LoggerFactory.getLogger(ModelCatalogService.class);

  public static final String CLAUDE_CODE_PROVIDER = "claude-code";
  public static final String FALLBACK_DEFAULT_MODEL = "sonnet";

  static final List<ModelInfo> FALLBACK_MODELS =
      List.of(
          new ModelInfo("default", "Default (Sonnet)", "Recommended adaptive model"),
          new ModelInfo("sonnet", "Sonnet", "Latest Sonnet for daily coding tasks"),
          new ModelInfo("opus", "Opus", "Most capable for complex reasoning"),
          new ModelInfo("haiku", "Haiku", "Fast and efficient for simple tasks"));

  private final SettingsQueryPort settings;

  public ModelCatalogService(SettingsQueryPort settings) {
    this.settings = settings;
  }

  public ModelCatalog catalog() {
    List<ModelInfo> configured;
    try {
      configured = settings.getConfig().modelsFor(CLAUDE_CODE_PROVIDER);
    } catch (SettingsStoreException e) {
      log.warn("[cui] Models unavailable from settings ({}), using built-in list", e.kind());
      configured = List.of();
    }

    if (!configured.isEmpty()) {
      String defaultModel = configured.get(0).value();
      if (defaultModel.isEmpty()) defaultModel = "default";
      return new ModelCatalog(configured, defaultModel, true);
    }

    log.debug("[cui] No models configured for '{}', using built-in list", CLAUDE_CODE_PROVIDER);
    return new ModelCatalog(FALLBACK_MODELS, FALLBACK_DEFAULT_MODEL, false);
  }
}
