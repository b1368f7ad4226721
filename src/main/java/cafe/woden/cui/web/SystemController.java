package cafe.woden.cui.web;

import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.model.SettingsDocument;
import cafe.woden.cui.models.ModelCatalog;
import cafe.woden.cui.models.ModelCatalogService;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
public class SystemController {

  private final SettingsQueryPort settings;
  private final ModelCatalogService modelCatalog;

  public SystemController(SettingsQueryPort settings, ModelCatalogService modelCatalog) {
    this.settings = settings;
    this.modelCatalog = modelCatalog;
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  @GetMapping("/status")
  public SystemStatus status() {
    SettingsDocument config = settings.getConfig();
    return new SystemStatus(config.machineId(), config.serverPort(), config.maxConversations());
  }

  @GetMapping("/models")
  public ModelCatalog models() {
    return modelCatalog.catalog();
  }

  public record SystemStatus(String machineId, Integer serverPort, Integer maxConversations) {}
}
