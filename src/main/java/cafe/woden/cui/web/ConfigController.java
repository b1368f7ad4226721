package cafe.woden.cui.web;

import cafe.woden.cui.config.api.SettingsCommandPort;
import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.model.InterfacePatch;
import cafe.woden.cui.model.InterfaceSettings;
import cafe.woden.cui.model.SettingsPatch;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/config")
public class ConfigController {

  private static final Logger log = LoggerFactory.getLogger(ConfigController.class);

  private final SettingsQueryPort settings;
  private final SettingsCommandPort commands;

  public ConfigController(SettingsQueryPort settings, SettingsCommandPort commands) {
    this.settings = settings;
    this.commands = commands;
  }

  @GetMapping
  public JsonNode getConfig() {
    return settings.getConfigJson();
  }

  @PutMapping
  public JsonNode updateConfig(@RequestBody SettingsPatch patch) {
    log.debug("[cui] Update config request");
    return await(commands.updateConfigJson(patch));
  }

  @GetMapping("/interface")
  public InterfaceSettings getInterface() {
    return settings.getInterface();
  }

  @PutMapping("/interface")
  public InterfaceSettings updateInterface(@RequestBody InterfacePatch patch) {
    log.debug("[cui] Update interface request");
    return await(commands.updateInterface(patch));
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) throw re;
      throw e;
    }
  }
}
