package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Typed, immutable view of the settings file.
 *
 * <p>Fields this version does not know about are kept in the stored document but are not part of
 * this view. A known field holding a value of the wrong type reads as {@code null} here.
 */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SettingsDocument(
    String claudeExecutablePath,
    LogLevel logLevel,
    Integer serverPort,
    Integer maxConversations,
    /** Milliseconds. */
    Long conversationTimeout,
    /** Milliseconds. */
    Long healthCheckInterval,
    String machineId,
    /** Provider name to ordered model list. Optional. */
    Map<String, List<ModelInfo>> models,
    @JsonProperty("interface") InterfaceSettings interfaceSettings) {

  public SettingsDocument {
    models = immutableModels(models);
  }

  private static Map<String, List<ModelInfo>> immutableModels(Map<String, List<ModelInfo>> raw) {
    if (raw == null) return null;
    Map<String, List<ModelInfo>> out = new LinkedHashMap<>();
    raw.forEach(
        (provider, list) -> {
          if (provider == null || list == null) return;
          List<ModelInfo> copy = new ArrayList<>();
          for (ModelInfo m : list) {
            if (m != null) copy.add(m);
          }
          out.put(provider, List.copyOf(copy));
        });
    return Collections.unmodifiableMap(out);
  }

  public List<ModelInfo> modelsFor(String provider) {
    if (models == null) return List.of();
    return Objects.requireNonNullElse(models.get(provider), List.of());
  }
}
