package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Partial update of the whole settings document.
 *
 * <p>There is no {@code machineId} component: the id is generated once per settings file and is
 * not writable through updates. A {@code models} entry replaces the whole list for that provider.
 */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SettingsPatch(
    String claudeExecutablePath,
    LogLevel logLevel,
    Integer serverPort,
    Integer maxConversations,
    Long conversationTimeout,
    Long healthCheckInterval,
    Map<String, List<ModelInfo>> models,
    @JsonProperty("interface") InterfacePatch interfaceSettings) {

  public static SettingsPatch ofInterface(InterfacePatch interfacePatch) {
    return new SettingsPatch(null, null, null, null, null, null, null, interfacePatch);
  }
}
