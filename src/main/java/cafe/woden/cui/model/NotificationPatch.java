package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jmolecules.ddd.annotation.ValueObject;

/** Partial update of {@code interface.notifications}; {@code null} leaves a field unchanged. */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationPatch(
    Boolean enabled, Boolean showOnSuccess, Boolean showOnError, Boolean showOnStart) {

  public static NotificationPatch ofEnabled(boolean enabled) {
    return new NotificationPatch(enabled, null, null, null);
  }
}
