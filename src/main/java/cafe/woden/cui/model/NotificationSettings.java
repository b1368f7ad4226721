package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Browser notification preferences under {@code interface.notifications}.
 *
 * <p>Legacy keys written by older versions stay in the stored document but are not mapped here.
 */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationSettings(
    Boolean enabled, Boolean showOnSuccess, Boolean showOnError, Boolean showOnStart) {

  public boolean enabledOrFalse() {
    return Boolean.TRUE.equals(enabled);
  }
}
