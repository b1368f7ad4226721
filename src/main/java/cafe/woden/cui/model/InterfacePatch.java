package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Partial update of the {@code interface} section.
 *
 * <p>A {@code null} component is absent. A non-null {@link NotificationPatch} with every field
 * {@code null} is present but empty and changes nothing.
 */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InterfacePatch(
    ColorScheme colorScheme, String language, NotificationPatch notifications) {

  public static InterfacePatch ofColorScheme(ColorScheme colorScheme) {
    return new InterfacePatch(colorScheme, null, null);
  }

  public static InterfacePatch ofNotifications(NotificationPatch notifications) {
    return new InterfacePatch(null, null, notifications);
  }
}
