package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jmolecules.ddd.annotation.ValueObject;

/** User-facing preferences stored under the {@code interface} key. */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InterfaceSettings(
    ColorScheme colorScheme,
    /** ISO-639-1 language code. */
    String language,
    NotificationSettings notifications) {}
