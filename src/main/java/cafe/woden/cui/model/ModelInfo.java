package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** One selectable model as offered to the UI. */
@ValueObject
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelInfo(String value, String label, String description) {

  public ModelInfo {
    value = Objects.toString(value, "").trim();
    label = Objects.toString(label, "").trim();
    if (label.isEmpty()) label = value;
    description = Objects.toString(description, "");
  }
}
