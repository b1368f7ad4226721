package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;

/** Web UI color scheme preference. */
public enum ColorScheme {
  AUTO,
  LIGHT,
  DARK,
  SYSTEM;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ColorScheme fromWire(String raw) {
    String s = Objects.toString(raw, "").trim().toUpperCase(Locale.ROOT);
    for (ColorScheme scheme : values()) {
      if (scheme.name().equals(s)) return scheme;
    }
    return null;
  }
}
