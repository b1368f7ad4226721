package cafe.woden.cui.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;

/** Server log verbosity as stored in the settings file. */
public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns {@code null} for unknown values so a hand-edited file never breaks reads. */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static LogLevel fromWire(String raw) {
    String s = Objects.toString(raw, "").trim().toUpperCase(Locale.ROOT);
    for (LogLevel level : values()) {
      if (level.name().equals(s)) return level;
    }
    return null;
  }
}
