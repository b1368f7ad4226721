package cafe.woden.cui.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Location and load behavior of the settings file. */
@ConfigurationProperties(prefix = "cui.settings")
public record SettingsProperties(
    /** Settings file path. Default: {@code ~/.cui/config.json}. */
    String file,

    /**
     * If true (default), a settings file that is not a JSON object is copied aside before the
     * defaults are written over it.
     */
    Boolean backupMalformed
) {

  public SettingsProperties {
    file = Objects.toString(file, "").trim();
    if (file.isEmpty()) file = defaultFile().toString();
    if (backupMalformed == null) backupMalformed = Boolean.TRUE;
  }

  public Path path() {
    return Paths.get(file);
  }

  public static Path defaultFile() {
    return Paths.get(System.getProperty("user.home"), ".cui", "config.json");
  }
}
