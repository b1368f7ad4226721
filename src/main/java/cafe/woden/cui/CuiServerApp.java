package cafe.woden.cui;

import cafe.woden.cui.config.SettingsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "CUI Server",
    sharedModules = {"model", "util"})
@EnableConfigurationProperties(SettingsProperties.class)
public class CuiServerApp {

  public static void main(String[] args) {
    SpringApplication.run(CuiServerApp.class, args);
  }
}
