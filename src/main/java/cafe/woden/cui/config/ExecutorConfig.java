package cafe.woden.cui.config;

import cafe.woden.cui.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>The settings executor is single-threaded: every load and update of the settings file runs
 * on it, in submission order.
 */
@Configuration
public class ExecutorConfig {
  public static final String SETTINGS_PERSIST_EXECUTOR = "settingsPersistExecutor";

  @Bean(name = SETTINGS_PERSIST_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService settingsPersistExecutor() {
    return NamedThreads.newSingleThreadExecutor("cui-settings-persist");
  }
}
