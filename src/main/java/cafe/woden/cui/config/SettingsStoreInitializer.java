package cafe.woden.cui.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Loads the settings file once the context is up. A failed load stops startup. */
@Component
public class SettingsStoreInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SettingsStoreInitializer.class);

  private final SettingsStore store;

  public SettingsStoreInitializer(SettingsStore store) {
    this.store = store;
  }

  @Override
  public void run(ApplicationArguments args) {
    store.initialize().join();
    log.info("[cui] Settings loaded from '{}' (origin={})", store.settingsFile(), store.lastLoadOrigin());
  }
}
