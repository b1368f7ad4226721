package cafe.woden.cui.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import cafe.woden.cui.CuiServerApp;
import cafe.woden.cui.config.SettingsStore;
import cafe.woden.cui.config.api.SettingsCommandPort;
import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.config.api.SettingsStoreException;
import cafe.woden.cui.models.ModelCatalogService;
import cafe.woden.cui.notify.NotificationPreferences;
import cafe.woden.cui.web.ConfigController;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;
import org.springframework.modulith.core.NamedInterface;

class SpringModulithStructureTest {

  private static final ApplicationModules MODULES = ApplicationModules.of(CuiServerApp.class);

  @Test
  void modulesVerify() {
    assertThatCode(MODULES::verify).doesNotThrowAnyException();
  }

  @Test
  void typesResolveToExpectedModules() {
    ApplicationModule config = moduleFor(SettingsStore.class);
    assertThat(config.getBasePackage().getName()).isEqualTo("cafe.woden.cui.config");
    assertThat(moduleFor(SettingsQueryPort.class)).isEqualTo(config);

    assertThat(moduleFor(NotificationPreferences.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.cui.notify");
    assertThat(moduleFor(ModelCatalogService.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.cui.models");
    assertThat(moduleFor(ConfigController.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.cui.web");
  }

  @Test
  void configExposesPortsThroughApiInterface() {
    NamedInterface api =
        moduleFor(SettingsStore.class)
            .getNamedInterfaces()
            .getByName("api")
            .orElseThrow(() -> new AssertionError("Missing config::api named interface."));

    for (Class<?> type :
        new Class<?>[] {
          SettingsQueryPort.class, SettingsCommandPort.class, SettingsStoreException.class
        }) {
      assertThat(api.contains(type))
          .as("config::api should contain " + type.getSimpleName())
          .isTrue();
    }
  }

  private static ApplicationModule moduleFor(Class<?> type) {
    return MODULES
        .getModuleByType(type)
        .orElseThrow(() -> new AssertionError("No module discovered for type " + type.getName()));
  }
}
