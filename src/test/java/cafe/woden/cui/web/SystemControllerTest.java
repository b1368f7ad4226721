package cafe.woden.cui.web;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.model.ModelInfo;
import cafe.woden.cui.model.SettingsDocument;
import cafe.woden.cui.models.ModelCatalog;
import cafe.woden.cui.models.ModelCatalogService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SystemController.class)
class SystemControllerTest {

  @Autowired MockMvc mvc;

  @MockitoBean SettingsQueryPort settings;

  @MockitoBean ModelCatalogService modelCatalog;

  @Test
  void healthIsOk() throws Exception {
    mvc.perform(get("/api/system/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Test
  void statusReportsMachineId() throws Exception {
    when(settings.getConfig())
        .thenReturn(new SettingsDocument("claude", null, 3001, 10, null, null, "box-12345678", null, null));

    mvc.perform(get("/api/system/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.machineId").value("box-12345678"))
        .andExpect(jsonPath("$.serverPort").value(3001));
  }

  @Test
  void modelsComeFromCatalog() throws Exception {
    when(modelCatalog.catalog())
        .thenReturn(new ModelCatalog(List.of(new ModelInfo("opus", "Opus", "big")), "opus", true));

    mvc.perform(get("/api/system/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.defaultModel").value("opus"))
        .andExpect(jsonPath("$.fromConfig").value(true))
        .andExpect(jsonPath("$.models[0].label").value("Opus"));
  }
}
