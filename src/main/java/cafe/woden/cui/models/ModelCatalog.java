package cafe.woden.cui.models;

import cafe.woden.cui.model.ModelInfo;
import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/** Models offered to the UI; {@code fromConfig} is false when the built-in list was used. */
@ValueObject
public record ModelCatalog(List<ModelInfo> models, String defaultModel, boolean fromConfig) {

  public ModelCatalog {
    models = models == null ? List.of() : List.copyOf(models);
  }
}
