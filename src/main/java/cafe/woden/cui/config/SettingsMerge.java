package cafe.woden.cui.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Deep merge of settings trees.
 *
 * <p>Objects present on both sides merge key by key. Any other override value (scalar, array, or
 * an object over a scalar) replaces the base value wholly. Keys only the override has are copied
 * as-is. A JSON {@code null} never clears a key the base already has.
 */
public final class SettingsMerge {

  private SettingsMerge() {}

  /** Returns a new tree; neither argument is modified. */
  public static ObjectNode merge(ObjectNode base, JsonNode override) {
    ObjectNode out = base.deepCopy();
    if (override instanceof ObjectNode o) {
      mergeInto(out, o);
    }
    return out;
  }

  private static void mergeInto(ObjectNode target, ObjectNode override) {
    Iterator<Map.Entry<String, JsonNode>> it = override.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String key = e.getKey();
      JsonNode value = e.getValue();

      if (value == null || value.isMissingNode()) continue;
      if (value.isNull() && target.has(key)) continue;

      JsonNode existing = target.get(key);
      if (existing instanceof ObjectNode existingObj && value instanceof ObjectNode valueObj) {
        mergeInto(existingObj, valueObj);
      } else {
        target.set(key, value.deepCopy());
      }
    }
  }
}
