package cafe.woden.cui.config;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Canonical default settings document; the baseline every loaded file is merged onto.
 *
 * <p>Each call builds a new tree, so callers may mutate what they get back. {@code machineId} has
 * no fixed default: the loader generates one when the file has none.
 */
public final class SettingsDefaults {

  public static final String CLAUDE_EXECUTABLE_PATH = "claude";
  public static final String LOG_LEVEL = "info";
  public static final int SERVER_PORT = 3001;
  public static final int MAX_CONVERSATIONS = 10;
  public static final int CONVERSATION_TIMEOUT_MS = 3_600_000;
  public static final int HEALTH_CHECK_INTERVAL_MS = 30_000;

  public static final String COLOR_SCHEME = "auto";
  public static final String LANGUAGE = "en";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private SettingsDefaults() {}

  public static ObjectNode newDocument() {
    ObjectNode doc = NODES.objectNode();
    doc.put("claudeExecutablePath", CLAUDE_EXECUTABLE_PATH);
    doc.put("logLevel", LOG_LEVEL);
    doc.put("serverPort", SERVER_PORT);
    doc.put("maxConversations", MAX_CONVERSATIONS);
    doc.put("conversationTimeout", CONVERSATION_TIMEOUT_MS);
    doc.put("healthCheckInterval", HEALTH_CHECK_INTERVAL_MS);
    doc.set("interface", newInterfaceSection());
    return doc;
  }

  public static ObjectNode newInterfaceSection() {
    ObjectNode ui = NODES.objectNode();
    ui.put("colorScheme", COLOR_SCHEME);
    ui.put("language", LANGUAGE);
    ui.set("notifications", newNotificationSection());
    return ui;
  }

  public static ObjectNode newNotificationSection() {
    ObjectNode n = NODES.objectNode();
    n.put("enabled", true);
    n.put("showOnSuccess", false);
    n.put("showOnError", true);
    n.put("showOnStart", true);
    return n;
  }
}
