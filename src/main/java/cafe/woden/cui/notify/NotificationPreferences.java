package cafe.woden.cui.notify;

import cafe.woden.cui.config.api.SettingsQueryPort;
import cafe.woden.cui.config.api.SettingsStoreException;
import cafe.woden.cui.model.InterfaceSettings;
import cafe.woden.cui.model.NotificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a browser notification should go out, from {@code interface.notifications}.
 *
 * <p>Best-effort: never throws to callers, and answers {@code false} while settings are unavailable.
 */
@Component
public class NotificationPreferences {

  private static final Logger log = LoggerFactory.getLogger(NotificationPreferences.class);

  public enum NotificationKind {
    CONVERSATION_STARTED,
    CONVERSATION_SUCCEEDED,
    CONVERSATION_FAILED,
    PERMISSION_REQUEST
  }

  private final SettingsQueryPort settings;

  public NotificationPreferences(SettingsQueryPort settings) {
    this.settings = settings;
  }

  public boolean enabled() {
    NotificationSettings n = current();
    return n != null && n.enabledOrFalse();
  }

  public boolean shouldNotify(NotificationKind kind) {
    NotificationSettings n = current();
    if (n == null || !n.enabledOrFalse()) return false;
    if (kind == null) return false;

    return switch (kind) {
      case CONVERSATION_STARTED -> Boolean.TRUE.equals(n.showOnStart());
      case CONVERSATION_SUCCEEDED -> Boolean.TRUE.equals(n.showOnSuccess());
      case CONVERSATION_FAILED -> Boolean.TRUE.equals(n.showOnError());
      case PERMISSION_REQUEST -> true;
    };
  }

  private NotificationSettings current() {
    try {
      InterfaceSettings ui = settings.getInterface();
      return ui == null ? null : ui.notifications();
    } catch (SettingsStoreException e) {
      log.debug("[cui] Notification settings unavailable ({})", e.kind());
      return null;
    }
  }
}
