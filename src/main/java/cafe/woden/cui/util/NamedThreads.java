package cafe.woden.cui.util;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/** Shared helpers for creating app-owned executors on named daemon threads. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    return new ThreadFactoryBuilder()
        .setNameFormat(normalize(baseName) + "-%d")
        .setDaemon(true)
        .build();
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return Executors.newSingleThreadExecutor(namedFactory(baseName));
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "cui-worker" : s;
  }
}
