package se.alipsa.lgtrefactor.core.host;

/** Sink for user-visible messages (e.g., status bar, UI, test capture). */
public interface Notifier {
  void info(String message);

  void error(String message);

  default void warn(String message) { info(message); }

  Notifier NO_OP = new Notifier() {
    @Override public void info(String message) {}
    @Override public void error(String message) {}
  };
}
