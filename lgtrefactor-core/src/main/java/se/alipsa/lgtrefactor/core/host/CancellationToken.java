package se.alipsa.lgtrefactor.core.host;

/** Cooperative cancellation, polled at a few checkpoints only. */
@FunctionalInterface
public interface CancellationToken {
  boolean isCancellationRequested();

  CancellationToken NONE = () -> false;
}
