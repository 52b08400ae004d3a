package se.alipsa.lgtrefactor.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.model.RefactorKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/** The registered refactorings, one per kind. */
public final class RefactoringRegistry {

  private static final Logger logger = LogManager.getLogger(RefactoringRegistry.class);

  private final Map<RefactorKind, Refactoring> byKind = new EnumMap<>(RefactorKind.class);
  private final RefactorEnvironment env;

  /** Registry populated from {@code META-INF/services}. */
  public RefactoringRegistry(RefactorEnvironment env) {
    this(env, true);
  }

  public RefactoringRegistry(RefactorEnvironment env, boolean discover) {
    this.env = Objects.requireNonNull(env);
    if (discover) loadViaServiceLoader();
  }

  public synchronized void register(Refactoring refactoring) {
    Objects.requireNonNull(refactoring);
    if (byKind.containsKey(refactoring.kind())) {
      logger.warn("Refactoring {} already registered; ignoring {}", refactoring.kind(), refactoring.getClass().getName());
      return;
    }
    refactoring.configure(env);
    byKind.put(refactoring.kind(), refactoring);
    logger.debug("Registered refactoring {} ({})", refactoring.kind().commandId(), refactoring.getClass().getSimpleName());
  }

  public synchronized Optional<Refactoring> byKind(RefactorKind kind) {
    return Optional.ofNullable(byKind.get(kind));
  }

  /** All refactorings in {@link RefactorKind} order. */
  public synchronized List<Refactoring> all() {
    return List.copyOf(byKind.values());
  }

  private void loadViaServiceLoader() {
    ServiceLoader<Refactoring> sl = ServiceLoader.load(Refactoring.class, RefactoringRegistry.class.getClassLoader());
    for (Refactoring r : sl) register(r);
    logger.info("Loaded {} refactorings", byKind.size());
  }
}
