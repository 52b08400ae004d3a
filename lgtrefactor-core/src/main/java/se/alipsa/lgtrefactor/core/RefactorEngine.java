package se.alipsa.lgtrefactor.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Default implementation of RefactorFacade; the boundary where every failure is caught. */
public final class RefactorEngine implements RefactorFacade {

  private static final Logger logger = LogManager.getLogger(RefactorEngine.class);

  private final RefactoringRegistry registry;
  private final RefactorEnvironment env;

  public RefactorEngine(RefactoringRegistry registry, RefactorEnvironment env) {
    this.registry = Objects.requireNonNull(registry);
    this.env = Objects.requireNonNull(env);
  }

  @Override
  public List<RefactorAction> availableRefactorings(String uri, Range range) {
    Document doc;
    try {
      doc = env.documents().open(uri);
    } catch (IOException e) {
      logger.warn("Cannot open {} for refactoring detection", uri, e);
      return List.of();
    }
    if (range.start.line >= doc.lineCount()) return List.of();
    List<RefactorAction> actions = new ArrayList<>();
    for (Refactoring r : registry.all()) {
      try {
        actions.addAll(r.detect(doc, range));
      } catch (RuntimeException e) {
        logger.warn("Detection of {} failed at {}@{}", r.kind(), uri, range, e);
      }
    }
    logger.debug("{} refactorings available at {}@{}", actions.size(), uri, range);
    return actions;
  }

  @Override
  public RefactorResult execute(RefactorAction action) {
    Optional<Refactoring> refactoring = registry.byKind(action.getKind());
    if (refactoring.isEmpty()) {
      String msg = "No refactoring registered for " + action.getCommandId();
      logger.warn(msg);
      return RefactorResult.notApplicable(msg);
    }
    RefactorResult result;
    try {
      result = refactoring.get().execute(action);
    } catch (RefactorException e) {
      logger.warn("{} failed ({}): {}", action.getCommandId(), e.getReason(), e.getMessage());
      env.notifier().error(e.getMessage());
      return RefactorResult.failed(e.getMessage());
    } catch (RuntimeException e) {
      logger.error("Unexpected failure in {}", action, e);
      String msg = action.getTitle() + " failed: " + e.getMessage();
      env.notifier().error(msg);
      return RefactorResult.failed(msg);
    }
    switch (result.getStatus()) {
      case APPLIED:
        logger.info("{}: {}", action.getCommandId(), result.getMessage());
        env.notifier().info(result.getMessage());
        break;
      case NOT_APPLICABLE:
        env.notifier().warn(result.getMessage());
        break;
      default:
        logger.debug("{}: {}", action.getCommandId(), result);
    }
    return result;
  }
}
