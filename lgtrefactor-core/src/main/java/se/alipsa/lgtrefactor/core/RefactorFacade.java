package se.alipsa.lgtrefactor.core;

import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;

import java.util.List;

/** Host-facing API: populate the action menu, then run the chosen action. */
public interface RefactorFacade {

  /** Refactorings available at a cursor (empty range) or selection, in menu order. */
  List<RefactorAction> availableRefactorings(String uri, Range range);

  /** Run an action. Never throws; failures are reported through the result and the notifier. */
  RefactorResult execute(RefactorAction action);
}
