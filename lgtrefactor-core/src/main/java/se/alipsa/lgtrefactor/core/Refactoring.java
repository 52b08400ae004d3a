package se.alipsa.lgtrefactor.core;

import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;

import java.util.List;

/**
 * One refactoring kind. Implementations are discovered with {@link java.util.ServiceLoader}
 * and must have a public no-arg constructor.
 */
public interface Refactoring {

  RefactorKind kind();

  /** Called once after registration. */
  default void configure(RefactorEnvironment env) {}

  /**
   * Actions this refactoring offers for the cursor ({@code range} empty) or selection. Returns an
   * empty list when the shape under the cursor does not fit; detection never reports errors.
   */
  List<RefactorAction> detect(Document doc, Range range);

  /**
   * Compute the edits, prompting the user where needed, and hand them to the host.
   *
   * @throws RefactorException when a precondition fails or the host rejects the edits
   */
  RefactorResult execute(RefactorAction action) throws RefactorException;
}
