package se.alipsa.lgtrefactor.core.refactor.variable;

import se.alipsa.lgtrefactor.core.model.RefactorKind;

/** Closes the gap below the number under the cursor: {@code S2, S3} become {@code S1, S2}. */
public final class DecrementNumberedVariablesRefactoring extends NumberedVariablesRefactoring {

  public DecrementNumberedVariablesRefactoring() {
    super(RefactorKind.DECREMENT_NUMBERED_VARIABLES, -1);
  }
}
