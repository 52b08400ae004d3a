package se.alipsa.lgtrefactor.core.refactor.variable;

import se.alipsa.lgtrefactor.core.model.RefactorKind;

/** Frees the number under the cursor: {@code S1, S2} become {@code S2, S3}. */
public final class IncrementNumberedVariablesRefactoring extends NumberedVariablesRefactoring {

  public IncrementNumberedVariablesRefactoring() {
    super(RefactorKind.INCREMENT_NUMBERED_VARIABLES, 1);
  }
}
