package se.alipsa.lgtrefactor.core.refactor.entity;

import se.alipsa.lgtrefactor.core.model.EntityIdentifier;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.arity.ArgumentChange;

import java.util.Optional;

/** Permutes entity parameters; entities with fewer than two parameters are left alone. */
public final class ReorderParametersRefactoring extends ParameterRefactoring {

  public ReorderParametersRefactoring() {
    super(RefactorKind.REORDER_PARAMETERS);
  }

  @Override
  protected int minimumArity() {
    return 2;
  }

  @Override
  protected Optional<ArgumentChange> askChange(EntityIdentifier identifier) {
    return askPermutation(identifier.arity(), identifier.indicator()).map(ArgumentChange::reorder);
  }
}
