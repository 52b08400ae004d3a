package se.alipsa.lgtrefactor.core.refactor.arity;

import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.RefactorKind;

import java.util.Optional;

/** Permutes the arguments. With two arguments the only other order is used without asking. */
public final class ReorderArgumentsRefactoring extends ArityRefactoring {

  public ReorderArgumentsRefactoring() {
    super(RefactorKind.REORDER_ARGUMENTS);
  }

  @Override
  protected int minimumArity() {
    return 2;
  }

  @Override
  protected Optional<ArgumentChange> askChange(Indicator indicator) {
    return askPermutation(indicator.getArity(), indicator.toString()).map(ArgumentChange::reorder);
  }
}
