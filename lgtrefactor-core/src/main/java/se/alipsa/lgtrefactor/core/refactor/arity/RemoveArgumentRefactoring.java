package se.alipsa.lgtrefactor.core.refactor.arity;

import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.Validators;

import java.util.Optional;

/** Removes the argument at a chosen position; a sole argument is removed without asking. */
public final class RemoveArgumentRefactoring extends ArityRefactoring {

  public RemoveArgumentRefactoring() {
    super(RefactorKind.REMOVE_ARGUMENT);
  }

  @Override
  protected int minimumArity() {
    return 1;
  }

  @Override
  protected Optional<ArgumentChange> askChange(Indicator indicator) {
    int arity = indicator.getArity();
    if (arity == 1) return Optional.of(ArgumentChange.remove(1));
    return promptText("Position of the argument to remove from " + indicator + " (1-" + arity + ")",
        "1", Validators.positionBetween(1, arity))
        .map(p -> ArgumentChange.remove(Validators.parseInt(p)));
  }
}
