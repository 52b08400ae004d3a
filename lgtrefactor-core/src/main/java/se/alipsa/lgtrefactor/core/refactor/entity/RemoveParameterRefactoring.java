package se.alipsa.lgtrefactor.core.refactor.entity;

import se.alipsa.lgtrefactor.core.model.EntityIdentifier;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.Validators;
import se.alipsa.lgtrefactor.core.refactor.arity.ArgumentChange;

import java.util.Optional;

public final class RemoveParameterRefactoring extends ParameterRefactoring {

  public RemoveParameterRefactoring() {
    super(RefactorKind.REMOVE_PARAMETER);
  }

  @Override
  protected int minimumArity() {
    return 1;
  }

  @Override
  protected Optional<ArgumentChange> askChange(EntityIdentifier identifier) {
    int arity = identifier.arity();
    if (arity == 1) return Optional.of(ArgumentChange.remove(1));
    return promptText("Position of the parameter to remove from " + identifier.getName() + " (1-" + arity + ")",
        "1", Validators.positionBetween(1, arity))
        .map(p -> ArgumentChange.remove(Validators.parseInt(p)));
  }
}
