package se.alipsa.lgtrefactor.core.refactor.entity;

import se.alipsa.lgtrefactor.core.model.EntityIdentifier;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.Validators;
import se.alipsa.lgtrefactor.core.refactor.arity.ArgumentChange;

import java.util.Optional;

/** Adds a parameter to an entity, making it parametric if it was not. */
public final class AddParameterRefactoring extends ParameterRefactoring {

  public AddParameterRefactoring() {
    super(RefactorKind.ADD_PARAMETER);
  }

  @Override
  protected int minimumArity() {
    return 0;
  }

  @Override
  protected Optional<ArgumentChange> askChange(EntityIdentifier identifier) {
    Optional<String> name = promptText("Name of the new parameter of " + identifier.getName(), "_Param_",
        Validators.variableName());
    if (name.isEmpty()) return Optional.empty();
    String parName = name.get().trim();
    int arity = identifier.arity();
    if (arity == 0) return Optional.of(ArgumentChange.insert(1, parName));
    Optional<String> position = promptText("Position of the new parameter (1-" + (arity + 1) + ")",
        String.valueOf(arity + 1), Validators.positionBetween(1, arity + 1));
    return position.map(p -> ArgumentChange.insert(Validators.parseInt(p), parName));
  }
}
