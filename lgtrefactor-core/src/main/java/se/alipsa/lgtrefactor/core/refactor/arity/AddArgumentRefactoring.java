package se.alipsa.lgtrefactor.core.refactor.arity;

import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.Validators;

import java.util.Optional;

/** Adds an argument to a predicate or non-terminal at a chosen position. */
public final class AddArgumentRefactoring extends ArityRefactoring {

  public AddArgumentRefactoring() {
    super(RefactorKind.ADD_ARGUMENT);
  }

  @Override
  protected int minimumArity() {
    return 0;
  }

  @Override
  protected Optional<ArgumentChange> askChange(Indicator indicator) {
    Optional<String> name = promptText("Name of the new argument of " + indicator, "NewArg", Validators.variableName());
    if (name.isEmpty()) return Optional.empty();
    int arity = indicator.getArity();
    if (arity == 0) return Optional.of(ArgumentChange.insert(1, name.get().trim()));
    Optional<String> position = promptText("Position of the new argument (1-" + (arity + 1) + ")",
        String.valueOf(arity + 1), Validators.positionBetween(1, arity + 1));
    return position.map(p -> ArgumentChange.insert(Validators.parseInt(p), name.get().trim()));
  }
}
