package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** One entry of the contextual action menu: title, command id and the typed detector output. */
public final class RefactorAction {
  private final RefactorKind kind;
  private final RefactorTarget target;

  public RefactorAction(RefactorKind kind, RefactorTarget target) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.target = Objects.requireNonNull(target, "target");
  }

  public RefactorKind getKind() { return kind; }

  public String getTitle() { return kind.title(); }

  public String getCommandId() { return kind.commandId(); }

  public RefactorTarget getTarget() { return target; }

  public <T extends RefactorTarget> T targetAs(Class<T> type) {
    if (!type.isInstance(target)) {
      throw new IllegalArgumentException(kind + " expects a " + type.getSimpleName()
          + " but got " + target.getClass().getSimpleName());
    }
    return type.cast(target);
  }

  @Override
  public String toString() {
    return getCommandId() + "(" + target + ")";
  }
}
