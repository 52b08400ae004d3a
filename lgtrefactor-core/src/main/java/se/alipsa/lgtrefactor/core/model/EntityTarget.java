package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** An entity whose opening directive is under the cursor. */
public final class EntityTarget extends RefactorTarget {
  private final Position position;
  private final EntityKind kind;
  private final EntityIdentifier identifier;

  public EntityTarget(String uri, Position position, EntityKind kind, EntityIdentifier identifier) {
    super(uri);
    this.position = Objects.requireNonNull(position, "position");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.identifier = Objects.requireNonNull(identifier, "identifier");
  }

  public Position getPosition() { return position; }

  public EntityKind getKind() { return kind; }

  public EntityIdentifier getIdentifier() { return identifier; }

  @Override
  public String toString() {
    return kind.keyword() + " " + identifier + " at " + getUri() + "@" + position;
  }
}
