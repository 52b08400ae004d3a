package se.alipsa.lgtrefactor.core.boundary;

import se.alipsa.lgtrefactor.core.model.EntityIdentifier;
import se.alipsa.lgtrefactor.core.model.EntityKind;
import se.alipsa.lgtrefactor.core.model.LineRange;

import java.util.Objects;

/** An entity's opening directive and the line of its closing directive. */
public final class EntityBlock {
  private final EntityKind kind;
  private final EntityIdentifier identifier;
  private final LineRange opening;
  private final int endLine;

  EntityBlock(EntityKind kind, EntityIdentifier identifier, LineRange opening, int endLine) {
    this.kind = Objects.requireNonNull(kind);
    this.identifier = Objects.requireNonNull(identifier);
    this.opening = Objects.requireNonNull(opening);
    this.endLine = endLine;
  }

  public EntityKind getKind() { return kind; }

  public EntityIdentifier getIdentifier() { return identifier; }

  public LineRange getOpening() { return opening; }

  /** Line of the {@code end_*} directive, or -1 when the entity is not closed. */
  public int getEndLine() { return endLine; }

  public boolean isClosed() { return endLine >= 0; }

  /** True when {@code line} lies strictly between the opening and closing directives. */
  public boolean containsInBody(int line) {
    return line > opening.getEnd() && (endLine < 0 || line < endLine);
  }

  @Override
  public String toString() {
    return kind.keyword() + "(" + identifier + ") " + opening + ".." + endLine;
  }
}
