package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** A variable occurrence inside a clause. */
public final class VariableTarget extends RefactorTarget {
  private final Position position;
  private final String variable;
  private final LineRange clause;

  public VariableTarget(String uri, Position position, String variable, LineRange clause) {
    super(uri);
    this.position = Objects.requireNonNull(position, "position");
    this.variable = Objects.requireNonNull(variable, "variable");
    this.clause = Objects.requireNonNull(clause, "clause");
  }

  public Position getPosition() { return position; }

  public String getVariable() { return variable; }

  public LineRange getClause() { return clause; }

  @Override
  public String toString() {
    return variable + " in " + getUri() + clause;
  }
}
