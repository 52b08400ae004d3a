package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** A numeric literal inside a rule body. */
public final class NumberTarget extends RefactorTarget {
  private final Range literalRange;
  private final String literal;
  private final LineRange clause;

  public NumberTarget(String uri, Range literalRange, String literal, LineRange clause) {
    super(uri);
    this.literalRange = Objects.requireNonNull(literalRange, "literalRange");
    this.literal = Objects.requireNonNull(literal, "literal");
    this.clause = Objects.requireNonNull(clause, "clause");
  }

  public Range getLiteralRange() { return literalRange; }

  public String getLiteral() { return literal; }

  public LineRange getClause() { return clause; }

  @Override
  public String toString() {
    return literal + " at " + getUri() + "@" + literalRange;
  }
}
