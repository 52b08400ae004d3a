package se.alipsa.lgtrefactor.core.model;

public enum TermType {
  ENTITY_DIRECTIVE,
  PREDICATE_DIRECTIVE,
  PREDICATE_RULE,
  NON_TERMINAL_RULE,
  PREDICATE_FACT;

  public boolean isDirective() {
    return this == ENTITY_DIRECTIVE || this == PREDICATE_DIRECTIVE;
  }

  public boolean isClause() {
    return !isDirective();
  }
}
