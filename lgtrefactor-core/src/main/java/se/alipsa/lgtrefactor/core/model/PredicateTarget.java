package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** A predicate or non-terminal found under the cursor. */
public final class PredicateTarget extends RefactorTarget {
  private final Position position;
  private final Indicator indicator;

  public PredicateTarget(String uri, Position position, Indicator indicator) {
    super(uri);
    this.position = Objects.requireNonNull(position, "position");
    this.indicator = Objects.requireNonNull(indicator, "indicator");
  }

  public Position getPosition() { return position; }

  public Indicator getIndicator() { return indicator; }

  @Override
  public String toString() {
    return indicator + " at " + getUri() + "@" + position;
  }
}
