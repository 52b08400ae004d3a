package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** A non-empty selection. */
public final class SelectionTarget extends RefactorTarget {
  private final Range selection;

  public SelectionTarget(String uri, Range selection) {
    super(uri);
    this.selection = Objects.requireNonNull(selection, "selection");
  }

  public Range getSelection() { return selection; }

  @Override
  public String toString() {
    return getUri() + "@" + selection;
  }
}
