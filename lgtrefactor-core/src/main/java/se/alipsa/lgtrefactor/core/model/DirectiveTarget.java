package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** A list-valued directive such as {@code uses/2} or {@code public/1}. */
public final class DirectiveTarget extends RefactorTarget {
  private final LineRange directive;
  private final String directiveName;

  public DirectiveTarget(String uri, LineRange directive, String directiveName) {
    super(uri);
    this.directive = Objects.requireNonNull(directive, "directive");
    this.directiveName = Objects.requireNonNull(directiveName, "directiveName");
  }

  public LineRange getDirective() { return directive; }

  public String getDirectiveName() { return directiveName; }

  @Override
  public String toString() {
    return directiveName + " directive " + getUri() + directive;
  }
}
