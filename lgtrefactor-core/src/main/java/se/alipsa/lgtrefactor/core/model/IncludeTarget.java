package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/** An {@code include/1} directive and the file argument as written. */
public final class IncludeTarget extends RefactorTarget {
  private final LineRange directive;
  private final String fileSpec;

  public IncludeTarget(String uri, LineRange directive, String fileSpec) {
    super(uri);
    this.directive = Objects.requireNonNull(directive, "directive");
    this.fileSpec = Objects.requireNonNull(fileSpec, "fileSpec");
  }

  public LineRange getDirective() { return directive; }

  public String getFileSpec() { return fileSpec; }

  @Override
  public String toString() {
    return "include(" + fileSpec + ") at " + getUri() + directive;
  }
}
