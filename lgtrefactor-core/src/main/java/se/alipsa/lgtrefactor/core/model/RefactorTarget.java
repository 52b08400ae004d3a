package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/**
 * The detector's output for one offered refactoring: what was found under the cursor or
 * selection. Each refactoring kind consumes one concrete subclass.
 */
public abstract class RefactorTarget {
  private final String uri;

  protected RefactorTarget(String uri) {
    this.uri = Objects.requireNonNull(uri, "uri");
  }

  public String getUri() {
    return uri;
  }
}
