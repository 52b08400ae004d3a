package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

/**
 * A source location: a document URI plus a range within that document.
 * <p>
 * The URI is typically a {@code file://} URL, but may also be a {@code mem://}
 * or any scheme the host's document provider understands.
 */
public final class Location {
  private final String uri;
  private final Range range;

  public Location(String uri, Range range) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.range = Objects.requireNonNull(range, "range");
  }

  public String getUri() {
    return uri;
  }

  public Range getRange() {
    return range;
  }

  public int getLine() {
    return range.start.line;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Location that)) return false;
    return uri.equals(that.uri) && range.equals(that.range);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri, range);
  }

  @Override
  public String toString() {
    return uri + "@" + range;
  }
}
