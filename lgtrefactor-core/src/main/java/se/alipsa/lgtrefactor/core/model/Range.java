package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

public class Range {
  public final Position start;
  public final Position end;

  public Range(Position start, Position end) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Range end " + end + " is before start " + start);
    }
  }

  public static Range of(int startLine, int startColumn, int endLine, int endColumn) {
    return new Range(new Position(startLine, startColumn), new Position(endLine, endColumn));
  }

  /** Zero-width range at a position, i.e. a caret. */
  public static Range caret(Position p) {
    return new Range(p, p);
  }

  public boolean isEmpty() {
    return start.equals(end);
  }

  public boolean isSingleLine() {
    return start.line == end.line;
  }

  public boolean contains(Position p) {
    return !p.isBefore(start) && !end.isBefore(p);
  }

  /** True when the two ranges share at least one character; touching ranges do not overlap. */
  public boolean overlaps(Range other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Range that)) return false;
    return start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + "-" + end + "]";
  }
}
