package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

public class Position implements Comparable<Position> {
  public final int line;   // zero-based line number
  public final int column; // zero-based column offset, UTF-16 code units

  public Position(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public boolean isBefore(Position other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(Position o) {
    return line != o.line ? Integer.compare(line, o.line) : Integer.compare(column, o.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Position that)) return false;
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
