package se.alipsa.lgtrefactor.core.model;

/**
 * Inclusive span of whole lines forming one term. A range that is not {@code terminated}
 * ran to end of file without finding the closing period.
 */
public final class LineRange {
  private final int start;
  private final int end;
  private final boolean terminated;

  public LineRange(int start, int end, boolean terminated) {
    if (end < start) throw new IllegalArgumentException("end " + end + " < start " + start);
    this.start = start;
    this.end = end;
    this.terminated = terminated;
  }

  public int getStart() { return start; }
  public int getEnd() { return end; }
  public boolean isTerminated() { return terminated; }
  public int lineCount() { return end - start + 1; }
  public boolean contains(int line) { return line >= start && line <= end; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LineRange that)) return false;
    return start == that.start && end == that.end && terminated == that.terminated;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * start + end) + (terminated ? 1 : 0);
  }

  @Override
  public String toString() {
    return "{" + start + ".." + end + (terminated ? "" : ", unterminated") + "}";
  }
}
