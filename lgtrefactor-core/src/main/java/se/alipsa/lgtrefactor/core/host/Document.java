package se.alipsa.lgtrefactor.core.host;

import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;

/** Read-only snapshot of a document's lines, stable for the duration of one refactoring. */
public interface Document {

  String uri();

  int lineCount();

  /** Text of line {@code n} without its line terminator. */
  String lineAt(int n);

  /** Separator used when joining lines, {@code "\n"} unless the source used CRLF. */
  default String lineSeparator() { return "\n"; }

  default String getText() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lineCount(); i++) {
      if (i > 0) sb.append(lineSeparator());
      sb.append(lineAt(i));
    }
    return sb.toString();
  }

  default String getText(Range range) {
    if (range.start.line == range.end.line) {
      String line = lineAt(range.start.line);
      return line.substring(clamp(range.start.column, line), clamp(range.end.column, line));
    }
    StringBuilder sb = new StringBuilder();
    String first = lineAt(range.start.line);
    sb.append(first.substring(clamp(range.start.column, first)));
    for (int i = range.start.line + 1; i < range.end.line; i++) {
      sb.append('\n').append(lineAt(i));
    }
    String last = lineAt(range.end.line);
    sb.append('\n').append(last, 0, clamp(range.end.column, last));
    return sb.toString();
  }

  /** Lines {@code start..end} inclusive joined by {@code '\n'}. */
  default String getLines(int start, int end) {
    StringBuilder sb = new StringBuilder();
    for (int i = start; i <= end; i++) {
      if (i > start) sb.append('\n');
      sb.append(lineAt(i));
    }
    return sb.toString();
  }

  default Position endOfLine(int line) {
    return new Position(line, lineAt(line).length());
  }

  private static int clamp(int column, String line) {
    return Math.max(0, Math.min(column, line.length()));
  }
}
