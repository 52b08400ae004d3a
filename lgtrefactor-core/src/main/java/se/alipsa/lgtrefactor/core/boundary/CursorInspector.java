package se.alipsa.lgtrefactor.core.boundary;

import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** What sits under the cursor: an indicator, a callable, a variable or a plain word. */
public final class CursorInspector {

  private static final Pattern INDICATOR_TOKEN = Pattern.compile("(?<![A-Za-z0-9_])([a-z][A-Za-z0-9_]*)(//?)(\\d+)");

  private CursorInspector() {}

  /** True when the column falls in a comment or quoted text. */
  public static boolean inCommentOrQuote(String line, int column) {
    for (int i = 0; i < line.length() && i <= column; i++) {
      int r = TermScanner.regionEnd(line, i);
      if (r >= 0) {
        if (column >= i && column <= r) return true;
        i = r;
      }
    }
    return false;
  }

  /** {@code name/N} or {@code name//N} text covering the column. */
  public static Optional<Indicator> indicatorAt(String line, int column) {
    Matcher m = INDICATOR_TOKEN.matcher(line);
    while (m.find()) {
      if (column >= m.start() && column <= m.end() && !inCommentOrQuote(line, m.start())) {
        return Optional.of(new Indicator(m.group(1), Integer.parseInt(m.group(3)), m.group(2).length() == 2));
      }
    }
    return Optional.empty();
  }

  /** Bounds {@code [start, end)} of the identifier covering the column, or empty. */
  public static Optional<int[]> wordAt(String line, int column) {
    if (line.isEmpty()) return Optional.empty();
    int c = Math.min(column, line.length() - 1);
    if (!TermScanner.isAlnum(line.charAt(c)) && c > 0 && TermScanner.isAlnum(line.charAt(c - 1))) c--;
    if (!TermScanner.isAlnum(line.charAt(c))) return Optional.empty();
    int start = c;
    while (start > 0 && TermScanner.isAlnum(line.charAt(start - 1))) start--;
    int end = c;
    while (end < line.length() && TermScanner.isAlnum(line.charAt(end))) end++;
    return Optional.of(new int[] {start, end});
  }

  public static Optional<String> variableAt(String line, int column) {
    if (inCommentOrQuote(line, column)) return Optional.empty();
    return wordAt(line, column)
        .map(b -> line.substring(b[0], b[1]))
        .filter(VariableScanner::isValidVariableName);
  }

  /**
   * The callable whose name is under the cursor, with arity counted from its argument list
   * (which may continue on following lines). A name followed by {@code ::} is a message
   * receiver, and the name right after {@code :-} is a directive, so neither is a call.
   */
  public static Optional<Indicator> callAt(Document doc, Position pos) {
    String line = doc.lineAt(pos.line);
    if (inCommentOrQuote(line, pos.column)) return Optional.empty();
    Optional<int[]> bounds = wordAt(line, pos.column);
    if (bounds.isEmpty()) return Optional.empty();
    int start = bounds.get()[0];
    int end = bounds.get()[1];
    if (!Character.isLowerCase(line.charAt(start))) return Optional.empty();
    String name = line.substring(start, end);
    if (line.substring(0, start).stripTrailing().endsWith(":-") && Directives.isDirective(line.substring(0, start) + " ")) {
      return Optional.empty();
    }
    if (TermScanner.startsWith(line, end, "::")) return Optional.empty();
    if (end >= line.length() || line.charAt(end) != '(') {
      return Optional.of(Indicator.predicate(name, 0));
    }
    LineRange term = TermBoundaries.enclosingTerm(doc, pos.line).orElse(new LineRange(pos.line, pos.line, false));
    String rest = line.substring(start);
    if (term.getEnd() > pos.line) rest = rest + "\n" + doc.getLines(pos.line + 1, term.getEnd());
    int open = end - start;
    int close = TermScanner.findMatchingClose(rest, open, '(', ')');
    if (close < 0) return Optional.empty();
    return Optional.of(Indicator.predicate(name, ArgumentList.parse(rest.substring(open + 1, close)).size()));
  }
}
