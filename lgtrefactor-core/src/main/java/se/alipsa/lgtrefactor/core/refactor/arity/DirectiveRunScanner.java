package se.alipsa.lgtrefactor.core.refactor.arity;

import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Walks the run of directives that directly follows a line. Blank and comment lines are
 * skipped; the run ends at the first non-directive, unterminated or rejected directive.
 */
public final class DirectiveRunScanner {

  /** Callback for each accepted directive; return {@code false} to stop early. */
  @FunctionalInterface
  public interface Visitor {
    boolean visit(LineRange range, String text);
  }

  private DirectiveRunScanner() {}

  public static List<LineRange> scan(Document doc, int fromLine, Predicate<String> accept, Visitor visitor) {
    List<LineRange> visited = new ArrayList<>();
    int ln = fromLine;
    while (ln < doc.lineCount()) {
      String line = doc.lineAt(ln);
      if (TermScanner.isCommentOrBlank(line)) {
        ln++;
        continue;
      }
      if (!Directives.isDirective(line)) break;
      LineRange range = TermBoundaries.getDirectiveRange(doc, ln);
      if (!range.isTerminated()) break;
      String text = TermBoundaries.termText(doc, range);
      if (!accept.test(text)) break;
      visited.add(range);
      if (!visitor.visit(range, text)) break;
      ln = range.getEnd() + 1;
    }
    return visited;
  }

  /** The accepted run without a callback. */
  public static List<LineRange> collect(Document doc, int fromLine, Predicate<String> accept) {
    return scan(doc, fromLine, accept, (r, t) -> true);
  }
}
