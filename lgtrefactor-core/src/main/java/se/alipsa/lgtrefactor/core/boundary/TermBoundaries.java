package se.alipsa.lgtrefactor.core.boundary;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.Optional;

/**
 * Line level boundaries of directives, clauses and terms.
 * <p>
 * Ranges are found by a forward character scan that tracks bracket depth and skips quotes
 * and comments; the terminator is a period at depth zero that is not part of a symbol atom
 * or a float. A term with no terminator before end of file yields an unterminated range
 * ending at the last line.
 */
public final class TermBoundaries {

  private TermBoundaries() {}

  public static LineRange getDirectiveRange(Document doc, int startLine) {
    return scanToTerminator(doc, startLine);
  }

  public static LineRange getClauseRange(Document doc, int startLine) {
    return scanToTerminator(doc, startLine);
  }

  /**
   * Start line of the term containing {@code line}: the first code line after the previous
   * line that ends a term. Returns {@code null} for blank and comment lines.
   */
  public static @Nullable Integer findTermStart(Document doc, int line) {
    if (line < 0 || line >= doc.lineCount()) return null;
    if (TermScanner.isCommentOrBlank(doc.lineAt(line))) return null;
    int p = line - 1;
    while (p >= 0) {
      String text = doc.lineAt(p);
      if (!TermScanner.isCommentOrBlank(text) && TermScanner.endsWithTerminator(text)) break;
      p--;
    }
    int start = p + 1;
    while (start < line && TermScanner.isCommentOrBlank(doc.lineAt(start))) start++;
    LineRange range = scanToTerminator(doc, start);
    // a terminator hidden mid-line between start and line means line starts its own term
    return range.getEnd() >= line ? start : line;
  }

  /** Range of the term containing {@code line}, if the line is code. */
  public static Optional<LineRange> enclosingTerm(Document doc, int line) {
    Integer start = findTermStart(doc, line);
    if (start == null) return Optional.empty();
    return Optional.of(scanToTerminator(doc, start));
  }

  public static String termText(Document doc, LineRange range) {
    return doc.getLines(range.getStart(), range.getEnd());
  }

  /** Offset of {@code line:column} within {@link #termText(Document, LineRange)}. */
  public static int offsetIn(Document doc, LineRange range, int line, int column) {
    int offset = 0;
    for (int ln = range.getStart(); ln < line; ln++) offset += doc.lineAt(ln).length() + 1;
    return offset + Math.min(column, line < doc.lineCount() ? doc.lineAt(line).length() : 0);
  }

  public static @Nullable TermType termType(Document doc, int line) {
    Optional<LineRange> range = enclosingTerm(doc, line);
    if (range.isEmpty()) return null;
    return classify(termText(doc, range.get()));
  }

  public static TermType classify(String termText) {
    if (Directives.isDirective(termText)) {
      return Directives.isEntityDirective(termText) ? TermType.ENTITY_DIRECTIVE : TermType.PREDICATE_DIRECTIVE;
    }
    if (TermScanner.indexOfTopLevel(termText, "-->", 0) >= 0) return TermType.NON_TERMINAL_RULE;
    if (TermScanner.indexOfTopLevel(termText, ":-", 0) >= 0) return TermType.PREDICATE_RULE;
    return TermType.PREDICATE_FACT;
  }

  /** Offset in the term text where the body starts (after the neck), or -1 for facts and directives. */
  public static int bodyStart(String termText) {
    if (Directives.isDirective(termText)) return -1;
    int dcg = TermScanner.indexOfTopLevel(termText, "-->", 0);
    if (dcg >= 0) return dcg + 3;
    int neck = TermScanner.indexOfTopLevel(termText, ":-", 0);
    return neck >= 0 ? neck + 2 : -1;
  }

  private static LineRange scanToTerminator(Document doc, int startLine) {
    int depth = 0;
    boolean inBlockComment = false;
    for (int ln = startLine; ln < doc.lineCount(); ln++) {
      String line = doc.lineAt(ln);
      int i = 0;
      if (inBlockComment) {
        int close = line.indexOf("*/");
        if (close < 0) continue;
        inBlockComment = false;
        i = close + 2;
      }
      for (; i < line.length(); i++) {
        char c = line.charAt(i);
        if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '*') {
          int close = line.indexOf("*/", i + 2);
          if (close < 0) {
            inBlockComment = true;
            break;
          }
          i = close + 1;
          continue;
        }
        int r = TermScanner.regionEnd(line, i);
        if (r >= 0) {
          i = r;
          continue;
        }
        if (c == '(' || c == '[' || c == '{') {
          depth++;
        } else if (c == ')' || c == ']' || c == '}') {
          if (depth > 0) depth--;
        } else if (c == '.' && depth == 0 && TermScanner.isEndToken(line, i)) {
          return new LineRange(startLine, ln, true);
        }
      }
    }
    return new LineRange(startLine, Math.max(startLine, doc.lineCount() - 1), false);
  }
}
