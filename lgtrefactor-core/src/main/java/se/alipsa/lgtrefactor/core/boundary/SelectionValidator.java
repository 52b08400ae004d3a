package se.alipsa.lgtrefactor.core.boundary;

import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Checks and normalizes selections used by the extraction refactorings. */
public final class SelectionValidator {

  private SelectionValidator() {}

  /** First and last line covered by a selection; a selection ending at column 0 excludes that line. */
  public static int[] lineSpan(Range selection) {
    int last = selection.end.line;
    if (selection.end.column == 0 && last > selection.start.line) last--;
    return new int[] {selection.start.line, last};
  }

  /**
   * Returns a problem description when the selected lines are not one or more complete
   * top-level terms, or empty when they are.
   */
  public static Optional<String> validateCompleteTerms(Document doc, Range selection) {
    int[] span = lineSpan(selection);
    int first = -1;
    int lastCode = -1;
    for (int ln = span[0]; ln <= span[1]; ln++) {
      String line = doc.lineAt(ln);
      if (line.isBlank()) continue;
      if (first < 0) first = ln;
      if (!TermScanner.isCommentOrBlank(line)) lastCode = ln;
    }
    if (first < 0) return Optional.of("The selection is empty.");
    if (lastCode < 0) return Optional.of("The selection contains only comments.");
    String firstLine = doc.lineAt(first);
    if (!TermScanner.isCommentOrBlank(firstLine)) {
      Integer start = TermBoundaries.findTermStart(doc, first);
      if (start == null || start != first) {
        return Optional.of("The selection starts in the middle of a term; select complete terms.");
      }
    }
    if (!TermScanner.endsWithTerminator(doc.lineAt(lastCode))) {
      return Optional.of("The selection contains incomplete terms; the last term must end with a period.");
    }
    Integer lastStart = TermBoundaries.findTermStart(doc, lastCode);
    if (lastStart == null || lastStart < first) {
      return Optional.of("The selection starts in the middle of a term; select complete terms.");
    }
    return Optional.empty();
  }

  /** Drop blank lines at the top and bottom, keeping the indentation of the rest. */
  public static String processSelectedCode(String text) {
    List<String> lines = new ArrayList<>(List.of(text.split("\r?\n", -1)));
    while (!lines.isEmpty() && lines.get(0).isBlank()) lines.remove(0);
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);
    return String.join("\n", lines);
  }

  /** Remove the indentation shared by all non-blank lines. */
  public static String stripCommonIndent(String text) {
    String[] lines = text.split("\n", -1);
    String common = null;
    for (String line : lines) {
      if (line.isBlank()) continue;
      String indent = TermScanner.indentOf(line);
      if (common == null) {
        common = indent;
      } else {
        int k = 0;
        while (k < common.length() && k < indent.length() && common.charAt(k) == indent.charAt(k)) k++;
        common = common.substring(0, k);
      }
    }
    if (common == null || common.isEmpty()) return text;
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) sb.append('\n');
      String line = lines[i];
      sb.append(line.isBlank() ? "" : line.substring(common.length()));
    }
    return sb.toString();
  }

  /** Prefix every non-blank line with {@code indent}. */
  public static String indent(String text, String indent) {
    String[] lines = text.split("\n", -1);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) sb.append('\n');
      if (!lines[i].isBlank()) sb.append(indent).append(lines[i]);
    }
    return sb.toString();
  }
}
