package se.alipsa.lgtrefactor.core.host;

import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** In-memory {@link Document} built from a string. */
public final class TextDocument implements Document {

  private final String uri;
  private final List<String> lines;
  private final String separator;

  public TextDocument(String uri, String text) {
    this.uri = Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(text, "text");
    this.separator = text.contains("\r\n") ? "\r\n" : "\n";
    this.lines = List.of(text.split("\r?\n", -1));
  }

  public static TextDocument of(String uri, String text) {
    return new TextDocument(uri, text);
  }

  @Override public String uri() { return uri; }

  @Override public int lineCount() { return lines.size(); }

  @Override public String lineAt(int n) {
    if (n < 0 || n >= lines.size()) {
      throw new IndexOutOfBoundsException("Line " + n + " outside 0.." + (lines.size() - 1) + " of " + uri);
    }
    return lines.get(n);
  }

  @Override public String lineSeparator() { return separator; }

  public int offsetAt(Position p) {
    int offset = 0;
    for (int i = 0; i < p.line && i < lines.size(); i++) {
      offset += lines.get(i).length() + separator.length();
    }
    if (p.line >= lines.size()) return offset;
    return offset + Math.min(p.column, lines.get(p.line).length());
  }

  /**
   * Apply non-overlapping edits and return the resulting text. Edits are applied back to front
   * so earlier offsets stay valid.
   */
  public String applyEdits(List<TextEdit> edits) {
    String text = getText();
    List<TextEdit> sorted = new ArrayList<>(edits);
    sorted.sort(Comparator.comparing((TextEdit e) -> e.getRange().start).reversed());
    StringBuilder sb = new StringBuilder(text);
    for (TextEdit e : sorted) {
      int start = offsetAt(e.getRange().start);
      int end = offsetAt(e.getRange().end);
      String replacement = "\n".equals(separator) ? e.getNewText() : e.getNewText().replace("\n", separator);
      sb.replace(start, end, replacement);
    }
    return sb.toString();
  }
}
