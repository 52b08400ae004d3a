package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;

public final class TextEdit {
  private final Range range;
  private final String newText;
  public TextEdit(Range range, String newText) {
    this.range = Objects.requireNonNull(range, "range");
    this.newText = Objects.requireNonNull(newText, "newText");
  }
  public static TextEdit insert(Position at, String text) { return new TextEdit(Range.caret(at), text); }
  public Range getRange() { return range; }
  public String getNewText() { return newText; }
  @Override public String toString() { return range + " -> \"" + newText + "\""; }
}
