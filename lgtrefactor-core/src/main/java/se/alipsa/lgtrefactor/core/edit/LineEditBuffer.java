package se.alipsa.lgtrefactor.core.edit;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.TextEdit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Full-line edits against one document. Every rewrite replaces, deletes or inserts whole lines,
 * so the resulting {@link TextEdit}s never overlap. Claiming a line twice is a programming error.
 */
public final class LineEditBuffer {

  private static final class Block {
    final int start;
    final int end;
    // null means delete
    final @Nullable String text;

    Block(int start, int end, @Nullable String text) {
      this.start = start;
      this.end = end;
      this.text = text;
    }
  }

  private final Document doc;
  private final TreeMap<Integer, Block> blocks = new TreeMap<>();
  private final TreeMap<Integer, StringBuilder> inserts = new TreeMap<>();

  public LineEditBuffer(Document doc) {
    this.doc = doc;
  }

  public Document getDocument() { return doc; }

  /** Replace lines {@code start..end} (inclusive) with {@code text}, which may span lines. */
  public void replace(int start, int end, String text) {
    claim(new Block(start, end, text));
  }

  public void delete(int start, int end) {
    claim(new Block(start, end, null));
  }

  /** Insert {@code text} as new line(s) before {@code line}; {@code line == lineCount()} appends. */
  public void insertBefore(int line, String text) {
    if (line < 0 || line > doc.lineCount()) {
      throw new IndexOutOfBoundsException("Insert line " + line + " outside 0.." + doc.lineCount());
    }
    StringBuilder sb = inserts.computeIfAbsent(line, k -> new StringBuilder());
    if (sb.length() > 0) sb.append('\n');
    sb.append(text);
  }

  public boolean isTouched(int line) {
    Map.Entry<Integer, Block> e = blocks.floorEntry(line);
    return e != null && e.getValue().end >= line;
  }

  public boolean isEmpty() {
    return blocks.isEmpty() && inserts.isEmpty();
  }

  private void claim(Block block) {
    if (block.start < 0 || block.end < block.start || block.end >= doc.lineCount()) {
      throw new IndexOutOfBoundsException("Lines " + block.start + ".." + block.end + " outside document " + doc.uri());
    }
    Map.Entry<Integer, Block> before = blocks.floorEntry(block.end);
    if (before != null && before.getValue().end >= block.start) {
      throw new IllegalStateException("Lines " + block.start + ".." + block.end + " of " + doc.uri()
          + " already edited (" + before.getValue().start + ".." + before.getValue().end + ")");
    }
    blocks.put(block.start, block);
  }

  /** Convert to text edits; replacements that leave the text unchanged are dropped. */
  public List<TextEdit> toTextEdits() {
    List<TextEdit> edits = new ArrayList<>();
    TreeMap<Integer, StringBuilder> pending = new TreeMap<>(inserts);
    for (Block b : blocks.values()) {
      StringBuilder prefix = pending.remove(b.start);
      if (b.text == null) {
        if (prefix != null) {
          // inserted lines take the place of the deleted ones
          edits.add(new TextEdit(fullLines(b.start, b.end), prefix.toString()));
        } else {
          edits.add(deletion(b.start, b.end));
        }
        continue;
      }
      String replacement = prefix == null ? b.text : prefix + "\n" + b.text;
      if (prefix == null && replacement.equals(doc.getLines(b.start, b.end))) continue;
      edits.add(new TextEdit(fullLines(b.start, b.end), replacement));
    }
    for (Map.Entry<Integer, StringBuilder> e : pending.entrySet()) {
      int line = e.getKey();
      if (line < doc.lineCount()) {
        edits.add(TextEdit.insert(new Position(line, 0), e.getValue() + "\n"));
      } else {
        edits.add(TextEdit.insert(doc.endOfLine(doc.lineCount() - 1), "\n" + e.getValue()));
      }
    }
    edits.sort((a, c) -> a.getRange().start.compareTo(c.getRange().start));
    return edits;
  }

  private Range fullLines(int start, int end) {
    return new Range(new Position(start, 0), doc.endOfLine(end));
  }

  private TextEdit deletion(int start, int end) {
    if (end + 1 < doc.lineCount()) {
      return new TextEdit(new Range(new Position(start, 0), new Position(end + 1, 0)), "");
    }
    if (start > 0) {
      return new TextEdit(new Range(doc.endOfLine(start - 1), doc.endOfLine(end)), "");
    }
    return new TextEdit(fullLines(start, end), "");
  }
}
