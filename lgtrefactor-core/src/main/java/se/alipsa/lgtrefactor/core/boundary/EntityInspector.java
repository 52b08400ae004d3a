package se.alipsa.lgtrefactor.core.boundary;

import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.EntityIdentifier;
import se.alipsa.lgtrefactor.core.model.EntityKind;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** Locates entity opening and closing directives. Entities do not nest. */
public final class EntityInspector {

  private static final Pattern OPENING = Pattern.compile("^\\s*:-\\s*(object|protocol|category)\\(");
  private static final Pattern ENDING = Pattern.compile("^\\s*:-\\s*end_(object|protocol|category)\\s*\\.");

  private EntityInspector() {}

  public static boolean isOpeningLine(String line) {
    return OPENING.matcher(line).find();
  }

  public static boolean isEndingLine(String line) {
    return ENDING.matcher(line).find();
  }

  /** The entity whose opening directive, body or closing directive contains {@code line}. */
  public static Optional<EntityBlock> enclosingEntity(Document doc, int line) {
    for (int ln = Math.min(line, doc.lineCount() - 1); ln >= 0; ln--) {
      String text = doc.lineAt(ln);
      if (isOpeningLine(text)) {
        Optional<EntityBlock> block = entityAt(doc, ln);
        if (block.isPresent() && (block.get().getEndLine() < 0 || block.get().getEndLine() >= line)) {
          return block;
        }
        return Optional.empty();
      }
      if (ln < line && isEndingLine(text)) return Optional.empty();
    }
    return Optional.empty();
  }

  /** Parse the entity whose opening directive starts on {@code openingLine}. */
  public static Optional<EntityBlock> entityAt(Document doc, int openingLine) {
    if (openingLine < 0 || openingLine >= doc.lineCount() || !isOpeningLine(doc.lineAt(openingLine))) {
      return Optional.empty();
    }
    LineRange opening = TermBoundaries.getDirectiveRange(doc, openingLine);
    String text = TermBoundaries.termText(doc, opening);
    Optional<EntityKind> kind = EntityKind.fromKeyword(Directives.name(text));
    ArgumentList args = Directives.arguments(text);
    if (kind.isEmpty() || args == null || args.isEmpty()) return Optional.empty();
    Optional<EntityIdentifier> identifier = parseIdentifier(args.get(0));
    if (identifier.isEmpty()) return Optional.empty();
    int end = -1;
    for (int ln = opening.getEnd() + 1; ln < doc.lineCount(); ln++) {
      String line = doc.lineAt(ln);
      if (isEndingLine(line)) {
        end = ln;
        break;
      }
      if (isOpeningLine(line)) break;
    }
    return Optional.of(new EntityBlock(kind.get(), identifier.get(), opening, end));
  }

  /** Parse {@code name} or {@code name(P1, ..., Pn)}; parameters stay as source text. */
  public static Optional<EntityIdentifier> parseIdentifier(String text) {
    String t = text.trim();
    int i = 0;
    if (t.isEmpty() || !Character.isLowerCase(t.charAt(0))) return Optional.empty();
    while (i < t.length() && TermScanner.isAlnum(t.charAt(i))) i++;
    String name = t.substring(0, i);
    if (i == t.length()) return Optional.of(new EntityIdentifier(name, List.of()));
    if (t.charAt(i) != '(') return Optional.empty();
    int close = TermScanner.findMatchingClose(t, i, '(', ')');
    if (close != t.length() - 1) return Optional.empty();
    return Optional.of(new EntityIdentifier(name, ArgumentList.parse(t.substring(i + 1, close)).elements()));
  }

  /** The entity info/1 directive inside the entity, if any. */
  public static Optional<LineRange> entityInfo(Document doc, EntityBlock block) {
    int last = block.isClosed() ? block.getEndLine() : doc.lineCount();
    int ln = block.getOpening().getEnd() + 1;
    while (ln < last) {
      String line = doc.lineAt(ln);
      if (TermScanner.isCommentOrBlank(line)) {
        ln++;
        continue;
      }
      LineRange range = TermBoundaries.getDirectiveRange(doc, ln);
      String text = TermBoundaries.termText(doc, range);
      if (Directives.isEntityInfo(text)) return Optional.of(range);
      ln = range.getEnd() + 1;
    }
    return Optional.empty();
  }
}
