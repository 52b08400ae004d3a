package test.alipsa.lgtrefactor.core;

import se.alipsa.lgtrefactor.core.boundary.CursorInspector;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers symbol queries by scanning every workspace file for the word under the cursor: a
 * scope directive naming {@code word/N} is the declaration, an entity opening directive or the
 * first clause starting with the word is the definition, and every code line with the word is a
 * reference.
 */
public final class ScanningSymbolProvider implements SymbolProvider {

  private final TestWorkspace workspace;

  public ScanningSymbolProvider(TestWorkspace workspace) {
    this.workspace = workspace;
  }

  @Override
  public Optional<Location> findDeclaration(Document doc, Position position) {
    Optional<String> word = wordAt(doc, position);
    if (word.isEmpty()) return Optional.empty();
    Pattern indicator = Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(word.get()) + "//?\\d");
    for (Document d : documents()) {
      for (int ln = 0; ln < d.lineCount(); ln++) {
        String line = d.lineAt(ln);
        Matcher m = indicator.matcher(line);
        if (Directives.isDirective(line) && Directives.isScope(line) && m.find()) {
          return Optional.of(location(d, ln, m.start()));
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<Location> findDefinition(Document doc, Position position) {
    Optional<String> word = wordAt(doc, position);
    if (word.isEmpty()) return Optional.empty();
    Pattern entity = Pattern.compile("^\\s*:-\\s*(object|protocol|category)\\(" + Pattern.quote(word.get()) + "(?![A-Za-z0-9_])");
    for (Document d : documents()) {
      for (int ln = 0; ln < d.lineCount(); ln++) {
        if (entity.matcher(d.lineAt(ln)).find()) return Optional.of(location(d, ln, d.lineAt(ln).indexOf(word.get())));
      }
    }
    for (Document d : documents()) {
      for (int ln = 0; ln < d.lineCount(); ln++) {
        String line = d.lineAt(ln);
        if (TermScanner.isCommentOrBlank(line) || Directives.isDirective(line)) continue;
        String code = line.stripLeading();
        Integer start = TermBoundaries.findTermStart(d, ln);
        if (start != null && start == ln && startsWithWord(code, word.get())) {
          return Optional.of(location(d, ln, line.length() - code.length()));
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public List<Location> findImplementations(Document doc, Position position) {
    return List.of();
  }

  @Override
  public List<Location> findReferences(Document doc, Position position) {
    List<Location> refs = new ArrayList<>();
    Optional<String> word = wordAt(doc, position);
    if (word.isEmpty()) return refs;
    Pattern p = Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(word.get()) + "(?![A-Za-z0-9_])");
    for (Document d : documents()) {
      for (int ln = 0; ln < d.lineCount(); ln++) {
        String line = d.lineAt(ln);
        if (TermScanner.isCommentOrBlank(line)) continue;
        Matcher m = p.matcher(TermScanner.stripLineComment(line));
        if (m.find()) refs.add(location(d, ln, m.start()));
      }
    }
    return refs;
  }

  private static boolean startsWithWord(String code, String word) {
    if (!code.startsWith(word)) return false;
    return code.length() == word.length() || !TermScanner.isAlnum(code.charAt(word.length()));
  }

  private static Optional<String> wordAt(Document doc, Position position) {
    String line = doc.lineAt(position.line);
    return CursorInspector.wordAt(line, position.column).map(b -> line.substring(b[0], b[1]));
  }

  private static Location location(Document doc, int line, int column) {
    return new Location(doc.uri(), Range.caret(new Position(line, Math.max(0, column))));
  }

  private List<Document> documents() {
    List<Document> docs = new ArrayList<>();
    for (String uri : workspace.uris()) {
      try {
        docs.add(workspace.open(uri));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return docs;
  }
}
