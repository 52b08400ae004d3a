package test.alipsa.lgtrefactor.it;

import se.alipsa.lgtrefactor.core.boundary.CursorInspector;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Symbol queries answered by regex scans over the {@code .lgt} files below a directory, read
 * through the server's document provider so open buffers are seen.
 */
final class RegexSymbolProvider implements SymbolProvider {

  private final Path root;
  private DocumentProvider documents;

  RegexSymbolProvider(Path root) {
    this.root = root;
  }

  void useDocuments(DocumentProvider documents) {
    this.documents = documents;
  }

  @Override
  public Optional<Location> findDeclaration(Document doc, Position position) {
    Optional<String> word = wordAt(doc, position);
    if (word.isEmpty()) return Optional.empty();
    Pattern indicator = Pattern.compile(boundary(word.get()) + "//?\\d");
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
    Pattern opening = Pattern.compile("^\\s*:-\\s*(object|protocol|category)\\(" + Pattern.quote(word.get()) + "(?![A-Za-z0-9_])");
    Pattern head = Pattern.compile("^\\s*" + Pattern.quote(word.get()) + "(?![A-Za-z0-9_])");
    for (Document d : documents()) {
      for (int ln = 0; ln < d.lineCount(); ln++) {
        if (opening.matcher(d.lineAt(ln)).find()) return Optional.of(location(d, ln, d.lineAt(ln).indexOf(word.get())));
      }
    }
    for (Document d : documents()) {
      for (int ln = 0; ln < d.lineCount(); ln++) {
        String line = d.lineAt(ln);
        if (TermScanner.isCommentOrBlank(line) || Directives.isDirective(line)) continue;
        Integer start = TermBoundaries.findTermStart(d, ln);
        if (start != null && start == ln && head.matcher(line).find()) {
          return Optional.of(location(d, ln, line.length() - line.stripLeading().length()));
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
    Pattern p = Pattern.compile(boundary(word.get()) + "(?![A-Za-z0-9_])");
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

  private static String boundary(String word) {
    return "(?<![A-Za-z0-9_])" + Pattern.quote(word);
  }

  private static Optional<String> wordAt(Document doc, Position position) {
    String line = doc.lineAt(position.line);
    return CursorInspector.wordAt(line, position.column).map(b -> line.substring(b[0], b[1]));
  }

  private static Location location(Document doc, int line, int column) {
    return new Location(doc.uri(), Range.caret(new Position(line, Math.max(0, column))));
  }

  private List<Document> documents() {
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files = walk.filter(p -> p.getFileName().toString().endsWith(".lgt")).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    List<Document> docs = new ArrayList<>();
    for (Path file : files) {
      try {
        docs.add(documents.open(file.toUri().toString()));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return docs;
  }
}
