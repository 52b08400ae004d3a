package se.alipsa.lgtrefactor.core.locate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.host.CancellationToken;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects declaration, definition, implementation and reference locations for the symbol at
 * a position. Symbol correctness is the {@link SymbolProvider}'s business; this class only
 * aggregates and deduplicates by file and start line, keeping the first occurrence.
 */
public final class ReferenceLocator {

  private static final Logger logger = LogManager.getLogger(ReferenceLocator.class);

  private final SymbolProvider symbols;
  private final DocumentProvider documents;

  public ReferenceLocator(SymbolProvider symbols, DocumentProvider documents) {
    this.symbols = symbols;
    this.documents = documents;
  }

  /**
   * Locate all occurrences of the symbol named {@code name} at {@code position}. Returns empty
   * when cancellation was requested before the reference pass.
   */
  public Optional<References> locate(Document doc, Position position, String name, CancellationToken cancel)
      throws IOException {
    Optional<Location> declaration = symbols.findDeclaration(doc, position);
    Optional<Location> definition = symbols.findDefinition(doc, position);
    logger.debug("Declaration of {}: {}, definition: {}", name, declaration.orElse(null), definition.orElse(null));

    // later queries are anchored on the declaration, or the definition when there is none
    Location anchor = declaration.orElse(definition.orElse(null));
    Document anchorDoc = doc;
    Position anchorPos = position;
    if (anchor != null) {
      anchorDoc = anchor.getUri().equals(doc.uri()) ? doc : documents.open(anchor.getUri());
      anchorPos = namePosition(anchorDoc, anchor, name);
    }
    if (declaration.isEmpty() && anchor != null) {
      definition = symbols.findDefinition(anchorDoc, anchorPos).or(() -> Optional.of(anchor));
    } else if (declaration.isPresent()) {
      Optional<Location> fromDeclaration = symbols.findDefinition(anchorDoc, anchorPos);
      if (fromDeclaration.isPresent()) definition = fromDeclaration;
    }
    List<Location> implementations = symbols.findImplementations(anchorDoc, anchorPos);
    if (cancel.isCancellationRequested()) {
      logger.debug("Cancelled before reference search for {}", name);
      return Optional.empty();
    }
    List<Location> references = symbols.findReferences(anchorDoc, anchorPos);

    Map<String, Location> unique = new LinkedHashMap<>();
    declaration.ifPresent(l -> addUnique(unique, l));
    definition.ifPresent(l -> addUnique(unique, l));
    implementations.forEach(l -> addUnique(unique, l));
    references.forEach(l -> addUnique(unique, l));
    List<Location> locations = new ArrayList<>(unique.values());
    if (logger.isDebugEnabled()) {
      locations.forEach(l -> logger.debug("Location of {}: {}", name, l));
    }
    return Optional.of(new References(declaration.orElse(null), definition.orElse(null), locations));
  }

  private static void addUnique(Map<String, Location> unique, Location location) {
    unique.putIfAbsent(location.getUri() + "#" + location.getLine(), location);
  }

  /**
   * Position of {@code name} on the location's line, searching from the location's column so a
   * location pointing at a directive resolves to the symbol inside it.
   */
  static Position namePosition(Document doc, Location location, String name) {
    int line = location.getLine();
    if (line < 0 || line >= doc.lineCount()) return location.getRange().start;
    String text = doc.lineAt(line);
    int from = Math.min(location.getRange().start.column, text.length());
    int idx = indexOfName(text, name, from);
    if (idx < 0) idx = indexOfName(text, name, 0);
    return idx < 0 ? location.getRange().start : new Position(line, idx);
  }

  private static int indexOfName(String text, String name, int from) {
    int idx = text.indexOf(name, from);
    while (idx >= 0) {
      boolean startOk = idx == 0 || !TermScanner.isAlnum(text.charAt(idx - 1));
      int end = idx + name.length();
      boolean endOk = end >= text.length() || !TermScanner.isAlnum(text.charAt(end));
      if (startOk && endOk) return idx;
      idx = text.indexOf(name, idx + 1);
    }
    return -1;
  }
}
