package se.alipsa.lgtrefactor.core.host;

import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.Position;

import java.util.List;
import java.util.Optional;

/**
 * Symbol-level queries answered by the compiler/runtime collaborator. Results are trusted;
 * the engine never re-derives them from text.
 */
public interface SymbolProvider {

  Optional<Location> findDeclaration(Document doc, Position position);

  Optional<Location> findDefinition(Document doc, Position position);

  List<Location> findImplementations(Document doc, Position position);

  /** Call-site references, excluding the declaration. */
  List<Location> findReferences(Document doc, Position position);

  SymbolProvider NONE = new SymbolProvider() {
    @Override public Optional<Location> findDeclaration(Document doc, Position position) { return Optional.empty(); }
    @Override public Optional<Location> findDefinition(Document doc, Position position) { return Optional.empty(); }
    @Override public List<Location> findImplementations(Document doc, Position position) { return List.of(); }
    @Override public List<Location> findReferences(Document doc, Position position) { return List.of(); }
  };
}
