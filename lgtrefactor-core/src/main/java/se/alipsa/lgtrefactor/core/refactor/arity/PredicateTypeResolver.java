package se.alipsa.lgtrefactor.core.refactor.arity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.locate.References;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.scan.IndicatorRewriter;

import java.io.IOException;
import java.util.Optional;

/**
 * Decides whether a callable is a predicate or a non-terminal. Once decided the answer is not
 * revisited for the rest of the operation.
 */
final class PredicateTypeResolver {

  private static final Logger logger = LogManager.getLogger(PredicateTypeResolver.class);

  private PredicateTypeResolver() {}

  /**
   * Non-terminal when the cursor indicator used {@code //}, the declaration writes
   * {@code name//N}, or the definition is a grammar rule.
   */
  static Indicator resolve(Indicator cursor, References refs, DocumentProvider documents, Document current)
      throws IOException {
    if (cursor.isNonTerminal()) return cursor;
    Optional<Location> declaration = refs.getDeclaration();
    if (declaration.isPresent()) {
      Document doc = open(declaration.get(), documents, current);
      Optional<LineRange> term = TermBoundaries.enclosingTerm(doc, declaration.get().getLine());
      if (term.isPresent()) {
        String text = TermBoundaries.termText(doc, term.get());
        if (IndicatorRewriter.contains(text, cursor.asNonTerminal(true))) {
          logger.debug("{} declared as a non-terminal", cursor);
          return cursor.asNonTerminal(true);
        }
        if (IndicatorRewriter.contains(text, cursor)) return cursor;
      }
    }
    Optional<Location> definition = refs.getDefinition();
    if (definition.isPresent()) {
      Document doc = open(definition.get(), documents, current);
      if (definition.get().getLine() < doc.lineCount()
          && TermBoundaries.termType(doc, definition.get().getLine()) == TermType.NON_TERMINAL_RULE) {
        logger.debug("{} defined by a grammar rule", cursor);
        return cursor.asNonTerminal(true);
      }
    }
    return cursor;
  }

  private static Document open(Location location, DocumentProvider documents, Document current) throws IOException {
    return location.getUri().equals(current.uri()) ? current : documents.open(location.getUri());
  }
}
