package se.alipsa.lgtrefactor.core.refactor.arity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.CursorInspector;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.locate.ReferenceLocator;
import se.alipsa.lgtrefactor.core.locate.References;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.PredicateTarget;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Common flow of the argument refactorings: find the callable under the cursor, locate all its
 * occurrences, decide predicate or non-terminal, ask for the change, then rewrite every location.
 */
public abstract class ArityRefactoring extends AbstractRefactoring {

  private static final Logger logger = LogManager.getLogger(ArityRefactoring.class);

  protected ArityRefactoring(RefactorKind kind) {
    super(kind);
  }

  /** Minimum arity for which the refactoring is offered. */
  protected abstract int minimumArity();

  /** Ask the user for the change; empty when cancelled. */
  protected abstract Optional<ArgumentChange> askChange(Indicator indicator) throws RefactorException;

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (!range.isSingleLine()) return List.of();
    Position pos = range.start;
    String line = doc.lineAt(pos.line);
    if (TermScanner.isCommentOrBlank(line)) return List.of();
    Optional<Indicator> indicator = callableAt(doc, pos);
    if (indicator.isEmpty() || indicator.get().getArity() < minimumArity()) return List.of();
    TermType type = TermBoundaries.termType(doc, pos.line);
    if (type == null || type == TermType.ENTITY_DIRECTIVE) return List.of();
    return offer(new PredicateTarget(doc.uri(), pos, indicator.get()));
  }

  static Optional<Indicator> callableAt(Document doc, Position pos) {
    Optional<Indicator> indicator = CursorInspector.indicatorAt(doc.lineAt(pos.line), pos.column);
    return indicator.isPresent() ? indicator : CursorInspector.callAt(doc, pos);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    PredicateTarget target = action.targetAs(PredicateTarget.class);
    Document doc = open(target.getUri());
    Indicator cursor = target.getIndicator();
    if (cursor.getArity() < minimumArity()) {
      return RefactorResult.notApplicable(cursor.describe() + " has too few arguments for " + action.getTitle().toLowerCase());
    }
    References refs;
    Indicator indicator;
    try {
      Optional<References> located = new ReferenceLocator(env().symbols(), env().documents())
          .locate(doc, target.getPosition(), cursor.getName(), env().cancellation());
      if (located.isEmpty()) return RefactorResult.cancelled();
      refs = located.get();
      indicator = PredicateTypeResolver.resolve(cursor, refs, env().documents(), doc);
    } catch (IOException e) {
      throw RefactorException.host("Cannot read a file while locating " + cursor + ": " + e.getMessage(), e);
    }
    if (refs.isEmpty()) {
      throw RefactorException.precondition("No locations found for " + indicator.describe());
    }
    Optional<ArgumentChange> change = askChange(indicator);
    if (change.isEmpty()) return RefactorResult.cancelled();
    if (change.get().isIdentity()) {
      return apply(new EditAssembler(), indicator.describe() + " unchanged");
    }
    EditAssembler edits = new EditAssembler();
    ArityChangeEditor editor = new ArityChangeEditor(indicator, change.get(), change.get().insertedValue().orElse(""),
        env().settings().argumentDescription(), edits);
    Map<String, Document> docs = new HashMap<>();
    docs.put(doc.uri(), doc);
    for (Location loc : refs.getLocations()) {
      Document locDoc = docs.get(loc.getUri());
      if (locDoc == null) {
        locDoc = open(loc.getUri());
        docs.put(loc.getUri(), locDoc);
      }
      editor.apply(locDoc, loc.getLine(), refs.isDeclaration(loc));
    }
    logger.debug("{} {} over {} locations", indicator, change.get().describe(), refs.getLocations().size());
    return apply(edits, capitalize(change.get().describe()) + " of " + indicator + " (now " + editor.getUpdatedIndicator() + ")");
  }

  private static String capitalize(String s) {
    return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
