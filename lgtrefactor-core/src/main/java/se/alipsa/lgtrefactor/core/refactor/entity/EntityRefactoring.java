package se.alipsa.lgtrefactor.core.refactor.entity;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.boundary.EntityBlock;
import se.alipsa.lgtrefactor.core.boundary.EntityInspector;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.EntityTarget;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;

import java.util.List;
import java.util.Optional;

/** Refactorings offered on an entity opening directive. */
public abstract class EntityRefactoring extends AbstractRefactoring {

  protected EntityRefactoring(RefactorKind kind) {
    super(kind);
  }

  /** Whether the refactoring applies to this entity. */
  protected abstract boolean accepts(EntityBlock block);

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (!range.isSingleLine()) return List.of();
    Optional<EntityBlock> block = openingAt(doc, range.start.line);
    if (block.isEmpty() || !accepts(block.get())) return List.of();
    return offer(new EntityTarget(doc.uri(), range.start, block.get().getKind(), block.get().getIdentifier()));
  }

  /** The entity whose opening directive covers {@code line}. */
  static Optional<EntityBlock> openingAt(Document doc, int line) {
    Integer start = TermBoundaries.findTermStart(doc, line);
    if (start == null) return Optional.empty();
    return EntityInspector.entityAt(doc, start);
  }

  /** Re-read the entity at the target; the document may have changed since detection. */
  protected EntityBlock resolve(Document doc, EntityTarget target) throws RefactorException {
    int line = target.getPosition().line;
    if (line >= doc.lineCount()) {
      throw RefactorException.precondition("The entity " + target.getIdentifier().getName() + " is no longer there");
    }
    return openingAt(doc, line)
        .filter(b -> b.getIdentifier().getName().equals(target.getIdentifier().getName()))
        .orElseThrow(() -> RefactorException.precondition(
            "No " + target.getKind().keyword() + " opening directive found for " + target.getIdentifier().getName()));
  }
}
