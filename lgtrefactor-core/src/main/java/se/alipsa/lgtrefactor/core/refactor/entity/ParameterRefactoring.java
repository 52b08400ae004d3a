package se.alipsa.lgtrefactor.core.refactor.entity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.EntityBlock;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.locate.ReferenceLocator;
import se.alipsa.lgtrefactor.core.locate.References;
import se.alipsa.lgtrefactor.core.model.EntityIdentifier;
import se.alipsa.lgtrefactor.core.model.EntityTarget;
import se.alipsa.lgtrefactor.core.model.Location;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.arity.ArgumentChange;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Common flow of the entity parameter refactorings: the same positional changes as the
 * argument refactorings, applied to the entity identifier and its references.
 */
public abstract class ParameterRefactoring extends EntityRefactoring {

  private static final Logger logger = LogManager.getLogger(ParameterRefactoring.class);

  protected ParameterRefactoring(RefactorKind kind) {
    super(kind);
  }

  protected abstract int minimumArity();

  /** Empty when cancelled. */
  protected abstract Optional<ArgumentChange> askChange(EntityIdentifier identifier);

  @Override
  protected boolean accepts(EntityBlock block) {
    return block.getIdentifier().arity() >= minimumArity();
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    EntityTarget target = action.targetAs(EntityTarget.class);
    Document doc = open(target.getUri());
    EntityBlock block = resolve(doc, target);
    EntityIdentifier identifier = block.getIdentifier();
    if (identifier.arity() < minimumArity()) {
      return RefactorResult.notApplicable(identifier.indicator() + " has too few parameters for "
          + action.getTitle().toLowerCase());
    }
    Optional<ArgumentChange> change = askChange(identifier);
    if (change.isEmpty()) return RefactorResult.cancelled();
    if (change.get().isIdentity()) return apply(new EditAssembler(), identifier.indicator() + " unchanged");

    EditAssembler edits = new EditAssembler();
    ParameterChangeEditor editor = new ParameterChangeEditor(identifier.getName(), identifier.arity(), change.get(),
        change.get().insertedValue().orElse(""), env().settings().argumentDescription(), edits);
    List<String> stillUsed = editor.removedParameterUses(doc, block, identifier.getParameters());
    if (!stillUsed.isEmpty()) {
      throw RefactorException.precondition("Cannot remove a parameter of " + identifier.indicator()
          + " still used in its body: " + String.join(", ", stillUsed));
    }

    References refs;
    try {
      Optional<References> located = new ReferenceLocator(env().symbols(), env().documents())
          .locate(doc, target.getPosition(), identifier.getName(), env().cancellation());
      if (located.isEmpty()) return RefactorResult.cancelled();
      refs = located.get();
    } catch (IOException e) {
      throw RefactorException.host("Cannot read a file while locating " + identifier.indicator() + ": " + e.getMessage(), e);
    }
    editor.applyToEntity(doc, block);
    Map<String, Document> docs = new HashMap<>();
    docs.put(doc.uri(), doc);
    for (Location loc : refs.getLocations()) {
      Document locDoc = docs.get(loc.getUri());
      if (locDoc == null) {
        locDoc = open(loc.getUri());
        docs.put(loc.getUri(), locDoc);
      }
      editor.applyToReference(locDoc, loc.getLine());
    }
    logger.debug("{} {} with {} references", identifier.indicator(), change.get().describe(), refs.getLocations().size());
    int newArity = change.get().newArity(identifier.arity());
    return apply(edits, "Entity " + identifier.indicator() + " now " + identifier.getName() + "/" + newArity);
  }
}
