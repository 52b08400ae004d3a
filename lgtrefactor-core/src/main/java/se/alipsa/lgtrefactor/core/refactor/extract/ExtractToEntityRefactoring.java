package se.alipsa.lgtrefactor.core.refactor.extract;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.EntityKind;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;
import se.alipsa.lgtrefactor.core.refactor.Validators;

import java.util.List;
import java.util.Optional;

/** Moves the selected terms into a new entity in a new file named after the entity. */
public final class ExtractToEntityRefactoring extends SelectionRefactoring {

  public ExtractToEntityRefactoring() {
    super(RefactorKind.EXTRACT_TO_ENTITY);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    SelectionTarget target = action.targetAs(SelectionTarget.class);
    Document doc = open(target.getUri());
    int[] span = completeTermLines(doc, target.getSelection());
    Optional<String> type = promptChoice("Entity type", List.of("object", "protocol", "category"));
    if (type.isEmpty()) return RefactorResult.cancelled();
    EntityKind kind = EntityKind.fromKeyword(type.get())
        .orElseThrow(() -> RefactorException.precondition("Unknown entity type: " + type.get()));
    Optional<String> name = promptText("Name of the new " + kind.keyword(), "new_" + kind.keyword(), Validators.atomName());
    if (name.isEmpty()) return RefactorResult.cancelled();
    String entity = name.get().trim();
    String uri = FileUris.sibling(doc.uri(), entity + ".lgt");
    if (env().documents().exists(uri)) {
      throw RefactorException.precondition("File " + entity + ".lgt already exists");
    }
    String indent = env().settings().indent();
    String body = SelectionValidator.indent(SelectionValidator.stripCommonIndent(selectedCode(doc, span)), indent);
    EditAssembler edits = new EditAssembler();
    edits.createFile(uri, EntityTemplate.render(kind, entity, body, env().settings(), env().clock()));
    edits.buffer(doc).delete(span[0], span[1]);
    return apply(edits, "Code extracted to new " + kind.keyword() + " " + entity);
  }
}
