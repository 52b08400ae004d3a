package se.alipsa.lgtrefactor.core.refactor.extract;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;

import java.util.Optional;

/** Moves the selected terms, verbatim, into a new file next to the current one. */
public final class ExtractToFileRefactoring extends SelectionRefactoring {

  public ExtractToFileRefactoring() {
    super(RefactorKind.EXTRACT_TO_FILE);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    SelectionTarget target = action.targetAs(SelectionTarget.class);
    Document doc = open(target.getUri());
    int[] span = completeTermLines(doc, target.getSelection());
    String code = selectedCode(doc, span);
    Optional<String> uri = askNewFile(doc, "extracted.lgt");
    if (uri.isEmpty()) return RefactorResult.cancelled();
    EditAssembler edits = new EditAssembler();
    edits.createFile(uri.get(), code + "\n");
    edits.buffer(doc).delete(span[0], span[1]);
    return apply(edits, "Code extracted to new file " + FileUris.fileName(uri.get()));
  }
}
