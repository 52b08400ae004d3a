package se.alipsa.lgtrefactor.core.refactor.include;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;
import se.alipsa.lgtrefactor.core.refactor.extract.FileUris;
import se.alipsa.lgtrefactor.core.refactor.extract.SelectionRefactoring;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.Optional;

/** Moves the selected terms into a new file and leaves an {@code include/1} directive in their place. */
public final class ReplaceWithIncludeRefactoring extends SelectionRefactoring {

  public ReplaceWithIncludeRefactoring() {
    super(RefactorKind.REPLACE_WITH_INCLUDE);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    SelectionTarget target = action.targetAs(SelectionTarget.class);
    Document doc = open(target.getUri());
    int[] span = completeTermLines(doc, target.getSelection());
    String code = selectedCode(doc, span);
    Optional<String> uri = askNewFile(doc, "included.lgt");
    if (uri.isEmpty()) return RefactorResult.cancelled();
    String fileName = FileUris.fileName(uri.get());
    EditAssembler edits = new EditAssembler();
    edits.createFile(uri.get(), SelectionValidator.stripCommonIndent(code) + "\n");
    edits.buffer(doc).replace(span[0], span[1], TermScanner.indentOf(code) + ":- include('" + fileName + "').");
    return apply(edits, "Code moved to " + fileName + " and included");
  }
}
