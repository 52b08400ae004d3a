package se.alipsa.lgtrefactor.core.refactor.extract;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.refactor.Validators;

import java.util.List;
import java.util.Optional;

/** Refactorings that move a selection of complete terms somewhere else. */
public abstract class SelectionRefactoring extends AbstractRefactoring {

  protected SelectionRefactoring(RefactorKind kind) {
    super(kind);
  }

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (range.isEmpty() || doc.getText(range).isBlank()) return List.of();
    return offer(new SelectionTarget(doc.uri(), range));
  }

  /** Lines covered by the selection, after checking they hold complete terms. */
  protected int[] completeTermLines(Document doc, Range selection) throws RefactorException {
    if (selection.end.line >= doc.lineCount()) {
      throw RefactorException.precondition("The selection is outside the document");
    }
    Optional<String> problem = SelectionValidator.validateCompleteTerms(doc, selection);
    if (problem.isPresent()) throw RefactorException.precondition(problem.get());
    return SelectionValidator.lineSpan(selection);
  }

  /** Selected lines with blank lines trimmed at both ends. */
  protected static String selectedCode(Document doc, int[] span) {
    return SelectionValidator.processSelectedCode(doc.getLines(span[0], span[1]));
  }

  /** Ask for a file name next to {@code doc}; {@code .lgt} is added when there is no extension. */
  protected Optional<String> askNewFile(Document doc, String placeholder) throws RefactorException {
    Optional<String> name = promptText("File name", placeholder, Validators.fileName());
    if (name.isEmpty()) return Optional.empty();
    String file = name.get().trim();
    if (!FileUris.hasExtension(file)) file = file + ".lgt";
    String uri = FileUris.sibling(doc.uri(), file);
    if (uri.equals(doc.uri()) || env().documents().exists(uri)) {
      throw RefactorException.precondition("File " + file + " already exists");
    }
    return Optional.of(uri);
  }
}
