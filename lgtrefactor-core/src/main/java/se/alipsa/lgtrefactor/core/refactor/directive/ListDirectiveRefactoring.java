package se.alipsa.lgtrefactor.core.refactor.directive;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.DirectiveTarget;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.List;
import java.util.Optional;

/** Refactorings offered on a list directive under the cursor. */
abstract class ListDirectiveRefactoring extends AbstractRefactoring {

  protected ListDirectiveRefactoring(RefactorKind kind) {
    super(kind);
  }

  protected abstract boolean accepts(ListDirective directive);

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (!range.isSingleLine()) return List.of();
    String line = doc.lineAt(range.start.line);
    if (TermScanner.isCommentOrBlank(line)) return List.of();
    Optional<LineRange> term = TermBoundaries.enclosingTerm(doc, range.start.line);
    if (term.isEmpty() || !term.get().isTerminated()) return List.of();
    String text = TermBoundaries.termText(doc, term.get());
    if (!Directives.isDirective(text)) return List.of();
    Optional<ListDirective> directive = ListDirective.parse(text);
    if (directive.isEmpty() || !accepts(directive.get())) return List.of();
    return offer(new DirectiveTarget(doc.uri(), term.get(), directive.get().name()));
  }

  /** Re-parse the directive at the target. */
  protected ListDirective resolve(Document doc, DirectiveTarget target) throws RefactorException {
    LineRange range = target.getDirective();
    if (range.getEnd() >= doc.lineCount()) {
      throw RefactorException.precondition("The " + target.getDirectiveName() + " directive is no longer there");
    }
    return ListDirective.parse(TermBoundaries.termText(doc, range))
        .filter(d -> d.name().equals(target.getDirectiveName()) && accepts(d))
        .orElseThrow(() -> RefactorException.precondition(
            "Not a " + target.getDirectiveName() + " directive with a list to " + kind().title().toLowerCase()));
  }
}
