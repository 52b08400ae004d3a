package se.alipsa.lgtrefactor.core.refactor.directive;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.DirectiveTarget;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;

import java.util.List;

/** Turns {@code :- public([a/1, b/2]).} into one {@code public/1} directive per element. */
public final class SplitDirectiveRefactoring extends ListDirectiveRefactoring {

  public SplitDirectiveRefactoring() {
    super(RefactorKind.SPLIT_DIRECTIVE);
  }

  @Override
  protected boolean accepts(ListDirective directive) {
    return directive.size() >= 2;
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    DirectiveTarget target = action.targetAs(DirectiveTarget.class);
    Document doc = open(target.getUri());
    ListDirective directive = resolve(doc, target);
    List<String> split = directive.split();
    EditAssembler edits = new EditAssembler();
    LineRange range = target.getDirective();
    edits.buffer(doc).replace(range.getStart(), range.getEnd(), String.join("\n", split));
    return apply(edits, "Split " + directive.name() + " directive into " + split.size() + " directives");
  }
}
