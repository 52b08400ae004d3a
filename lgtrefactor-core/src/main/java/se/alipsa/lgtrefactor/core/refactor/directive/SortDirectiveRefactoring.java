package se.alipsa.lgtrefactor.core.refactor.directive;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.DirectiveTarget;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts the elements of a list directive case-insensitively by indicator, aliases by their
 * original name. Offered only when the list is not already sorted.
 */
public final class SortDirectiveRefactoring extends ListDirectiveRefactoring {

  public SortDirectiveRefactoring() {
    super(RefactorKind.SORT_DIRECTIVE);
  }

  @Override
  protected boolean accepts(ListDirective directive) {
    if (directive.size() < 2) return false;
    int[] order = sortedOrder(directive.elements());
    for (int i = 0; i < order.length; i++) {
      if (order[i] != i) return true;
    }
    return false;
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    DirectiveTarget target = action.targetAs(DirectiveTarget.class);
    Document doc = open(target.getUri());
    ListDirective directive = resolve(doc, target);
    ArgumentList elements = directive.elements();
    elements.reorder(sortedOrder(elements));
    EditAssembler edits = new EditAssembler();
    LineRange range = target.getDirective();
    edits.buffer(doc).replace(range.getStart(), range.getEnd(), directive.withElements(elements));
    return apply(edits, "Sorted " + directive.size() + " elements of the " + directive.name() + " directive");
  }

  /** Zero-based old positions in sorted order; ties keep their original order. */
  static int[] sortedOrder(ArgumentList elements) {
    List<Integer> indexes = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) indexes.add(i);
    indexes.sort(Comparator.comparing(i -> ListDirective.sortKey(elements.get(i))));
    return indexes.stream().mapToInt(Integer::intValue).toArray();
  }
}
