package se.alipsa.lgtrefactor.core.refactor.extract;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.ClauseBody;
import se.alipsa.lgtrefactor.core.boundary.ClauseHead;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.edit.LineEditBuffer;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.refactor.Validators;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces goals selected in a rule body with a call to a new predicate. The new predicate's
 * arguments are the variables the selected goals share with the rest of the clause, in order of
 * first appearance; its clause is added after the enclosing clause.
 */
public final class ExtractPredicateRefactoring extends AbstractRefactoring {

  public ExtractPredicateRefactoring() {
    super(RefactorKind.EXTRACT_PREDICATE);
  }

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (range.isEmpty()) return List.of();
    Optional<LineRange> clause = TermBoundaries.enclosingTerm(doc, range.start.line);
    if (clause.isEmpty() || !clause.get().contains(range.end.line)) return List.of();
    String text = TermBoundaries.termText(doc, clause.get());
    TermType type = TermBoundaries.classify(text);
    if (type != TermType.PREDICATE_RULE) return List.of();
    Optional<ClauseBody> body = ClauseBody.of(text);
    if (body.isEmpty() || !body.get().inBody(TermBoundaries.offsetIn(doc, clause.get(), range.start.line, range.start.column))) {
      return List.of();
    }
    return offer(new SelectionTarget(doc.uri(), range));
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    SelectionTarget target = action.targetAs(SelectionTarget.class);
    Document doc = open(target.getUri());
    Range sel = target.getSelection();
    LineRange clause = TermBoundaries.enclosingTerm(doc, sel.start.line)
        .filter(c -> c.contains(sel.end.line) && c.isTerminated())
        .orElseThrow(() -> RefactorException.precondition("Select goals inside a single rule body"));
    String text = TermBoundaries.termText(doc, clause);
    ClauseBody body = ClauseBody.of(text)
        .orElseThrow(() -> RefactorException.precondition("Goals can only be extracted from a rule body"));
    int from = TermBoundaries.offsetIn(doc, clause, sel.start.line, sel.start.column);
    int to = Math.min(TermBoundaries.offsetIn(doc, clause, sel.end.line, sel.end.column), body.getBodyEnd());
    if (!body.inBody(from) || to <= from) {
      throw RefactorException.precondition("Select goals inside a single rule body");
    }
    String selected = text.substring(from, to);
    String goals = selected.trim();
    String trailing = "";
    if (goals.endsWith(",")) {
      trailing = ",";
      goals = goals.substring(0, goals.length() - 1).trim();
    }
    if (goals.isEmpty() || !TermScanner.isBalanced(goals) || ArgumentList.parse(goals).isEmpty()) {
      throw RefactorException.precondition("The selection is not a complete sequence of goals");
    }

    String rest = text.substring(0, from) + text.substring(to);
    Set<String> restVars = VariableScanner.variableNames(rest);
    List<String> shared = new ArrayList<>();
    for (String v : VariableScanner.variableNames(goals)) {
      if (restVars.contains(v)) shared.add(v);
    }
    Optional<String> name = promptText("Name of the new predicate", "extracted", Validators.atomName());
    if (name.isEmpty()) return RefactorResult.cancelled();
    String call = shared.isEmpty() ? name.get().trim() : name.get().trim() + "(" + String.join(", ", shared) + ")";

    int lead = selected.indexOf(selected.trim());
    String layoutAfter = selected.substring(lead + selected.trim().length());
    String rewritten = text.substring(0, from) + selected.substring(0, lead) + call + trailing + layoutAfter
        + text.substring(to);
    String clauseIndent = TermScanner.indentOf(doc.lineAt(clause.getStart()));
    String goalIndent = clauseIndent + env().settings().indent();
    String newClause = clauseIndent + call + " :-\n" + indentGoals(goals, goalIndent) + ".";

    EditAssembler edits = new EditAssembler();
    LineEditBuffer buffer = edits.buffer(doc);
    buffer.replace(clause.getStart(), clause.getEnd(), rewritten);
    buffer.insertBefore(clause.getEnd() + 1, "\n" + newClause);
    Optional<ClauseHead> head = ClauseHead.parse(text);
    String origin = head.map(h -> h.indicator().toString()).orElse("clause");
    return apply(edits, "Extracted predicate " + name.get().trim() + "/" + shared.size() + " from " + origin);
  }

  /** Goals one per original line: the first line as is, the rest with their shared indentation removed. */
  static String indentGoals(String goals, String indent) {
    String[] lines = goals.split("\n", -1);
    if (lines.length == 1) return indent + goals.trim();
    StringBuilder tail = new StringBuilder();
    for (int i = 1; i < lines.length; i++) {
      if (i > 1) tail.append('\n');
      tail.append(lines[i]);
    }
    String stripped = SelectionValidator.stripCommonIndent(tail.toString());
    return indent + lines[0].trim() + "\n"
        + SelectionValidator.indent(stripped, indent);
  }
}
