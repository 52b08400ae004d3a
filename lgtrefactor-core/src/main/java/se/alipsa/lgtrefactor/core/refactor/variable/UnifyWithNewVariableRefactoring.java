package se.alipsa.lgtrefactor.core.refactor.variable;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.ClauseBody;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces a term selected in a rule body with a new variable and adds a {@code Var = Term}
 * goal before the goal that held the term.
 */
public final class UnifyWithNewVariableRefactoring extends AbstractRefactoring {

  public UnifyWithNewVariableRefactoring() {
    super(RefactorKind.UNIFY_WITH_NEW_VARIABLE);
  }

  /** A selected term, as offsets into its clause text. */
  static final class Selected {
    final LineRange clause;
    final String text;
    final ClauseBody body;
    final int from;
    final int to;

    Selected(LineRange clause, String text, ClauseBody body, int from, int to) {
      this.clause = clause;
      this.text = text;
      this.body = body;
      this.from = from;
      this.to = to;
    }

    String term() {
      return text.substring(from, to);
    }
  }

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (range.isEmpty()) return List.of();
    return select(doc, range).isPresent() ? offer(new SelectionTarget(doc.uri(), range)) : List.of();
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    SelectionTarget target = action.targetAs(SelectionTarget.class);
    Document doc = open(target.getUri());
    Selected selected = select(doc, target.getSelection())
        .orElseThrow(() -> RefactorException.precondition("Select a single term inside a rule body"));
    Set<String> taken = VariableScanner.variableNames(selected.text);
    Optional<String> name = promptText("Name of the new variable", VariableScanner.uniqueName("NewVar", taken),
        v -> {
          String t = v.trim();
          if (!VariableScanner.isValidVariableName(t)) return "Must be a valid variable name";
          return taken.contains(t) ? t + " is already used in this clause" : null;
        });
    if (name.isEmpty()) return RefactorResult.cancelled();
    String variable = name.get().trim();
    String rewritten = unify(selected, variable);
    EditAssembler edits = new EditAssembler();
    edits.buffer(doc).replace(selected.clause.getStart(), selected.clause.getEnd(), rewritten);
    return apply(edits, "Unified " + selected.term() + " with new variable " + variable);
  }

  static String unify(Selected selected, String variable) {
    String text = selected.text;
    int goal = selected.body.goalStart(selected.body.goalIndexAt(selected.from));
    String replaced = text.substring(0, selected.from) + variable + text.substring(selected.to);
    return ClauseBody.insertGoal(replaced, goal, variable + " = " + selected.term());
  }

  /**
   * The selection as a term inside one goal of a rule body. Surrounding layout is ignored; a
   * whole goal, a variable or several terms are not offered.
   */
  static Optional<Selected> select(Document doc, Range range) {
    if (range.end.line >= doc.lineCount()) return Optional.empty();
    Optional<LineRange> clause = TermBoundaries.enclosingTerm(doc, range.start.line);
    if (clause.isEmpty() || !clause.get().isTerminated() || !clause.get().contains(range.end.line)) {
      return Optional.empty();
    }
    String text = TermBoundaries.termText(doc, clause.get());
    if (TermBoundaries.classify(text) != TermType.PREDICATE_RULE) return Optional.empty();
    Optional<ClauseBody> body = ClauseBody.of(text);
    if (body.isEmpty()) return Optional.empty();
    int from = TermBoundaries.offsetIn(doc, clause.get(), range.start.line, range.start.column);
    int to = TermBoundaries.offsetIn(doc, clause.get(), range.end.line, range.end.column);
    while (from < to && Character.isWhitespace(text.charAt(from))) from++;
    while (to > from && Character.isWhitespace(text.charAt(to - 1))) to--;
    if (from >= to || !body.get().inBody(from) || !body.get().inBody(to - 1)) return Optional.empty();
    int goal = body.get().goalIndexAt(from);
    if (goal < 0 || goal != body.get().goalIndexAt(to - 1)) return Optional.empty();
    // a name followed by its arguments is not a term on its own
    if (to < text.length() && text.charAt(to) == '(') return Optional.empty();
    String term = text.substring(from, to);
    if (!TermScanner.isBalanced(term) || ArgumentList.parse(term).size() != 1) return Optional.empty();
    if (VariableScanner.isValidVariableName(term)) return Optional.empty();
    if (term.equals(body.get().goals().get(goal))) return Optional.empty();
    return Optional.of(new Selected(clause.get(), text, body.get(), from, to));
  }
}
