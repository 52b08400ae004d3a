package se.alipsa.lgtrefactor.core.refactor.variable;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.ClauseBody;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.model.VariableTarget;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.NumberLiterals;
import se.alipsa.lgtrefactor.core.scan.TermScanner;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.Map;
import java.util.Optional;

/**
 * Replaces a variable bound by a {@code Var = Term} goal with the term itself and drops the
 * goal. A rule left without goals becomes a fact.
 */
public final class InlineVariableRefactoring extends VariableRefactoring {

  public InlineVariableRefactoring() {
    super(RefactorKind.INLINE_VARIABLE);
  }

  /** The unification goal binding a variable, and the term it is bound to. */
  static final class Binding {
    final int goalIndex;
    final String term;

    Binding(int goalIndex, String term) {
      this.goalIndex = goalIndex;
      this.term = term;
    }
  }

  @Override
  protected boolean accepts(String text, TermType type, String variable) {
    if (type != TermType.PREDICATE_RULE) return false;
    return ClauseBody.of(text).map(b -> findBinding(b.goals(), variable) != null).orElse(false);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    VariableTarget target = action.targetAs(VariableTarget.class);
    Document doc = open(target.getUri());
    String text = clauseText(doc, target);
    String rewritten = inline(text, target.getVariable())
        .orElseThrow(() -> RefactorException.precondition("No unification binds " + target.getVariable()));
    EditAssembler edits = new EditAssembler();
    LineRange clause = target.getClause();
    edits.buffer(doc).replace(clause.getStart(), clause.getEnd(), rewritten);
    return apply(edits, "Inlined variable " + target.getVariable());
  }

  /** The clause with {@code variable} inlined, or empty when no goal binds it. */
  static Optional<String> inline(String text, String variable) {
    Optional<ClauseBody> body = ClauseBody.of(text);
    if (body.isEmpty()) return Optional.empty();
    ArgumentList goals = body.get().goals();
    Binding binding = findBinding(goals, variable);
    if (binding == null) return Optional.empty();
    goals.remove(binding.goalIndex);
    String withoutGoal;
    if (goals.isEmpty()) {
      // the neck is the two characters before the body
      withoutGoal = text.substring(0, body.get().getBodyStart() - 2).stripTrailing()
          + text.substring(body.get().getBodyEnd());
    } else {
      withoutGoal = body.get().withGoals(goals);
    }
    String replacement = needsParentheses(binding.term) ? "(" + binding.term + ")" : binding.term;
    return Optional.of(VariableScanner.rename(withoutGoal, Map.of(variable, replacement)));
  }

  static @Nullable Binding findBinding(ArgumentList goals, String variable) {
    for (int i = 0; i < goals.size(); i++) {
      String goal = goals.get(i);
      int eq = unificationOperator(goal);
      if (eq < 0) continue;
      String left = goal.substring(0, eq).trim();
      String right = goal.substring(eq + 1).trim();
      if (left.equals(variable) && !right.isEmpty() && VariableScanner.occurrences(right, variable).isEmpty()) {
        return new Binding(i, right);
      }
      if (right.equals(variable) && !left.isEmpty() && VariableScanner.occurrences(left, variable).isEmpty()) {
        return new Binding(i, left);
      }
    }
    return null;
  }

  /** Offset of a top-level {@code =} that is not part of a longer operator, or -1. */
  static int unificationOperator(String goal) {
    int depth = 0;
    for (int i = 0; i < goal.length(); i++) {
      int r = TermScanner.regionEnd(goal, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = goal.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (depth > 0) depth--;
      } else if (c == '=' && depth == 0) {
        boolean before = i > 0 && TermScanner.isSymbolChar(goal.charAt(i - 1));
        boolean after = i + 1 < goal.length() && TermScanner.isSymbolChar(goal.charAt(i + 1));
        if (!before && !after) return i;
      }
    }
    return -1;
  }

  /** True when the term has a top-level operator and must be bracketed where it is inlined. */
  static boolean needsParentheses(String term) {
    if (NumberLiterals.isNumericLiteral(term)) return false;
    int depth = 0;
    for (int i = 0; i < term.length(); i++) {
      int r = TermScanner.regionEnd(term, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = term.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (depth > 0) depth--;
      } else if (depth == 0 && (Character.isWhitespace(c) || c == ',' || c == '|' || TermScanner.isSymbolChar(c))) {
        return true;
      }
    }
    return false;
  }
}
