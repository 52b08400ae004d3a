package se.alipsa.lgtrefactor.core.refactor.variable;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.model.VariableTarget;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shifts the numbers of a family of variables ({@code S0}, {@code S1}, ...) in one clause.
 * Every variable of the family numbered at or above the one under the cursor moves by
 * {@code delta}, which opens a gap (increment) or closes one (decrement).
 */
public abstract class NumberedVariablesRefactoring extends VariableRefactoring {

  private static final Pattern NUMBERED = Pattern.compile("^([A-Z_][A-Za-z0-9_]*?)(0|[1-9][0-9]*)$");

  private final int delta;

  protected NumberedVariablesRefactoring(RefactorKind kind, int delta) {
    super(kind);
    this.delta = delta;
  }

  @Override
  protected boolean accepts(String text, TermType type, String variable) {
    return renaming(text, variable, delta) != null;
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    VariableTarget target = action.targetAs(VariableTarget.class);
    Document doc = open(target.getUri());
    String text = clauseText(doc, target);
    Map<String, String> mapping = renaming(text, target.getVariable(), delta);
    if (mapping == null) {
      throw RefactorException.precondition("Cannot renumber from " + target.getVariable());
    }
    EditAssembler edits = new EditAssembler();
    LineRange clause = target.getClause();
    edits.buffer(doc).replace(clause.getStart(), clause.getEnd(), VariableScanner.rename(text, mapping));
    return apply(edits, "Renumbered " + String.join(", ", mapping.keySet()));
  }

  /**
   * Old to new names, or {@code null} when {@code variable} is not numbered or the shift would
   * clash with a variable already in the clause.
   */
  static @Nullable Map<String, String> renaming(String clauseText, String variable, int delta) {
    Matcher m = NUMBERED.matcher(variable);
    if (!m.matches()) return null;
    String prefix = m.group(1);
    int from = Integer.parseInt(m.group(2));
    if (from + delta < 0) return null;
    Set<String> names = VariableScanner.variableNames(clauseText);
    if (delta < 0) {
      // the numbers below the cursor variable must leave a gap to close
      for (int n = from + delta; n < from; n++) {
        if (names.contains(prefix + n)) return null;
      }
    }
    Map<String, String> mapping = new LinkedHashMap<>();
    for (String name : names) {
      Matcher nm = NUMBERED.matcher(name);
      if (!nm.matches() || !nm.group(1).equals(prefix)) continue;
      int n = Integer.parseInt(nm.group(2));
      if (n >= from) mapping.put(name, prefix + (n + delta));
    }
    return mapping.isEmpty() ? null : mapping;
  }
}
