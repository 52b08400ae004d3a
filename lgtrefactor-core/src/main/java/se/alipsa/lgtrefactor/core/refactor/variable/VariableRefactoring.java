package se.alipsa.lgtrefactor.core.refactor.variable;

import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.boundary.CursorInspector;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.model.VariableTarget;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.List;
import java.util.Optional;

/** Refactorings offered on a variable inside a clause. */
public abstract class VariableRefactoring extends AbstractRefactoring {

  protected VariableRefactoring(RefactorKind kind) {
    super(kind);
  }

  /** Whether the refactoring applies to {@code variable} in the clause {@code text}. */
  protected abstract boolean accepts(String text, TermType type, String variable);

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (!range.isEmpty()) return List.of();
    Position pos = range.start;
    String line = doc.lineAt(pos.line);
    if (TermScanner.isCommentOrBlank(line)) return List.of();
    Optional<String> variable = CursorInspector.variableAt(line, pos.column);
    if (variable.isEmpty() || "_".equals(variable.get())) return List.of();
    Optional<LineRange> clause = TermBoundaries.enclosingTerm(doc, pos.line);
    if (clause.isEmpty() || !clause.get().isTerminated()) return List.of();
    String text = TermBoundaries.termText(doc, clause.get());
    TermType type = TermBoundaries.classify(text);
    if (type.isDirective() || !accepts(text, type, variable.get())) return List.of();
    return offer(new VariableTarget(doc.uri(), pos, variable.get(), clause.get()));
  }

  /** The clause text at the target, checked to still hold the variable. */
  protected String clauseText(Document doc, VariableTarget target) throws RefactorException {
    LineRange clause = target.getClause();
    if (clause.getEnd() >= doc.lineCount()) {
      throw RefactorException.precondition("The clause containing " + target.getVariable() + " is no longer there");
    }
    String text = TermBoundaries.termText(doc, clause);
    TermType type = TermBoundaries.classify(text);
    if (type.isDirective() || !accepts(text, type, target.getVariable())) {
      throw RefactorException.precondition(kind().title() + " does not apply to " + target.getVariable() + " here");
    }
    return text;
  }
}
