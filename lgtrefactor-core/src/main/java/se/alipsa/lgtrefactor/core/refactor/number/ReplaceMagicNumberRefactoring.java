package se.alipsa.lgtrefactor.core.refactor.number;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.ClauseBody;
import se.alipsa.lgtrefactor.core.boundary.ClauseHead;
import se.alipsa.lgtrefactor.core.boundary.CursorInspector;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.edit.LineEditBuffer;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.NumberTarget;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.TermType;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.refactor.Validators;
import se.alipsa.lgtrefactor.core.scan.NumberLiterals;
import se.alipsa.lgtrefactor.core.scan.TermScanner;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces a numeric literal in a rule body with a variable bound by a call to a new fact
 * predicate, e.g. {@code X > 100} becomes {@code max_value(MaxValue), X > MaxValue} plus
 * {@code max_value(100).} and, unless the predicate is local, its scope, mode and info directives.
 */
public final class ReplaceMagicNumberRefactoring extends AbstractRefactoring {

  private static final Logger logger = LogManager.getLogger(ReplaceMagicNumberRefactoring.class);

  static final String LOCAL = "local";
  static final List<String> SCOPES = List.of("public", "protected", "private", LOCAL);

  public ReplaceMagicNumberRefactoring() {
    super(RefactorKind.REPLACE_MAGIC_NUMBER);
  }

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (!range.isSingleLine() || range.start.line >= doc.lineCount()) return List.of();
    String line = doc.lineAt(range.start.line);
    if (TermScanner.isCommentOrBlank(line)) return List.of();
    int[] bounds = literalBounds(line, range);
    if (bounds == null || CursorInspector.inCommentOrQuote(line, bounds[0])) return List.of();
    Optional<LineRange> clause = TermBoundaries.enclosingTerm(doc, range.start.line);
    if (clause.isEmpty() || !clause.get().isTerminated()) return List.of();
    String text = TermBoundaries.termText(doc, clause.get());
    if (TermBoundaries.classify(text) != TermType.PREDICATE_RULE) return List.of();
    Optional<ClauseBody> body = ClauseBody.of(text);
    int offset = TermBoundaries.offsetIn(doc, clause.get(), range.start.line, bounds[0]);
    if (body.isEmpty() || body.get().goalIndexAt(offset) < 0) return List.of();
    Range literal = Range.of(range.start.line, bounds[0], range.start.line, bounds[1]);
    return offer(new NumberTarget(doc.uri(), literal, line.substring(bounds[0], bounds[1]), clause.get()));
  }

  /** Literal under the caret, or the selection when it is exactly one literal. */
  private static int @Nullable [] literalBounds(String line, Range range) {
    if (range.isEmpty()) return NumberLiterals.numberAt(line, range.start.column);
    int from = Math.min(range.start.column, line.length());
    int to = Math.min(range.end.column, line.length());
    while (from < to && Character.isWhitespace(line.charAt(from))) from++;
    while (to > from && Character.isWhitespace(line.charAt(to - 1))) to--;
    if (from >= to) return null;
    int[] bounds = NumberLiterals.numberAt(line, from);
    return bounds != null && bounds[0] == from && bounds[1] == to ? bounds : null;
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    NumberTarget target = action.targetAs(NumberTarget.class);
    Document doc = open(target.getUri());
    LineRange clause = target.getClause();
    Range literal = target.getLiteralRange();
    if (clause.getEnd() >= doc.lineCount() || !target.getLiteral().equals(doc.getText(literal))) {
      throw RefactorException.precondition("The number " + target.getLiteral() + " is no longer there");
    }
    String text = TermBoundaries.termText(doc, clause);
    ClauseBody body = ClauseBody.of(text)
        .orElseThrow(() -> RefactorException.precondition("The number is not inside a rule body"));
    int offset = TermBoundaries.offsetIn(doc, clause, literal.start.line, literal.start.column);
    int goal = body.goalIndexAt(offset);
    if (goal < 0) throw RefactorException.precondition("The number is not inside a rule body");

    Optional<String> name = promptText("Name of the predicate holding " + target.getLiteral(), "magic_number",
        Validators.atomName());
    if (name.isEmpty()) return RefactorResult.cancelled();
    Optional<String> scope = promptChoice("Scope of " + name.get().trim() + "/1", SCOPES);
    if (scope.isEmpty()) return RefactorResult.cancelled();

    String predicate = name.get().trim();
    String variable = VariableScanner.uniqueName(camelCase(predicate), VariableScanner.variableNames(text));
    String replaced = text.substring(0, offset) + variable
        + text.substring(offset + target.getLiteral().length());
    String rewritten = ClauseBody.insertGoal(replaced, body.goalStart(goal), predicate + "(" + variable + ")");

    int runStart = firstClauseOfRun(doc, clause);
    String indent = TermScanner.indentOf(doc.lineAt(runStart));
    String block = declarations(predicate, scope.get(), NumberLiterals.modeType(target.getLiteral()), variable,
        target.getLiteral(), indent, env().settings().indent());
    logger.debug("Declaring {}/1 before line {} of {}", predicate, runStart, doc.uri());

    EditAssembler edits = new EditAssembler();
    LineEditBuffer buffer = edits.buffer(doc);
    buffer.insertBefore(runStart, block);
    buffer.replace(clause.getStart(), clause.getEnd(), rewritten);
    return apply(edits, "Replaced " + target.getLiteral() + " with " + predicate + "/1");
  }

  /**
   * The scope, mode and info directives and the fact for the new predicate, followed by a blank
   * line. A local predicate gets only the fact.
   */
  static String declarations(String predicate, String scope, String modeType, String variable, String literal,
                             String indent, String step) {
    List<String> lines = new ArrayList<>();
    if (!LOCAL.equals(scope)) {
      lines.add(indent + ":- " + scope + "(" + predicate + "/1).");
      lines.add(indent + ":- mode(" + predicate + "(" + modeType + "), zero_or_one).");
      lines.add(indent + ":- info(" + predicate + "/1, [");
      lines.add(indent + step + "comment is '',");
      lines.add(indent + step + "argnames is ['" + variable + "']");
      lines.add(indent + "]).");
      lines.add("");
    }
    lines.add(indent + predicate + "(" + literal + ").");
    lines.add("");
    return String.join("\n", lines);
  }

  /** {@code max_value} becomes {@code MaxValue}. */
  static String camelCase(String atom) {
    StringBuilder sb = new StringBuilder();
    for (String part : atom.split("_")) {
      if (part.isEmpty()) continue;
      sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
    }
    return sb.length() == 0 ? "Value" : sb.toString();
  }

  /** Start line of the first clause in the run of consecutive clauses for the same predicate. */
  static int firstClauseOfRun(Document doc, LineRange clause) {
    Optional<Indicator> indicator = ClauseHead.parse(TermBoundaries.termText(doc, clause)).map(ClauseHead::indicator);
    int first = clause.getStart();
    if (indicator.isEmpty()) return first;
    int line = first - 1;
    while (line >= 0) {
      if (TermScanner.isCommentOrBlank(doc.lineAt(line))) {
        line--;
        continue;
      }
      Optional<LineRange> previous = TermBoundaries.enclosingTerm(doc, line);
      if (previous.isEmpty()) break;
      Optional<Indicator> other = ClauseHead.parse(TermBoundaries.termText(doc, previous.get()))
          .map(ClauseHead::indicator);
      if (!indicator.equals(other)) break;
      first = previous.get().getStart();
      line = first - 1;
    }
    return first;
  }
}
