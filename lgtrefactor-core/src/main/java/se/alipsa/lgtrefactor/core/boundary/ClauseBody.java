package se.alipsa.lgtrefactor.core.boundary;

import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.Optional;

/**
 * The body of a rule or grammar rule split into its top-level goals. Offsets are relative to
 * the clause text; the body runs from just after the neck to the terminating period.
 */
public final class ClauseBody {

  private final String text;
  private final int bodyStart;
  private final int bodyEnd;
  private final ArgumentList goals;

  private ClauseBody(String text, int bodyStart, int bodyEnd) {
    this.text = text;
    this.bodyStart = bodyStart;
    this.bodyEnd = bodyEnd;
    this.goals = ArgumentList.parse(text.substring(bodyStart, bodyEnd));
  }

  /** Empty for facts, directives and unterminated clauses. */
  public static Optional<ClauseBody> of(String clauseText) {
    int start = TermBoundaries.bodyStart(clauseText);
    if (start < 0) return Optional.empty();
    int end = TermScanner.findTerminator(clauseText, start);
    if (end < 0) return Optional.empty();
    return Optional.of(new ClauseBody(clauseText, start, end));
  }

  public String getText() { return text; }

  public int getBodyStart() { return bodyStart; }

  /** Offset of the terminating period. */
  public int getBodyEnd() { return bodyEnd; }

  public ArgumentList goals() { return goals.copy(); }

  /** Head and neck, e.g. {@code "foo(X) :-"}. */
  public String headText() { return text.substring(0, bodyStart); }

  public boolean inBody(int offset) {
    return offset >= bodyStart && offset < bodyEnd;
  }

  /** Index of the goal covering {@code offset}, or -1 when the offset is outside the body. */
  public int goalIndexAt(int offset) {
    if (!inBody(offset) || goals.isEmpty()) return -1;
    int rel = offset - bodyStart;
    for (int i = goals.size() - 1; i >= 0; i--) {
      if (rel >= goals.offsetOf(i)) return i;
    }
    return 0;
  }

  /** Offset in the clause text where goal {@code index} starts. */
  public int goalStart(int index) {
    return bodyStart + goals.offsetOf(index);
  }

  /**
   * {@code clauseText} with {@code goal} inserted at {@code offset}, which must be the start of
   * an existing body goal. A goal on its own line gets its own line with the same indentation.
   */
  public static String insertGoal(String clauseText, int offset, String goal) {
    int lineStart = offset;
    while (lineStart > 0 && (clauseText.charAt(lineStart - 1) == ' ' || clauseText.charAt(lineStart - 1) == '\t')) {
      lineStart--;
    }
    String separator = lineStart > 0 && clauseText.charAt(lineStart - 1) == '\n'
        ? ",\n" + clauseText.substring(lineStart, offset)
        : ", ";
    return clauseText.substring(0, offset) + goal + separator + clauseText.substring(offset);
  }

  /** The clause with its body replaced by {@code newGoals}. */
  public String withGoals(ArgumentList newGoals) {
    return text.substring(0, bodyStart) + newGoals.render() + text.substring(bodyEnd);
  }
}
