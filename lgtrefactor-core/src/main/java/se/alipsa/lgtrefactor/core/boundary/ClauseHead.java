package se.alipsa.lgtrefactor.core.boundary;

import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.Optional;

/**
 * The head of a clause or grammar rule: an optional {@code Entity::} qualifier (multifile
 * clauses), a name and its arguments.
 */
public final class ClauseHead {

  private final String name;
  private final ArgumentList args;
  private final int nameStart;
  private final int end;
  private final boolean grammarRule;
  private final boolean rule;

  private ClauseHead(String name, ArgumentList args, int nameStart, int end, boolean grammarRule, boolean rule) {
    this.name = name;
    this.args = args;
    this.nameStart = nameStart;
    this.end = end;
    this.grammarRule = grammarRule;
    this.rule = rule;
  }

  public static Optional<ClauseHead> parse(String clauseText) {
    if (Directives.isDirective(clauseText)) return Optional.empty();
    int i = skipLayout(clauseText, 0);
    int nameStart = i;
    int nameEnd = atomEnd(clauseText, i);
    if (nameEnd < 0) return Optional.empty();
    i = nameEnd;
    if (i < clauseText.length() && clauseText.charAt(i) == '(') {
      int close = TermScanner.findMatchingClose(clauseText, i, '(', ')');
      if (close < 0) return Optional.empty();
      i = close + 1;
    }
    if (TermScanner.startsWith(clauseText, i, "::")) {
      nameStart = i + 2;
      nameEnd = atomEnd(clauseText, nameStart);
      if (nameEnd < 0) return Optional.empty();
      i = nameEnd;
    }
    String name = clauseText.substring(nameStart, nameEnd);
    ArgumentList args = ArgumentList.empty();
    int end = nameEnd;
    if (nameEnd < clauseText.length() && clauseText.charAt(nameEnd) == '(') {
      int close = TermScanner.findMatchingClose(clauseText, nameEnd, '(', ')');
      if (close < 0) return Optional.empty();
      args = ArgumentList.parse(clauseText.substring(nameEnd + 1, close));
      end = close + 1;
    }
    int next = skipLayout(clauseText, end);
    boolean grammar = TermScanner.startsWith(clauseText, next, "-->");
    boolean rule = TermScanner.startsWith(clauseText, next, ":-");
    boolean fact = next < clauseText.length() && clauseText.charAt(next) == '.';
    if (!grammar && !rule && !fact && !TermScanner.startsWith(clauseText, next, ",")) return Optional.empty();
    return Optional.of(new ClauseHead(name, args, nameStart, end, grammar, rule));
  }

  private static int atomEnd(String text, int i) {
    if (i >= text.length() || !Character.isLowerCase(text.charAt(i))) return -1;
    while (i < text.length() && TermScanner.isAlnum(text.charAt(i))) i++;
    return i;
  }

  private static int skipLayout(String text, int i) {
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '%' || (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*')) {
        i = TermScanner.regionEnd(text, i) + 1;
      } else {
        break;
      }
    }
    return i;
  }

  public String getName() { return name; }

  public int arity() { return args.size(); }

  public ArgumentList getArgs() { return args.copy(); }

  public int getNameStart() { return nameStart; }

  /** Offset just past the head. */
  public int getEnd() { return end; }

  public boolean isGrammarRule() { return grammarRule; }

  public boolean isRule() { return rule; }

  public Indicator indicator() {
    return new Indicator(name, args.size(), grammarRule);
  }

  /** Exact match on name and arity; non-terminals must be grammar rules and predicates must not. */
  public boolean defines(Indicator indicator) {
    return name.equals(indicator.getName()) && args.size() == indicator.getArity()
        && grammarRule == indicator.isNonTerminal();
  }
}
