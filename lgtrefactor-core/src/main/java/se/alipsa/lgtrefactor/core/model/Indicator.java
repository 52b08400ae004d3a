package se.alipsa.lgtrefactor.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A predicate ({@code name/arity}) or non-terminal ({@code name//arity}) indicator. */
public final class Indicator {

  private static final Pattern INDICATOR = Pattern.compile("^\\s*([a-z][A-Za-z0-9_]*|'(?:[^'\\\\]|\\\\.|'')*')\\s*(//?)\\s*(\\d+)\\s*$");

  private final String name;
  private final int arity;
  private final boolean nonTerminal;

  public Indicator(String name, int arity, boolean nonTerminal) {
    this.name = Objects.requireNonNull(name, "name");
    if (arity < 0) throw new IllegalArgumentException("Negative arity " + arity + " for " + name);
    this.arity = arity;
    this.nonTerminal = nonTerminal;
  }

  public static Indicator predicate(String name, int arity) {
    return new Indicator(name, arity, false);
  }

  public static Indicator nonTerminal(String name, int arity) {
    return new Indicator(name, arity, true);
  }

  public static Optional<Indicator> parse(String text) {
    if (text == null) return Optional.empty();
    Matcher m = INDICATOR.matcher(text);
    if (!m.matches()) return Optional.empty();
    return Optional.of(new Indicator(m.group(1), Integer.parseInt(m.group(3)), m.group(2).length() == 2));
  }

  public String getName() { return name; }

  public int getArity() { return arity; }

  public boolean isNonTerminal() { return nonTerminal; }

  public String separator() { return nonTerminal ? "//" : "/"; }

  public Indicator withArity(int newArity) {
    return new Indicator(name, newArity, nonTerminal);
  }

  public Indicator asNonTerminal(boolean nt) {
    return nt == nonTerminal ? this : new Indicator(name, arity, nt);
  }

  /** The kind of callable: "predicate" or "non-terminal". */
  public String describe() {
    return nonTerminal ? "non-terminal" : "predicate";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Indicator that)) return false;
    return arity == that.arity && nonTerminal == that.nonTerminal && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arity, nonTerminal);
  }

  @Override
  public String toString() {
    return name + separator() + arity;
  }
}
