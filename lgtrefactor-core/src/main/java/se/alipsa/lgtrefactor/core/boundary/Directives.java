package se.alipsa.lgtrefactor.core.boundary;

import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.Set;

/** Classification of directive text ({@code :- name(Args).}), possibly spanning lines. */
public final class Directives {

  public static final Set<String> SCOPE = Set.of("public", "protected", "private");

  /** Directives that describe a single predicate and may follow its scope directive. */
  public static final Set<String> PREDICATE_RELATED = Set.of(
      "mode", "info", "meta_predicate", "meta_non_terminal", "synchronized", "coinductive",
      "multifile", "dynamic", "discontiguous", "uses");

  /** List directives whose first argument holds the list. */
  public static final Set<String> LIST_FIRST_ARGUMENT = Set.of(
      "public", "protected", "private", "dynamic", "discontiguous", "multifile", "synchronized",
      "coinductive");

  /** List directives whose second argument holds the list. */
  public static final Set<String> LIST_SECOND_ARGUMENT = Set.of("uses", "use_module", "alias");

  private static final Set<String> ENTITY_LEVEL = Set.of(
      "object", "protocol", "category", "end_object", "end_protocol", "end_category",
      "initialization", "set_logtalk_flag", "threaded", "built_in", "include", "encoding");

  private Directives() {}

  public static boolean isDirective(String text) {
    return text.stripLeading().startsWith(":-");
  }

  /** Directive name, or an empty string when the text is not a directive. */
  public static String name(String text) {
    String t = text.stripLeading();
    if (!t.startsWith(":-")) return "";
    int i = 2;
    while (i < t.length() && Character.isWhitespace(t.charAt(i))) i++;
    int start = i;
    while (i < t.length() && TermScanner.isAlnum(t.charAt(i))) i++;
    return t.substring(start, i);
  }

  /** Offset in {@code text} of the parenthesis opening the directive arguments, or -1. */
  public static int openParen(String text) {
    int colon = text.indexOf(":-");
    if (colon < 0) return -1;
    int i = colon + 2;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
    while (i < text.length() && TermScanner.isAlnum(text.charAt(i))) i++;
    return i < text.length() && text.charAt(i) == '(' ? i : -1;
  }

  /** The directive's arguments, or {@code null} for a directive without parentheses or unbalanced text. */
  public static @Nullable ArgumentList arguments(String text) {
    int open = openParen(text);
    if (open < 0) return null;
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    if (close < 0) return null;
    return ArgumentList.parse(text.substring(open + 1, close));
  }

  public static boolean isScope(String text) {
    return SCOPE.contains(name(text));
  }

  public static boolean isEntityOpening(String text) {
    String n = name(text);
    return n.equals("object") || n.equals("protocol") || n.equals("category");
  }

  public static boolean isEntityEnding(String text) {
    return name(text).startsWith("end_");
  }

  /** Entity info/1 ({@code :- info([...])}) as opposed to predicate info/2. */
  public static boolean isEntityInfo(String text) {
    if (!"info".equals(name(text))) return false;
    ArgumentList args = arguments(text);
    return args != null && args.size() == 1 && args.get(0).startsWith("[");
  }

  public static boolean isEntityDirective(String text) {
    String n = name(text);
    if (ENTITY_LEVEL.contains(n)) return true;
    if (isEntityInfo(text)) return true;
    // dynamic. without arguments marks the entity itself as dynamic
    return n.equals("dynamic") && openParen(text) < 0;
  }
}
