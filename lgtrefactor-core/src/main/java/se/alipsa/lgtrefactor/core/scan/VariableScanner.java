package se.alipsa.lgtrefactor.core.scan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Variable tokens in source text, skipping quotes, comments and character codes. */
public final class VariableScanner {

  private static final Pattern VARIABLE_NAME = Pattern.compile("^[A-Z_][A-Za-z0-9_]*$");

  /** A variable occurrence; {@code end} is exclusive. */
  public static final class Token {
    private final String name;
    private final int start;
    private final int end;

    Token(String name, int start, int end) {
      this.name = name;
      this.start = start;
      this.end = end;
    }

    public String getName() { return name; }
    public int getStart() { return start; }
    public int getEnd() { return end; }

    @Override
    public String toString() {
      return name + "@" + start;
    }
  }

  private VariableScanner() {}

  public static boolean isValidVariableName(String name) {
    return name != null && VARIABLE_NAME.matcher(name).matches();
  }

  public static List<Token> tokens(String text) {
    List<Token> tokens = new ArrayList<>();
    for (int i = 0; i < text.length(); i++) {
      int r = TermScanner.regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = text.charAt(i);
      if (TermScanner.isAlnum(c) && i > 0 && TermScanner.isAlnum(text.charAt(i - 1))) continue;
      if (Character.isUpperCase(c) || c == '_') {
        int j = i;
        while (j < text.length() && TermScanner.isAlnum(text.charAt(j))) j++;
        tokens.add(new Token(text.substring(i, j), i, j));
        i = j - 1;
      }
    }
    return tokens;
  }

  /** Distinct variable names in order of first appearance, anonymous {@code _} excluded. */
  public static Set<String> variableNames(String text) {
    Set<String> names = new LinkedHashSet<>();
    for (Token t : tokens(text)) {
      if (!"_".equals(t.name)) names.add(t.name);
    }
    return names;
  }

  public static List<Token> occurrences(String text, String variable) {
    List<Token> found = new ArrayList<>();
    for (Token t : tokens(text)) {
      if (t.name.equals(variable)) found.add(t);
    }
    return found;
  }

  /** Rename variables per the mapping; names not in the mapping are left alone. */
  public static String rename(String text, Map<String, String> mapping) {
    List<Token> tokens = tokens(text);
    StringBuilder sb = new StringBuilder(text);
    for (int k = tokens.size() - 1; k >= 0; k--) {
      Token t = tokens.get(k);
      String to = mapping.get(t.name);
      if (to != null) sb.replace(t.start, t.end, to);
    }
    return sb.toString();
  }

  /** A name based on {@code base} that does not clash with {@code taken}, e.g. {@code Base2}. */
  public static String uniqueName(String base, Set<String> taken) {
    if (!taken.contains(base)) return base;
    int n = 2;
    while (taken.contains(base + n)) n++;
    return base + n;
  }
}
