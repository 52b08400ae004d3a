package se.alipsa.lgtrefactor.core.scan;

import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/** Recognition of numeric literals as written in source text. */
public final class NumberLiterals {

  private static final Pattern NUMBER =
      Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
  private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

  private NumberLiterals() {}

  public static boolean isNumericLiteral(String text) {
    if (text == null) return false;
    String t = text.trim();
    return !t.isEmpty() && NUMBER.matcher(t).matches();
  }

  public static boolean isInteger(String text) {
    return text != null && INTEGER.matcher(text.trim()).matches();
  }

  /** Mode template argument for a literal: {@code ?integer} or {@code ?float}. */
  public static String modeType(String literal) {
    return isInteger(literal) ? "?integer" : "?float";
  }

  /**
   * Bounds {@code [start, end)} of the unsigned number token covering {@code column}, or
   * {@code null} when the column is not on a number. Digits that are part of a name are ignored.
   */
  public static int @Nullable [] numberAt(String line, int column) {
    if (column < 0 || column > line.length()) return null;
    int start = Math.min(column, line.length() - 1);
    if (start < 0) return null;
    if (!isNumberChar(line.charAt(start)) && start > 0 && isNumberChar(line.charAt(start - 1))) start--;
    if (!isNumberChar(line.charAt(start))) return null;
    while (start > 0 && isNumberChar(line.charAt(start - 1))) start--;
    // exponent signs
    while (start > 1 && (line.charAt(start - 1) == '-' || line.charAt(start - 1) == '+')
        && (line.charAt(start - 2) == 'e' || line.charAt(start - 2) == 'E')) {
      start -= 2;
      while (start > 0 && isNumberChar(line.charAt(start - 1))) start--;
    }
    int end = column;
    while (end < line.length() && (isNumberChar(line.charAt(end))
        || ((line.charAt(end) == '-' || line.charAt(end) == '+') && end > 0
            && (line.charAt(end - 1) == 'e' || line.charAt(end - 1) == 'E')))) {
      end++;
    }
    while (end > start && line.charAt(end - 1) == '.') end--;
    if (start > 0 && (TermScanner.isAlnum(line.charAt(start - 1)))) return null;
    String token = line.substring(start, end);
    if (!isNumericLiteral(token) || !Character.isDigit(token.charAt(0)) && token.charAt(0) != '.') return null;
    return new int[] {start, end};
  }

  private static boolean isNumberChar(char c) {
    return Character.isDigit(c) || c == '.' || c == 'e' || c == 'E';
  }
}
