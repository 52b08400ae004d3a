package se.alipsa.lgtrefactor.core.scan;

import java.util.List;

/**
 * Quote and nesting aware character walker over source text.
 * <p>
 * Every scan in the engine goes through {@link #regionEnd(CharSequence, int)} so quoted atoms,
 * strings, back-quoted text, {@code 0'c} character codes and comments are skipped the same way
 * everywhere. Nothing here throws on malformed input: unbalanced text yields {@code -1} or a
 * best-effort split.
 */
public final class TermScanner {

  private static final String SYMBOL_CHARS = "+-*/\\^<>=~:.?@#&$";

  private TermScanner() {}

  /**
   * If {@code i} starts a quoted region or comment, returns the index of its last character,
   * otherwise {@code -1}. Quoted text does not run past the end of its line.
   */
  public static int regionEnd(CharSequence s, int i) {
    int len = s.length();
    char c = s.charAt(i);
    if (c == '\'' && isCharCodeQuote(s, i)) {
      if (i + 1 >= len) return i;
      char n = s.charAt(i + 1);
      if (n == '\\' && i + 2 < len) return i + 2;
      if (n == '\'' && i + 2 < len && s.charAt(i + 2) == '\'') return i + 2;
      return i + 1;
    }
    if (c == '\'' || c == '"' || c == '`') {
      int j = i + 1;
      while (j < len) {
        char d = s.charAt(j);
        if (d == '\n') return j - 1;
        if (d == '\\') {
          j += 2;
          continue;
        }
        if (d == c) {
          if (j + 1 < len && s.charAt(j + 1) == c) {
            j += 2;
            continue;
          }
          return j;
        }
        j++;
      }
      return len - 1;
    }
    if (c == '%') {
      int nl = indexOf(s, '\n', i);
      return nl < 0 ? len - 1 : nl - 1;
    }
    if (c == '/' && i + 1 < len && s.charAt(i + 1) == '*') {
      int close = indexOf(s, "*/", i + 2);
      return close < 0 ? len - 1 : close + 1;
    }
    return -1;
  }

  /** {@code 0'c} character code notation: a quote right after a standalone zero. */
  public static boolean isCharCodeQuote(CharSequence s, int i) {
    return i > 0 && s.charAt(i - 1) == '0' && (i < 2 || !isAlnum(s.charAt(i - 2)));
  }

  public static int findMatchingClose(CharSequence text, int openIndex, char openChar, char closeChar) {
    if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != openChar) return -1;
    int depth = 0;
    for (int i = openIndex; i < text.length(); i++) {
      int r = regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = text.charAt(i);
      if (c == openChar) {
        depth++;
      } else if (c == closeChar) {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }

  /** Matching closer for the bracket at {@code openIndex}: {@code (}, {@code [} or <code>{</code>. */
  public static int findMatchingClose(CharSequence text, int openIndex) {
    if (openIndex < 0 || openIndex >= text.length()) return -1;
    char open = text.charAt(openIndex);
    switch (open) {
      case '(': return findMatchingClose(text, openIndex, '(', ')');
      case '[': return findMatchingClose(text, openIndex, '[', ']');
      case '{': return findMatchingClose(text, openIndex, '{', '}');
      default: return -1;
    }
  }

  /** Split on commas at nesting depth 0 outside quotes; each element trimmed. */
  public static List<String> splitTopLevelArguments(String text) {
    return ArgumentList.parse(text).elements();
  }

  /** First index of {@code token} at nesting depth 0, outside quotes and comments, or -1. */
  public static int indexOfTopLevel(CharSequence text, String token, int from) {
    int depth = 0;
    for (int i = from; i < text.length(); i++) {
      int r = regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = text.charAt(i);
      if (depth == 0 && startsWith(text, i, token)) return i;
      if (c == '(' || c == '[' || c == '{') depth++;
      else if ((c == ')' || c == ']' || c == '}') && depth > 0) depth--;
    }
    return -1;
  }

  /** First index of {@code token} outside quotes and comments at any depth, or -1. */
  public static int indexOfCode(CharSequence text, String token, int from) {
    for (int i = from; i < text.length(); i++) {
      int r = regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      if (startsWith(text, i, token)) return i;
    }
    return -1;
  }

  /**
   * Index of the clause-terminating period at or after {@code from}: a {@code .} at depth 0,
   * outside quotes and comments, not glued to symbol characters and followed by layout, a
   * comment or end of text. Returns -1 when there is none.
   */
  public static int findTerminator(CharSequence text, int from) {
    int depth = 0;
    for (int i = from; i < text.length(); i++) {
      int r = regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = text.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (depth > 0) depth--;
      } else if (c == '.' && depth == 0 && isEndToken(text, i)) {
        return i;
      }
    }
    return -1;
  }

  public static boolean isEndToken(CharSequence text, int i) {
    if (i > 0 && isSymbolChar(text.charAt(i - 1))) return false;
    if (i + 1 >= text.length()) return true;
    char next = text.charAt(i + 1);
    return Character.isWhitespace(next) || next == '%';
  }

  /** The line with any trailing {@code %} comment removed. Block comments are kept. */
  public static String stripLineComment(String line) {
    for (int i = 0; i < line.length(); i++) {
      if (line.charAt(i) == '%') return line.substring(0, i);
      int r = regionEnd(line, i);
      if (r >= 0) i = r;
    }
    return line;
  }

  /** True when the line's code ends with a clause-terminating period. */
  public static boolean endsWithTerminator(String line) {
    String code = stripLineComment(line).stripTrailing();
    int last = code.length() - 1;
    if (last < 0 || code.charAt(last) != '.') return false;
    return lastCodeIndex(code) == last && isEndToken(code, last);
  }

  private static int lastCodeIndex(String code) {
    int last = -1;
    for (int i = 0; i < code.length(); i++) {
      int r = regionEnd(code, i);
      if (r >= 0) {
        last = -1;
        i = r;
        continue;
      }
      last = i;
    }
    return last;
  }

  /** True when every bracket in the code of {@code text} is closed, in order. */
  public static boolean isBalanced(CharSequence text) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      int r = regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = text.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (--depth < 0) return false;
      }
    }
    return depth == 0;
  }

  public static boolean isCommentOrBlank(String line) {
    String t = line.trim();
    return t.isEmpty() || t.startsWith("%") || t.startsWith("/*") || t.startsWith("*");
  }

  public static boolean isAlnum(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  public static boolean isSymbolChar(char c) {
    return SYMBOL_CHARS.indexOf(c) >= 0;
  }

  public static boolean startsWith(CharSequence s, int at, String token) {
    if (at + token.length() > s.length()) return false;
    for (int k = 0; k < token.length(); k++) {
      if (s.charAt(at + k) != token.charAt(k)) return false;
    }
    return true;
  }

  /** Leading whitespace of a line. */
  public static String indentOf(String line) {
    int i = 0;
    while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
    return line.substring(0, i);
  }

  private static int indexOf(CharSequence s, char c, int from) {
    for (int i = from; i < s.length(); i++) {
      if (s.charAt(i) == c) return i;
    }
    return -1;
  }

  private static int indexOf(CharSequence s, String token, int from) {
    for (int i = from; i <= s.length() - token.length(); i++) {
      if (startsWith(s, i, token)) return i;
    }
    return -1;
  }
}
