package se.alipsa.lgtrefactor.core.refactor.arity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.CallSiteRewriter;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps the per-argument lists of {@code info/1} and {@code info/2} directives in step with an
 * argument change.
 * <p>
 * {@code argnames is [...]} and {@code arguments is [...]} (entity info: {@code parnames} and
 * {@code parameters}) get the same positional edit as the argument list, using the list's own
 * layout so one-per-line lists stay one-per-line. A list that becomes empty is dropped; a
 * missing {@code argnames} list is created when the first argument is added. Calls in
 * {@code examples} are rewritten like call sites. An entity info directive left with no entries
 * at all is removed: {@link #rewriteEntityInfo} then returns the empty string.
 */
public final class InfoDirectiveEditor {

  private static final Logger logger = LogManager.getLogger(InfoDirectiveEditor.class);

  private static final Pattern KEY = Pattern.compile("^([a-z][A-Za-z0-9_]*)\\s+is\\s+");

  private InfoDirectiveEditor() {}

  /** Rewrite {@code :- info(Indicator, [...]).}; the indicator itself is handled by the caller. */
  public static String rewritePredicateInfo(String text, String name, int oldArity, ArgumentChange change,
                                            String argName, String description) {
    String rewritten = rewrite(text, 1, "argnames", "arguments", name, oldArity, change, argName, description);
    if (rewritten != null) return rewritten;
    int open = Directives.openParen(text);
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    ArgumentList dirArgs = ArgumentList.parse(text.substring(open + 1, close));
    dirArgs.set(1, "[]");
    return text.substring(0, open + 1) + dirArgs.render() + text.substring(close);
  }

  /** Rewrite {@code :- info([...]).} of a parametric entity; empty when nothing is left of it. */
  public static String rewriteEntityInfo(String text, int oldArity, ArgumentChange change,
                                         String parName, String description) {
    String rewritten = rewrite(text, 0, "parnames", "parameters", null, oldArity, change, parName, description);
    return rewritten == null ? "" : rewritten;
  }

  /** {@code null} when every entry of the info list was removed. */
  private static @Nullable String rewrite(String text, int listArg, String namesKey, String describedKey,
                                          @Nullable String callName, int oldArity, ArgumentChange change,
                                          String newName, String description) {
    int open = Directives.openParen(text);
    if (open < 0) return text;
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    if (close < 0) return text;
    ArgumentList dirArgs = ArgumentList.parse(text.substring(open + 1, close));
    if (dirArgs.size() <= listArg) return text;
    String list = dirArgs.get(listArg);
    if (!list.startsWith("[") || TermScanner.findMatchingClose(list, 0, '[', ']') != list.length() - 1) {
      return text;
    }
    ArgumentList entries = ArgumentList.parse(list.substring(1, list.length() - 1));
    boolean hadEntries = !entries.isEmpty();
    boolean sawNames = false;
    for (int i = entries.size() - 1; i >= 0; i--) {
      String entry = entries.get(i);
      Matcher m = KEY.matcher(entry);
      if (!m.find()) continue;
      String key = m.group(1);
      String value = entry.substring(m.end());
      if (key.equals(namesKey) || key.equals(describedKey)) {
        if (key.equals(namesKey)) sawNames = true;
        String quoted = quote(newName);
        String inserted = key.equals(namesKey) ? quoted : quoted + " - " + quote(description);
        String updated = rewriteList(value, oldArity, change.forValue(inserted), key);
        if (updated == null) continue;
        if (updated.equals("[]")) {
          entries.remove(i);
        } else {
          entries.set(i, entry.substring(0, m.end()) + updated);
        }
      } else if (key.equals("examples") && callName != null) {
        entries.set(i, CallSiteRewriter.rewrite(entry, callName, oldArity, CallSiteRewriter.Mode.PREDICATE,
            change::rewrite));
      }
    }
    if (!sawNames && oldArity == 0 && change.newArity(0) == 1) {
      entries.insert(entries.size(), namesKey + " is [" + quote(newName) + "]");
    }
    if (hadEntries && entries.isEmpty()) return null;
    dirArgs.set(listArg, "[" + entries.render() + "]");
    return text.substring(0, open + 1) + dirArgs.render() + text.substring(close);
  }

  /** The changed list text, or {@code null} when the list does not match the old arity. */
  private static @Nullable String rewriteList(String value, int oldArity, ArgumentChange change, String key) {
    String v = value.trim();
    if (!v.startsWith("[") || TermScanner.findMatchingClose(v, 0, '[', ']') != v.length() - 1) return null;
    ArgumentList items = ArgumentList.parse(v.substring(1, v.length() - 1));
    if (items.size() != oldArity) {
      logger.warn("{} list has {} entries but {} were expected; left unchanged", key, items.size(), oldArity);
      return null;
    }
    change.applyTo(items);
    return "[" + items.render() + "]";
  }

  static String quote(String name) {
    return "'" + name.replace("'", "''") + "'";
  }
}
