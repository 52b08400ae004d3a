package se.alipsa.lgtrefactor.core.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds and rewrites {@code name(Args)} occurrences whose argument count equals an expected
 * arity. Occurrences of the same name with a different arity are never touched.
 */
public final class CallSiteRewriter {

  /** Whether bare names followed by {@code ::} are message receivers (entities) or not (predicates). */
  public enum Mode { PREDICATE, ENTITY }

  /** Produces the replacement for a matched call; {@code args} is empty for a bare atom. */
  @FunctionalInterface
  public interface CallTransform {
    String rewrite(String name, ArgumentList args);
  }

  /** Decides whether a matched occurrence is rewritten, given the text it was found in. */
  @FunctionalInterface
  public interface SiteFilter {
    boolean accept(String text, CallSite site);

    SiteFilter ALL = (text, site) -> true;
  }

  /** One matched occurrence; {@code end} is exclusive. */
  public static final class CallSite {
    private final int start;
    private final int end;
    private final ArgumentList args;
    private final boolean bare;

    CallSite(int start, int end, ArgumentList args, boolean bare) {
      this.start = start;
      this.end = end;
      this.args = args;
      this.bare = bare;
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }
    public ArgumentList getArgs() { return args.copy(); }
    public boolean isBare() { return bare; }
  }

  private CallSiteRewriter() {}

  /** Top-level occurrences; calls nested in the arguments of a match are not listed separately. */
  public static List<CallSite> findCalls(String text, String name, int arity, Mode mode) {
    List<CallSite> sites = new ArrayList<>();
    int len = text.length();
    for (int i = 0; i < len; i++) {
      int r = TermScanner.regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = text.charAt(i);
      if (!Character.isLowerCase(c) || (i > 0 && TermScanner.isAlnum(text.charAt(i - 1)))) continue;
      int j = i;
      while (j < len && TermScanner.isAlnum(text.charAt(j))) j++;
      if (!text.regionMatches(i, name, 0, name.length()) || j - i != name.length()) {
        i = j - 1;
        continue;
      }
      if (j < len && text.charAt(j) == '(') {
        int close = TermScanner.findMatchingClose(text, j, '(', ')');
        if (close < 0) {
          i = j - 1;
          continue;
        }
        ArgumentList args = ArgumentList.parse(text.substring(j + 1, close));
        if (args.size() == arity) {
          sites.add(new CallSite(i, close + 1, args, false));
          i = close;
        } else {
          i = j - 1;
        }
      } else {
        if (arity == 0 && isBareCall(text, i, j, mode)) {
          sites.add(new CallSite(i, j, ArgumentList.empty(), true));
        }
        i = j - 1;
      }
    }
    return sites;
  }

  /** Rewrite every matching occurrence, including ones nested inside the arguments of another. */
  public static String rewrite(String text, String name, int arity, Mode mode, CallTransform transform) {
    return rewrite(text, name, arity, mode, transform, SiteFilter.ALL);
  }

  /** As {@link #rewrite(String, String, int, Mode, CallTransform)}, skipping occurrences {@code filter} rejects. */
  public static String rewrite(String text, String name, int arity, Mode mode, CallTransform transform,
                               SiteFilter filter) {
    List<CallSite> sites = findCalls(text, name, arity, mode);
    if (sites.isEmpty()) return text;
    StringBuilder sb = new StringBuilder(text);
    for (int k = sites.size() - 1; k >= 0; k--) {
      CallSite site = sites.get(k);
      if (!filter.accept(text, site)) continue;
      ArgumentList args = site.getArgs();
      for (int a = 0; a < args.size(); a++) {
        args.set(a, rewrite(args.get(a), name, arity, mode, transform, filter));
      }
      sb.replace(site.start, site.end, transform.rewrite(name, args));
    }
    return sb.toString();
  }

  public static boolean containsCall(String text, String name, int arity, Mode mode) {
    return !findCalls(text, name, arity, mode).isEmpty();
  }

  private static boolean isBareCall(String text, int start, int end, Mode mode) {
    int k = end;
    while (k < text.length() && (text.charAt(k) == ' ' || text.charAt(k) == '\t')) k++;
    if (k < text.length()) {
      char next = text.charAt(k);
      // name/Arity and name//Arity are indicators, not calls
      if (next == '/' && !(k + 1 < text.length() && text.charAt(k + 1) == '*')) return false;
      if (mode == Mode.PREDICATE && TermScanner.startsWith(text, k, "::")) return false;
    }
    if (mode == Mode.ENTITY && start >= 2 && TermScanner.startsWith(text, start - 2, "::")) return false;
    return true;
  }
}
