package se.alipsa.lgtrefactor.core.scan;

import se.alipsa.lgtrefactor.core.model.Indicator;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Token-aware search and substitution of {@code name/arity} and {@code name//arity} text. */
public final class IndicatorRewriter {

  private IndicatorRewriter() {}

  private static Pattern patternFor(Indicator indicator) {
    String sep = indicator.isNonTerminal() ? "//" : "/(?!/)";
    return Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(indicator.getName())
        + "\\s*" + sep + "\\s*" + indicator.getArity() + "(?![0-9])");
  }

  /** Start offsets of code occurrences of the indicator (not inside quotes or comments). */
  public static List<Integer> find(String text, Indicator indicator) {
    List<Integer> found = new ArrayList<>();
    boolean[] inRegion = regionMask(text);
    Matcher m = patternFor(indicator).matcher(text);
    while (m.find()) {
      if (!inRegion[m.start()]) found.add(m.start());
    }
    return found;
  }

  public static boolean contains(String text, Indicator indicator) {
    return !find(text, indicator).isEmpty();
  }

  public static String replace(String text, Indicator from, Indicator to) {
    boolean[] inRegion = regionMask(text);
    Matcher m = patternFor(from).matcher(text);
    StringBuilder sb = new StringBuilder();
    int last = 0;
    while (m.find()) {
      if (inRegion[m.start()]) continue;
      sb.append(text, last, m.start()).append(to);
      last = m.end();
    }
    return sb.append(text.substring(last)).toString();
  }

  private static boolean[] regionMask(String text) {
    boolean[] mask = new boolean[text.length() + 1];
    for (int i = 0; i < text.length(); i++) {
      int r = TermScanner.regionEnd(text, i);
      if (r >= 0) {
        for (int k = i; k <= r; k++) mask[k] = true;
        i = r;
      }
    }
    return mask;
  }
}
