package se.alipsa.lgtrefactor.core.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The comma separated elements of an argument list or list literal, together with the layout
 * between them, so the list can be edited and re-rendered without disturbing its formatting.
 * <p>
 * For {@code "\n\ta,\n\tb\n"} the layout is: prefix {@code "\n\t"}, separator
 * {@code ",\n\t"}, suffix {@code "\n"}. Inserted elements reuse the first separator, which keeps
 * one-per-line lists one-per-line and inline lists inline. Leading comments belong to the
 * layout, not to the element that follows them.
 */
public final class ArgumentList {

  private String prefix;
  private String suffix;
  private final List<String> elements;
  private final List<String> separators;

  private ArgumentList(String prefix, List<String> elements, List<String> separators, String suffix) {
    this.prefix = prefix;
    this.elements = elements;
    this.separators = separators;
    this.suffix = suffix;
  }

  public static ArgumentList empty() {
    return new ArgumentList("", new ArrayList<>(), new ArrayList<>(), "");
  }

  /** Parse the text between an opening and closing bracket. */
  public static ArgumentList parse(String inner) {
    Objects.requireNonNull(inner, "inner");
    if (inner.trim().isEmpty()) {
      return new ArgumentList(inner, new ArrayList<>(), new ArrayList<>(), "");
    }
    List<String> raw = new ArrayList<>();
    int depth = 0;
    int segStart = 0;
    for (int i = 0; i < inner.length(); i++) {
      int r = TermScanner.regionEnd(inner, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      char c = inner.charAt(i);
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (depth > 0) depth--;
      } else if (c == ',' && depth == 0) {
        raw.add(inner.substring(segStart, i));
        segStart = i + 1;
      }
    }
    raw.add(inner.substring(segStart));

    List<String> elements = new ArrayList<>();
    List<String> separators = new ArrayList<>();
    String prefix = "";
    String pendingTrailing = "";
    for (int k = 0; k < raw.size(); k++) {
      String seg = raw.get(k);
      int lead = leadingLayout(seg);
      int trail = trailingLayout(seg, lead);
      String leading = seg.substring(0, lead);
      if (k == 0) {
        prefix = leading;
      } else {
        separators.add(pendingTrailing + "," + leading);
      }
      elements.add(seg.substring(lead, trail));
      pendingTrailing = seg.substring(trail);
    }
    if (elements.size() == 1 && elements.get(0).isEmpty()) {
      // only layout and comments
      return new ArgumentList(inner, new ArrayList<>(), new ArrayList<>(), "");
    }
    return new ArgumentList(prefix, elements, separators, pendingTrailing);
  }

  private static int leadingLayout(String seg) {
    int i = 0;
    while (i < seg.length()) {
      char c = seg.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '%' || (c == '/' && i + 1 < seg.length() && seg.charAt(i + 1) == '*')) {
        i = TermScanner.regionEnd(seg, i) + 1;
      } else {
        break;
      }
    }
    return i;
  }

  private static int trailingLayout(String seg, int from) {
    int lastCode = from;
    for (int i = from; i < seg.length(); i++) {
      char c = seg.charAt(i);
      if (c == '%' || (c == '/' && i + 1 < seg.length() && seg.charAt(i + 1) == '*')) {
        i = TermScanner.regionEnd(seg, i);
        continue;
      }
      int r = TermScanner.regionEnd(seg, i);
      if (r >= 0) {
        i = r;
        lastCode = r + 1;
        continue;
      }
      if (!Character.isWhitespace(c)) lastCode = i + 1;
    }
    return lastCode;
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public String get(int index) {
    return elements.get(index);
  }

  public List<String> elements() {
    return List.copyOf(elements);
  }

  public void set(int index, String value) {
    elements.set(index, value);
  }

  /** Insert {@code value} so it ends up at zero-based {@code index}. */
  public void insert(int index, String value) {
    if (index < 0 || index > elements.size()) {
      throw new IndexOutOfBoundsException("Insert position " + index + " outside 0.." + elements.size());
    }
    if (elements.isEmpty()) {
      elements.add(value);
      return;
    }
    String sep = canonicalSeparator();
    if (index == elements.size()) {
      separators.add(sep);
    } else {
      separators.add(index, sep);
    }
    elements.add(index, value);
  }

  public void remove(int index) {
    if (index < 0 || index >= elements.size()) {
      throw new IndexOutOfBoundsException("Remove position " + index + " outside 0.." + (elements.size() - 1));
    }
    elements.remove(index);
    if (!separators.isEmpty()) {
      separators.remove(index < separators.size() ? index : index - 1);
    }
    if (elements.isEmpty()) {
      prefix = "";
      suffix = "";
    }
  }

  /** Rearrange so the element at new position {@code i} is the old element {@code order[i]} (zero-based). */
  public void reorder(int[] order) {
    if (order.length != elements.size()) {
      throw new IllegalArgumentException("Permutation of " + order.length + " for " + elements.size() + " elements");
    }
    List<String> old = List.copyOf(elements);
    boolean[] seen = new boolean[order.length];
    for (int i = 0; i < order.length; i++) {
      int from = order[i];
      if (from < 0 || from >= order.length || seen[from]) {
        throw new IllegalArgumentException("Not a permutation at position " + i + ": " + from);
      }
      seen[from] = true;
      elements.set(i, old.get(from));
    }
  }

  /** Offset of element {@code index} within {@link #render()}. */
  public int offsetOf(int index) {
    if (index < 0 || index >= elements.size()) {
      throw new IndexOutOfBoundsException("Element " + index + " outside 0.." + (elements.size() - 1));
    }
    int offset = prefix.length();
    for (int i = 0; i < index; i++) {
      offset += elements.get(i).length() + separators.get(i).length();
    }
    return offset;
  }

  public ArgumentList copy() {
    return new ArgumentList(prefix, new ArrayList<>(elements), new ArrayList<>(separators), suffix);
  }

  private String canonicalSeparator() {
    if (!separators.isEmpty()) {
      String first = separators.get(0);
      // a leading comment belongs to the element it documents, not to the new one
      return first.contains("%") || first.contains("/*") ? ", " : first;
    }
    return prefix.contains("\n") ? "," + prefix : ", ";
  }

  public String render() {
    StringBuilder sb = new StringBuilder(prefix);
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) sb.append(separators.get(i - 1));
      sb.append(elements.get(i));
    }
    return sb.append(suffix).toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
