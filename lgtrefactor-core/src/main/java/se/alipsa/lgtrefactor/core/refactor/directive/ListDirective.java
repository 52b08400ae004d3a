package se.alipsa.lgtrefactor.core.refactor.directive;

import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A directive holding a list of elements: {@code public([a/1, b/2])}, {@code dynamic((a/1, b/2))},
 * {@code dynamic(a/1, b/2)} or {@code uses(list, [append/3, member/2])}. Single-argument
 * directives keep their elements in the first argument, two-argument directives in the second.
 */
final class ListDirective {

  enum Form {
    /** {@code [a, b]} */
    LIST,
    /** {@code (a, b)} */
    CONJUNCTION,
    /** {@code a, b} as separate directive arguments */
    ARGUMENTS
  }

  private final String text;
  private final String name;
  private final Form form;
  private final ArgumentList directiveArgs;
  private final ArgumentList elements;
  private final int open;
  private final int close;

  private ListDirective(String text, String name, Form form, ArgumentList directiveArgs, ArgumentList elements,
                        int open, int close) {
    this.text = text;
    this.name = name;
    this.form = form;
    this.directiveArgs = directiveArgs;
    this.elements = elements;
    this.open = open;
    this.close = close;
  }

  static Optional<ListDirective> parse(String text) {
    String name = Directives.name(text);
    boolean first = Directives.LIST_FIRST_ARGUMENT.contains(name);
    boolean second = Directives.LIST_SECOND_ARGUMENT.contains(name);
    if (!first && !second) return Optional.empty();
    int open = Directives.openParen(text);
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    if (open < 0 || close < 0) return Optional.empty();
    ArgumentList args = ArgumentList.parse(text.substring(open + 1, close));
    if (first) {
      if (args.size() > 1) return Optional.of(new ListDirective(text, name, Form.ARGUMENTS, args, args.copy(), open, close));
      if (args.size() != 1) return Optional.empty();
      String arg = args.get(0);
      if (isBracketed(arg, '[', ']')) {
        return Optional.of(new ListDirective(text, name, Form.LIST, args, inner(arg), open, close));
      }
      if (isBracketed(arg, '(', ')')) {
        return Optional.of(new ListDirective(text, name, Form.CONJUNCTION, args, inner(arg), open, close));
      }
      return Optional.of(new ListDirective(text, name, Form.ARGUMENTS, args, args.copy(), open, close));
    }
    if (args.size() != 2 || !isBracketed(args.get(1), '[', ']')) return Optional.empty();
    return Optional.of(new ListDirective(text, name, Form.LIST, args, inner(args.get(1)), open, close));
  }

  private static boolean isBracketed(String arg, char openChar, char closeChar) {
    return !arg.isEmpty() && arg.charAt(0) == openChar
        && TermScanner.findMatchingClose(arg, 0, openChar, closeChar) == arg.length() - 1;
  }

  private static ArgumentList inner(String bracketed) {
    return ArgumentList.parse(bracketed.substring(1, bracketed.length() - 1));
  }

  String name() { return name; }

  Form form() { return form; }

  boolean holdsListInSecondArgument() {
    return Directives.LIST_SECOND_ARGUMENT.contains(name);
  }

  ArgumentList elements() { return elements.copy(); }

  int size() { return elements.size(); }

  /** The directive with its elements replaced, layout outside the elements untouched. */
  String withElements(ArgumentList newElements) {
    ArgumentList args = directiveArgs.copy();
    switch (form) {
      case LIST:
        args.set(args.size() - 1, "[" + newElements.render() + "]");
        break;
      case CONJUNCTION:
        args.set(0, "(" + newElements.render() + ")");
        break;
      default:
        args = newElements;
    }
    return text.substring(0, open + 1) + args.render() + text.substring(close);
  }

  /**
   * One directive per element, each on its own line with the indentation of the original.
   * Two-argument directives keep the element in a list; a trailing comment stays on the last line.
   */
  List<String> split() {
    int terminator = TermScanner.findTerminator(text, close);
    String lead = text.substring(0, open + 1);
    String tail = terminator < 0 ? text.substring(close) : text.substring(close, terminator + 1);
    String trailing = terminator < 0 ? "" : text.substring(terminator + 1);
    List<String> out = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) {
      String element = elements.get(i);
      String body = holdsListInSecondArgument()
          ? directiveArgs.get(0) + ", [" + element + "]"
          : element;
      out.add(lead + body + tail + (i == elements.size() - 1 ? trailing : ""));
    }
    return out;
  }

  /** Sort key of an element: the indicator, or for {@code X as Y} the part before {@code as}. */
  static String sortKey(String element) {
    int as = TermScanner.indexOfTopLevel(element, " as ", 0);
    String key = as < 0 ? element : element.substring(0, as);
    return key.trim().toLowerCase(Locale.ROOT);
  }
}
