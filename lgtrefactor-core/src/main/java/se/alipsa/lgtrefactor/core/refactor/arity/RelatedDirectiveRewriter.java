package se.alipsa.lgtrefactor.core.refactor.arity;

import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.scan.CallSiteRewriter;
import se.alipsa.lgtrefactor.core.scan.IndicatorRewriter;

/**
 * Rewrites one predicate-related directive ({@code mode/2}, {@code info/2},
 * {@code meta_predicate/1} and friends) for an argument change. Indicator text is substituted;
 * template forms get the directive's placeholder for a new argument: {@code ?} in mode templates,
 * {@code *} in meta templates, {@code +} in coinductive templates.
 */
final class RelatedDirectiveRewriter {

  private final Indicator from;
  private final Indicator to;
  private final ArgumentChange change;
  private final String argName;
  private final String description;

  RelatedDirectiveRewriter(Indicator from, Indicator to, ArgumentChange change, String argName, String description) {
    this.from = from;
    this.to = to;
    this.change = change;
    this.argName = argName;
    this.description = description;
  }

  /** Whether {@code text} is a related directive mentioning the indicator or its template. */
  boolean accepts(String text) {
    String name = Directives.name(text);
    if (!Directives.PREDICATE_RELATED.contains(name)) return false;
    if (name.equals("info") && Directives.isEntityInfo(text)) return false;
    return mentions(text);
  }

  boolean mentions(String text) {
    return IndicatorRewriter.contains(text, from)
        || CallSiteRewriter.containsCall(text, from.getName(), from.getArity(), CallSiteRewriter.Mode.PREDICATE);
  }

  String rewrite(String text) {
    String name = Directives.name(text);
    if (name.equals("info")) {
      String out = IndicatorRewriter.replace(text, from, to);
      return InfoDirectiveEditor.rewritePredicateInfo(out, from.getName(), from.getArity(), change, argName, description);
    }
    String out = IndicatorRewriter.replace(text, from, to);
    ArgumentChange templateChange = change.forValue(placeholder(name));
    return CallSiteRewriter.rewrite(out, from.getName(), from.getArity(), CallSiteRewriter.Mode.PREDICATE,
        templateChange::rewrite);
  }

  private String placeholder(String directive) {
    switch (directive) {
      case "mode": return "?";
      case "meta_predicate":
      case "meta_non_terminal": return "*";
      case "coinductive": return "+";
      default: return argName;
    }
  }
}
