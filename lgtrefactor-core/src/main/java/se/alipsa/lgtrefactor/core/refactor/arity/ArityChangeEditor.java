package se.alipsa.lgtrefactor.core.refactor.arity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.boundary.ClauseHead;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.edit.LineEditBuffer;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.scan.CallSiteRewriter;
import se.alipsa.lgtrefactor.core.scan.IndicatorRewriter;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.Optional;

/**
 * Applies one argument change to every kind of location a predicate or non-terminal has.
 * <p>
 * A location is classified by the term containing it: the scope directive (then the directives
 * that directly follow it are visited too), another predicate-related directive, a defining
 * clause (then the clauses that directly follow it are visited too), or any other term, where
 * only call sites are rewritten. Calls are matched on the pre-change arity, so a same-name
 * predicate of another arity is never touched. Each term is edited at most once.
 */
public final class ArityChangeEditor {

  private static final Logger logger = LogManager.getLogger(ArityChangeEditor.class);

  private final Indicator from;
  private final Indicator to;
  private final ArgumentChange change;
  private final EditAssembler edits;
  private final RelatedDirectiveRewriter related;

  /**
   * @param argName name used for a new argument in info lists; ignored for removal and reordering
   * @param description description used for a new {@code arguments} entry
   */
  public ArityChangeEditor(Indicator from, ArgumentChange change, String argName, String description, EditAssembler edits) {
    this.from = from;
    this.to = from.withArity(change.newArity(from.getArity()));
    this.change = change;
    this.edits = edits;
    this.related = new RelatedDirectiveRewriter(from, to, change, argName, description);
  }

  public Indicator getUpdatedIndicator() {
    return to;
  }

  /** Edit the term containing {@code line}; {@code declaration} marks the scope directive location. */
  public void apply(Document doc, int line, boolean declaration) {
    LineEditBuffer buffer = edits.buffer(doc);
    if (line < 0 || line >= doc.lineCount()) {
      logger.warn("Location {}:{} is outside the document; skipped", doc.uri(), line);
      return;
    }
    if (buffer.isTouched(line)) return;
    Optional<LineRange> term = TermBoundaries.enclosingTerm(doc, line);
    if (term.isEmpty()) {
      logger.debug("No term at {}:{}; skipped", doc.uri(), line);
      return;
    }
    LineRange range = term.get();
    if (buffer.isTouched(range.getStart()) || buffer.isTouched(range.getEnd())) return;
    if (!range.isTerminated()) {
      logger.warn("Unterminated term at {}:{}; skipped", doc.uri(), range.getStart());
      return;
    }
    String text = TermBoundaries.termText(doc, range);
    if (Directives.isDirective(text)) {
      if (declaration || Directives.isScope(text)) {
        rewriteDeclaration(doc, buffer, range, text);
      } else if (related.accepts(text)) {
        replace(buffer, range, related.rewrite(text));
      } else {
        replace(buffer, range, rewriteCalls(text));
      }
      return;
    }
    Optional<ClauseHead> head = ClauseHead.parse(text);
    if (head.isPresent() && head.get().defines(from)) {
      rewriteClauses(doc, buffer, range, text);
    } else {
      replace(buffer, range, rewriteCalls(text));
    }
  }

  private void rewriteDeclaration(Document doc, LineEditBuffer buffer, LineRange range, String text) {
    replace(buffer, range, IndicatorRewriter.replace(text, from, to));
    DirectiveRunScanner.scan(doc, range.getEnd() + 1, related::accepts, (r, t) -> {
      if (buffer.isTouched(r.getStart())) return false;
      replace(buffer, r, related.rewrite(t));
      return true;
    });
  }

  private void rewriteClauses(Document doc, LineEditBuffer buffer, LineRange range, String text) {
    replace(buffer, range, rewriteCalls(text));
    int ln = range.getEnd() + 1;
    while (ln < doc.lineCount()) {
      String line = doc.lineAt(ln);
      if (TermScanner.isCommentOrBlank(line)) {
        ln++;
        continue;
      }
      if (Directives.isDirective(line) || buffer.isTouched(ln)) break;
      LineRange next = TermBoundaries.getClauseRange(doc, ln);
      if (!next.isTerminated() || buffer.isTouched(next.getEnd())) break;
      String nextText = TermBoundaries.termText(doc, next);
      Optional<ClauseHead> head = ClauseHead.parse(nextText);
      if (head.isEmpty() || !head.get().defines(from)) break;
      replace(buffer, next, rewriteCalls(nextText));
      ln = next.getEnd() + 1;
    }
  }

  String rewriteCalls(String text) {
    return CallSiteRewriter.rewrite(text, from.getName(), from.getArity(), CallSiteRewriter.Mode.PREDICATE,
        change::rewrite);
  }

  private void replace(LineEditBuffer buffer, LineRange range, String text) {
    buffer.replace(range.getStart(), range.getEnd(), text);
    logger.debug("Rewrote {}:{}..{} for {} -> {}", buffer.getDocument().uri(), range.getStart(), range.getEnd(), from, to);
  }
}
