package se.alipsa.lgtrefactor.core.refactor.entity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.boundary.EntityBlock;
import se.alipsa.lgtrefactor.core.boundary.EntityInspector;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.edit.LineEditBuffer;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.EntityKind;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.refactor.arity.ArgumentChange;
import se.alipsa.lgtrefactor.core.refactor.arity.InfoDirectiveEditor;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.CallSiteRewriter;
import se.alipsa.lgtrefactor.core.scan.TermScanner;
import se.alipsa.lgtrefactor.core.scan.VariableScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Applies a parameter change to a parametric entity: its opening directive, its info/1
 * {@code parnames}/{@code parameters} lists, {@code parameter/2} indexes in its body, and every
 * {@code Entity(...)} or {@code Entity::} reference, each bounded to the term holding it.
 * <p>
 * Only terms in entity position count as references: message receivers ({@code ::}),
 * delegation targets ({@code <<}) and relation arguments such as {@code extends(...)}.
 * A local predicate sharing the entity name is left alone.
 */
final class ParameterChangeEditor {

  private static final Logger logger = LogManager.getLogger(ParameterChangeEditor.class);

  private static final String PARAMETER_CALL = "parameter(";
  private static final Pattern PARAMETER_VARIABLE = Pattern.compile("^_[A-Z][A-Za-z0-9_]*_$");

  private final String name;
  private final int arity;
  private final ArgumentChange change;
  private final String parName;
  private final String description;
  private final EditAssembler edits;

  ParameterChangeEditor(String name, int arity, ArgumentChange change, String parName, String description,
                        EditAssembler edits) {
    this.name = name;
    this.arity = arity;
    this.change = change;
    this.parName = parName;
    this.description = description;
    this.edits = edits;
  }

  /** Rewrite the entity definition itself. */
  void applyToEntity(Document doc, EntityBlock block) {
    LineEditBuffer buffer = edits.buffer(doc);
    LineRange opening = block.getOpening();
    buffer.replace(opening.getStart(), opening.getEnd(), rewriteOpening(TermBoundaries.termText(doc, opening)));
    Optional<LineRange> info = EntityInspector.entityInfo(doc, block);
    if (info.isPresent() && !buffer.isTouched(info.get().getStart())) {
      String text = TermBoundaries.termText(doc, info.get());
      String rewritten = InfoDirectiveEditor.rewriteEntityInfo(text, arity, change, parName, description);
      if (rewritten.isEmpty()) {
        deleteDirective(doc, buffer, info.get());
      } else {
        buffer.replace(info.get().getStart(), info.get().getEnd(), rewritten);
      }
    }
    for (LineRange term : bodyTerms(doc, block)) {
      if (buffer.isTouched(term.getStart()) || buffer.isTouched(term.getEnd())) continue;
      String text = TermBoundaries.termText(doc, term);
      String rewritten = renumberParameters(rewriteCalls(text));
      if (!rewritten.equals(text)) {
        buffer.replace(term.getStart(), term.getEnd(), rewritten);
      }
    }
  }

  /**
   * Uses in the entity body of parameters this change removes: {@code parameter(N, _)} calls and
   * parameter variables such as {@code _Type_}. Each entry names the use and its 1-based line.
   */
  List<String> removedParameterUses(Document doc, EntityBlock block, List<String> parameters) {
    List<Integer> removed = new ArrayList<>();
    for (int i = 1; i <= arity; i++) {
      if (newIndexOf(i) < 0) removed.add(i);
    }
    List<String> uses = new ArrayList<>();
    if (removed.isEmpty()) return uses;
    for (LineRange term : bodyTerms(doc, block)) {
      String text = TermBoundaries.termText(doc, term);
      for (int[] call : parameterCalls(text)) {
        if (removed.contains(call[2])) {
          uses.add("parameter(" + call[2] + ", _) on line " + lineOf(term, text, call[0]));
        }
      }
      for (int index : removed) {
        String variable = index <= parameters.size() ? parameters.get(index - 1).trim() : "";
        if (!PARAMETER_VARIABLE.matcher(variable).matches()) continue;
        for (VariableScanner.Token token : VariableScanner.occurrences(text, variable)) {
          uses.add(variable + " on line " + lineOf(term, text, token.getStart()));
        }
      }
    }
    return uses;
  }

  /** Remove a directive, and one of the blank lines around it when it sat between two. */
  private static void deleteDirective(Document doc, LineEditBuffer buffer, LineRange range) {
    int start = range.getStart();
    int end = range.getEnd();
    if (start > 0 && end + 1 < doc.lineCount() && doc.lineAt(start - 1).isBlank()
        && doc.lineAt(end + 1).isBlank() && !buffer.isTouched(end + 1)) {
      end++;
    }
    buffer.delete(start, end);
  }

  private static List<LineRange> bodyTerms(Document doc, EntityBlock block) {
    List<LineRange> terms = new ArrayList<>();
    int last = block.isClosed() ? block.getEndLine() : doc.lineCount();
    int ln = block.getOpening().getEnd() + 1;
    while (ln < last) {
      if (TermScanner.isCommentOrBlank(doc.lineAt(ln))) {
        ln++;
        continue;
      }
      LineRange term = TermBoundaries.getClauseRange(doc, ln);
      if (term.getEnd() >= last) term = new LineRange(term.getStart(), last - 1, term.isTerminated());
      terms.add(term);
      ln = Math.max(term.getEnd(), ln) + 1;
    }
    return terms;
  }

  private static int lineOf(LineRange term, String text, int offset) {
    int line = term.getStart();
    for (int i = 0; i < offset && i < text.length(); i++) {
      if (text.charAt(i) == '\n') line++;
    }
    return line + 1;
  }

  /** Rewrite references in the term containing {@code line}. */
  void applyToReference(Document doc, int line) {
    LineEditBuffer buffer = edits.buffer(doc);
    if (line < 0 || line >= doc.lineCount() || buffer.isTouched(line)) return;
    Optional<LineRange> term = TermBoundaries.enclosingTerm(doc, line);
    if (term.isEmpty() || !term.get().isTerminated()) {
      logger.debug("No complete term at {}:{}; reference skipped", doc.uri(), line);
      return;
    }
    LineRange range = term.get();
    if (buffer.isTouched(range.getStart()) || buffer.isTouched(range.getEnd())) return;
    String text = TermBoundaries.termText(doc, range);
    String rewritten = rewriteCalls(text);
    if (!rewritten.equals(text)) buffer.replace(range.getStart(), range.getEnd(), rewritten);
  }

  private String rewriteOpening(String text) {
    int open = text.indexOf('(');
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    if (open < 0 || close < 0) return text;
    ArgumentList args = ArgumentList.parse(text.substring(open + 1, close));
    if (args.isEmpty()) return text;
    String identifier = args.get(0);
    String rewritten = CallSiteRewriter.rewrite(identifier, name, arity, CallSiteRewriter.Mode.ENTITY, change::rewrite);
    args.set(0, rewritten);
    return text.substring(0, open + 1) + args.render() + text.substring(close);
  }

  String rewriteCalls(String text) {
    return CallSiteRewriter.rewrite(text, name, arity, CallSiteRewriter.Mode.ENTITY, change::rewrite,
        ParameterChangeEditor::isEntityPosition);
  }

  /** Followed by {@code ::} or {@code <<}, or an argument of a relation. */
  static boolean isEntityPosition(String text, CallSiteRewriter.CallSite site) {
    int k = site.getEnd();
    while (k < text.length() && Character.isWhitespace(text.charAt(k))) k++;
    if (TermScanner.startsWith(text, k, "::") || TermScanner.startsWith(text, k, "<<")) return true;
    int len = text.length();
    for (int i = 0; i < site.getStart(); i++) {
      int r = TermScanner.regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      if (!Character.isLowerCase(text.charAt(i)) || (i > 0 && TermScanner.isAlnum(text.charAt(i - 1)))) continue;
      int j = i;
      while (j < len && TermScanner.isAlnum(text.charAt(j))) j++;
      if (j < len && text.charAt(j) == '(' && EntityKind.ALL_RELATIONS.contains(text.substring(i, j))) {
        int close = TermScanner.findMatchingClose(text, j, '(', ')');
        if (close > site.getStart()) return true;
      }
      i = j - 1;
    }
    return false;
  }

  /** Shift {@code parameter(N, _)} indexes to follow the change. */
  String renumberParameters(String text) {
    StringBuilder sb = new StringBuilder();
    int last = 0;
    for (int[] call : parameterCalls(text)) {
      if (call[2] < 1 || call[2] > arity) continue;
      int newIndex = newIndexOf(call[2]);
      if (newIndex < 0) continue;
      sb.append(text, last, call[0]).append(newIndex);
      last = call[1];
    }
    return sb.append(text.substring(last)).toString();
  }

  /**
   * {@code parameter(N, ...)} calls outside quotes and comments, as {digit start, digit end, N}.
   * N is -1 when it does not fit an int.
   */
  static List<int[]> parameterCalls(String text) {
    List<int[]> calls = new ArrayList<>();
    int len = text.length();
    for (int i = 0; i < len; i++) {
      int r = TermScanner.regionEnd(text, i);
      if (r >= 0) {
        i = r;
        continue;
      }
      if (!TermScanner.startsWith(text, i, PARAMETER_CALL) || (i > 0 && TermScanner.isAlnum(text.charAt(i - 1)))) {
        continue;
      }
      int from = skipLayout(text, i + PARAMETER_CALL.length());
      int to = from;
      while (to < len && Character.isDigit(text.charAt(to))) to++;
      if (to == from || skipLayout(text, to) >= len || text.charAt(skipLayout(text, to)) != ',') continue;
      int index = to - from > 9 ? -1 : Integer.parseInt(text.substring(from, to));
      calls.add(new int[] {from, to, index});
      i = to - 1;
    }
    return calls;
  }

  private static int skipLayout(String text, int i) {
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
    return i;
  }

  /** The 1-based index a parameter moves to, or -1 when it is removed. */
  private int newIndexOf(int oldIndex) {
    if (oldIndex < 1 || oldIndex > arity) return oldIndex;
    ArgumentList indexes = ArgumentList.parse(indexList(arity));
    change.forValue("0").applyTo(indexes);
    for (int i = 0; i < indexes.size(); i++) {
      if (indexes.get(i).equals(String.valueOf(oldIndex))) return i + 1;
    }
    return -1;
  }

  private static String indexList(int n) {
    StringBuilder sb = new StringBuilder();
    for (int i = 1; i <= n; i++) {
      if (i > 1) sb.append(", ");
      sb.append(i);
    }
    return sb.toString();
  }
}
