package se.alipsa.lgtrefactor.core.refactor.include;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.IncludeTarget;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.AbstractRefactoring;
import se.alipsa.lgtrefactor.core.refactor.extract.FileUris;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces {@code :- include(File).} with the contents of the included file, indented like the
 * directive. The file is looked up next to the including file, as written and then with each
 * configured extension.
 */
public final class ReplaceIncludeWithContentRefactoring extends AbstractRefactoring {

  private static final Logger logger = LogManager.getLogger(ReplaceIncludeWithContentRefactoring.class);

  public ReplaceIncludeWithContentRefactoring() {
    super(RefactorKind.REPLACE_INCLUDE_WITH_CONTENT);
  }

  @Override
  public List<RefactorAction> detect(Document doc, Range range) {
    if (!range.isEmpty() || range.start.line >= doc.lineCount()) return List.of();
    if (TermScanner.isCommentOrBlank(doc.lineAt(range.start.line))) return List.of();
    Optional<LineRange> term = TermBoundaries.enclosingTerm(doc, range.start.line);
    if (term.isEmpty() || !term.get().isTerminated()) return List.of();
    String spec = fileSpec(TermBoundaries.termText(doc, term.get()));
    return spec == null ? List.of() : offer(new IncludeTarget(doc.uri(), term.get(), spec));
  }

  /** The argument of an {@code include/1} directive as written, or null. */
  static @Nullable String fileSpec(String directive) {
    if (!"include".equals(Directives.name(directive))) return null;
    ArgumentList args = Directives.arguments(directive);
    return args == null || args.size() != 1 ? null : args.get(0);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    IncludeTarget target = action.targetAs(IncludeTarget.class);
    Document doc = open(target.getUri());
    LineRange range = target.getDirective();
    if (range.getEnd() >= doc.lineCount()
        || !target.getFileSpec().equals(fileSpec(TermBoundaries.termText(doc, range)))) {
      throw RefactorException.precondition("The include directive is no longer there");
    }
    String name = unquote(target.getFileSpec());
    if (name.indexOf('(') >= 0) {
      throw RefactorException.precondition("Cannot resolve library notation " + name + "; only plain file names are supported");
    }
    String uri = candidates(doc.uri(), name).stream()
        .filter(c -> env().documents().exists(c))
        .findFirst()
        .orElseThrow(() -> RefactorException.precondition("Included file " + name + " not found"));
    logger.debug("Inlining {} into {}", uri, doc.uri());
    Document included = open(uri);
    String content = SelectionValidator.stripCommonIndent(SelectionValidator.processSelectedCode(included.getText()));
    String indent = TermScanner.indentOf(doc.lineAt(range.getStart()));
    EditAssembler edits = new EditAssembler();
    if (content.isEmpty()) {
      edits.buffer(doc).delete(range.getStart(), range.getEnd());
    } else {
      edits.buffer(doc).replace(range.getStart(), range.getEnd(), SelectionValidator.indent(content, indent));
    }
    return apply(edits, "Replaced include of " + FileUris.fileName(uri) + " with its contents");
  }

  /** The name as written first, then with each extension unless it already has one. */
  List<String> candidates(String including, String name) {
    List<String> out = new ArrayList<>();
    out.add(FileUris.resolve(including, name));
    if (!FileUris.hasExtension(name)) {
      for (String ext : env().settings().includeExtensions()) {
        out.add(FileUris.resolve(including, name + "." + ext));
      }
    }
    return out;
  }

  static String unquote(String spec) {
    String s = spec.trim();
    if (s.length() >= 2 && (s.charAt(0) == '\'' || s.charAt(0) == '"') && s.charAt(s.length() - 1) == s.charAt(0)) {
      return s.substring(1, s.length() - 1);
    }
    return s;
  }
}
