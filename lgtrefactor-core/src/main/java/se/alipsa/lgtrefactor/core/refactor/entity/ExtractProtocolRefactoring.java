package se.alipsa.lgtrefactor.core.refactor.entity;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.Directives;
import se.alipsa.lgtrefactor.core.boundary.EntityBlock;
import se.alipsa.lgtrefactor.core.boundary.TermBoundaries;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.edit.LineEditBuffer;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.EntityKind;
import se.alipsa.lgtrefactor.core.model.EntityTarget;
import se.alipsa.lgtrefactor.core.model.LineRange;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.refactor.Validators;
import se.alipsa.lgtrefactor.core.refactor.arity.DirectiveRunScanner;
import se.alipsa.lgtrefactor.core.refactor.extract.EntityTemplate;
import se.alipsa.lgtrefactor.core.refactor.extract.FileUris;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Moves the predicate declarations of an object or category into a new protocol file and makes
 * the entity implement it. A declaration is a scope directive plus the mode, info and meta
 * directives that directly follow it; they are moved verbatim.
 */
public final class ExtractProtocolRefactoring extends EntityRefactoring {

  private static final Logger logger = LogManager.getLogger(ExtractProtocolRefactoring.class);

  private static final Set<String> DECLARATION_DETAILS = Set.of("mode", "info", "meta_predicate", "meta_non_terminal");

  public ExtractProtocolRefactoring() {
    super(RefactorKind.EXTRACT_PROTOCOL);
  }

  @Override
  protected boolean accepts(EntityBlock block) {
    return block.getKind() != EntityKind.PROTOCOL && block.isClosed();
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    EntityTarget target = action.targetAs(EntityTarget.class);
    Document doc = open(target.getUri());
    EntityBlock block = resolve(doc, target);
    if (!accepts(block)) {
      throw RefactorException.precondition("Protocols can only be extracted from a closed object or category");
    }
    List<LineRange> runs = declarationRuns(doc, block);
    if (runs.isEmpty()) {
      throw RefactorException.precondition("No predicate declarations found in " + block.getIdentifier().getName());
    }
    Optional<String> name = promptText("Name of the new protocol", block.getIdentifier().getName() + "_protocol",
        Validators.atomName());
    if (name.isEmpty()) return RefactorResult.cancelled();
    String protocol = name.get().trim();
    String protocolUri = FileUris.sibling(doc.uri(), protocol + ".lgt");
    if (env().documents().exists(protocolUri)) {
      throw RefactorException.precondition("File " + FileUris.fileName(protocolUri) + " already exists");
    }

    EditAssembler edits = new EditAssembler();
    LineEditBuffer buffer = edits.buffer(doc);
    List<String> moved = new ArrayList<>();
    for (LineRange run : runs) {
      moved.add(doc.getLines(run.getStart(), run.getEnd()));
      int end = run.getEnd();
      // keep a single blank line between the remaining terms
      if (end + 1 < block.getEndLine() && doc.lineAt(end + 1).isBlank()
          && run.getStart() > 0 && doc.lineAt(run.getStart() - 1).isBlank()) {
        end++;
      }
      buffer.delete(run.getStart(), end);
    }
    LineRange opening = block.getOpening();
    buffer.replace(opening.getStart(), opening.getEnd(),
        addImplements(TermBoundaries.termText(doc, opening), protocol, env().settings().indent()));
    edits.createFile(protocolUri, EntityTemplate.render(EntityKind.PROTOCOL, protocol, String.join("\n\n", moved),
        env().settings(), env().clock()));
    logger.debug("Moving {} declaration runs from {} to {}", runs.size(), block.getIdentifier().getName(), protocol);
    return apply(edits, "Extracted protocol " + protocol + " from " + block.getIdentifier().getName());
  }

  /** Scope directives in the entity body, each with the declaration details that follow it. */
  static List<LineRange> declarationRuns(Document doc, EntityBlock block) {
    List<LineRange> runs = new ArrayList<>();
    int ln = block.getOpening().getEnd() + 1;
    while (ln < block.getEndLine()) {
      String line = doc.lineAt(ln);
      if (TermScanner.isCommentOrBlank(line)) {
        ln++;
        continue;
      }
      LineRange term = TermBoundaries.getClauseRange(doc, ln);
      String text = TermBoundaries.termText(doc, term);
      if (Directives.isDirective(text) && Directives.isScope(text)) {
        List<LineRange> details = DirectiveRunScanner.collect(doc, term.getEnd() + 1,
            t -> DECLARATION_DETAILS.contains(Directives.name(t)) && !Directives.isEntityInfo(t));
        int end = details.isEmpty() ? term.getEnd() : details.get(details.size() - 1).getEnd();
        runs.add(new LineRange(term.getStart(), end, true));
        ln = end + 1;
      } else {
        ln = term.getEnd() + 1;
      }
    }
    return runs;
  }

  /**
   * Add {@code implements(Protocol)} to an opening directive, keeping the identifier and any
   * existing relations as written. An existing {@code implements/N} relation gets the protocol
   * appended.
   */
  static String addImplements(String text, String protocol, String indent) {
    int open = Directives.openParen(text);
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    if (open < 0 || close < 0) return text;
    ArgumentList args = ArgumentList.parse(text.substring(open + 1, close));
    for (int i = 1; i < args.size(); i++) {
      String relation = args.get(i);
      if (relation.startsWith("implements(") && relation.endsWith(")")) {
        args.set(i, relation.substring(0, relation.length() - 1) + ", " + protocol + ")");
        return text.substring(0, open + 1) + args.render() + text.substring(close);
      }
    }
    if (args.size() == 1) {
      // identifier only: put the relation on its own line
      int identifierEnd = close - (text.substring(open + 1, close).length()
          - text.substring(open + 1, close).stripTrailing().length());
      return text.substring(0, identifierEnd) + ",\n" + indent + "implements(" + protocol + ")"
          + text.substring(identifierEnd);
    }
    args.insert(1, "implements(" + protocol + ")");
    return text.substring(0, open + 1) + args.render() + text.substring(close);
  }
}
