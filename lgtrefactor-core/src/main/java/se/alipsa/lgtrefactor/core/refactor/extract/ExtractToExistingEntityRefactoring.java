package se.alipsa.lgtrefactor.core.refactor.extract;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.boundary.EntityBlock;
import se.alipsa.lgtrefactor.core.boundary.EntityInspector;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.SelectionTarget;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves the selected terms to the end of an existing entity, in this file or a file next to
 * it, re-indented to match the destination.
 */
public final class ExtractToExistingEntityRefactoring extends SelectionRefactoring {

  private static final Logger logger = LogManager.getLogger(ExtractToExistingEntityRefactoring.class);

  public ExtractToExistingEntityRefactoring() {
    super(RefactorKind.EXTRACT_TO_EXISTING_ENTITY);
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    SelectionTarget target = action.targetAs(SelectionTarget.class);
    Document doc = open(target.getUri());
    int[] span = completeTermLines(doc, target.getSelection());
    Optional<String> file = promptText("File containing the target entity", FileUris.fileName(doc.uri()),
        v -> v.isBlank() ? "Enter a file name" : null);
    if (file.isEmpty()) return RefactorResult.cancelled();
    String uri = FileUris.resolve(doc.uri(), file.get().trim());
    Document dest;
    if (uri.equals(doc.uri())) {
      dest = doc;
    } else if (env().documents().exists(uri)) {
      dest = open(uri);
    } else {
      throw RefactorException.precondition("File " + file.get().trim() + " not found");
    }

    List<EntityBlock> candidates = new ArrayList<>();
    for (EntityBlock block : entities(dest)) {
      boolean holdsSelection = dest == doc && block.getOpening().getStart() <= span[0] && block.getEndLine() >= span[1];
      if (!holdsSelection) candidates.add(block);
    }
    if (candidates.isEmpty()) {
      throw RefactorException.precondition("No other entity found in " + FileUris.fileName(uri));
    }
    EntityBlock chosen = candidates.get(0);
    if (candidates.size() > 1) {
      List<String> names = new ArrayList<>();
      candidates.forEach(b -> names.add(b.getKind().keyword() + " " + b.getIdentifier().render()));
      Optional<String> choice = promptChoice("Target entity", names);
      if (choice.isEmpty()) return RefactorResult.cancelled();
      chosen = candidates.get(Math.max(0, names.indexOf(choice.get())));
    }
    if (dest == doc && chosen.getOpening().getStart() <= span[1] && chosen.getEndLine() >= span[0]) {
      throw RefactorException.precondition("The selection overlaps the target entity");
    }

    String code = SelectionValidator.stripCommonIndent(selectedCode(doc, span));
    String indent = bodyIndent(dest, chosen, env().settings().indent());
    int endLine = chosen.getEndLine();
    boolean blankBefore = endLine > 0 && dest.lineAt(endLine - 1).isBlank();
    EditAssembler edits = new EditAssembler();
    edits.buffer(dest).insertBefore(endLine, (blankBefore ? "" : "\n") + SelectionValidator.indent(code, indent) + "\n");
    edits.buffer(doc).delete(span[0], span[1]);
    logger.debug("Moving lines {}..{} of {} into {}", span[0], span[1], doc.uri(), chosen);
    return apply(edits, "Code moved to " + chosen.getKind().keyword() + " " + chosen.getIdentifier().getName());
  }

  static List<EntityBlock> entities(Document doc) {
    List<EntityBlock> blocks = new ArrayList<>();
    int ln = 0;
    while (ln < doc.lineCount()) {
      Optional<EntityBlock> block = EntityInspector.isOpeningLine(doc.lineAt(ln))
          ? EntityInspector.entityAt(doc, ln) : Optional.empty();
      if (block.isPresent() && block.get().isClosed()) {
        blocks.add(block.get());
        ln = block.get().getEndLine() + 1;
      } else {
        ln++;
      }
    }
    return blocks;
  }

  /** Indentation of the first code line in the entity body, or the default indent. */
  private static String bodyIndent(Document doc, EntityBlock block, String fallback) {
    for (int ln = block.getOpening().getEnd() + 1; ln < block.getEndLine(); ln++) {
      String line = doc.lineAt(ln);
      if (!TermScanner.isCommentOrBlank(line)) return TermScanner.indentOf(line);
    }
    return fallback;
  }
}
