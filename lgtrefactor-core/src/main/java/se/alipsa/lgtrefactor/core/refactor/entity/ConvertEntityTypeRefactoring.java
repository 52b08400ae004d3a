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
import se.alipsa.lgtrefactor.core.scan.ArgumentList;
import se.alipsa.lgtrefactor.core.scan.TermScanner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns an object, protocol or category into another kind of entity. The opening and closing
 * directives change keyword; relations the new kind does not support are dropped.
 */
public final class ConvertEntityTypeRefactoring extends EntityRefactoring {

  private static final Logger logger = LogManager.getLogger(ConvertEntityTypeRefactoring.class);

  public ConvertEntityTypeRefactoring() {
    super(RefactorKind.CONVERT_ENTITY_TYPE);
  }

  @Override
  protected boolean accepts(EntityBlock block) {
    return block.isClosed();
  }

  @Override
  public RefactorResult execute(RefactorAction action) throws RefactorException {
    EntityTarget target = action.targetAs(EntityTarget.class);
    Document doc = open(target.getUri());
    EntityBlock block = resolve(doc, target);
    if (!block.isClosed()) {
      throw RefactorException.precondition("The " + block.getKind().keyword() + " has no closing directive");
    }
    List<String> options = new ArrayList<>();
    for (EntityKind k : EntityKind.values()) {
      if (k != block.getKind()) options.add(k.keyword());
    }
    Optional<String> choice = promptChoice("Convert " + block.getIdentifier().getName() + " to", options);
    if (choice.isEmpty()) return RefactorResult.cancelled();
    EntityKind to = EntityKind.fromKeyword(choice.get())
        .orElseThrow(() -> RefactorException.precondition("Unknown entity type: " + choice.get()));
    if (to == EntityKind.PROTOCOL && block.getIdentifier().isParametric()) {
      throw RefactorException.precondition("A parametric entity cannot become a protocol");
    }

    EditAssembler edits = new EditAssembler();
    LineEditBuffer buffer = edits.buffer(doc);
    LineRange opening = block.getOpening();
    List<String> dropped = new ArrayList<>();
    String converted = convertOpening(TermBoundaries.termText(doc, opening), to, dropped);
    buffer.replace(opening.getStart(), opening.getEnd(), converted);
    String ending = doc.lineAt(block.getEndLine());
    buffer.replace(block.getEndLine(), block.getEndLine(),
        ending.replace("end_" + block.getKind().keyword(), "end_" + to.keyword()));
    if (!dropped.isEmpty()) {
      String msg = "Dropped relations not supported by " + to.withArticle() + ": " + String.join(", ", dropped);
      logger.warn("{} {}", block.getIdentifier().getName(), msg);
      env().notifier().warn(msg);
    }
    return apply(edits, "Converted " + block.getKind().keyword() + " " + block.getIdentifier().getName()
        + " to " + to.withArticle());
  }

  /** The opening directive with the new keyword and only the relations {@code to} supports. */
  static String convertOpening(String text, EntityKind to, List<String> dropped) {
    int open = Directives.openParen(text);
    int close = TermScanner.findMatchingClose(text, open, '(', ')');
    if (open < 0 || close < 0) return text;
    String head = text.substring(0, open);
    int kw = head.lastIndexOf(Directives.name(text));
    head = head.substring(0, kw) + to.keyword();
    ArgumentList args = ArgumentList.parse(text.substring(open + 1, close));
    for (int i = args.size() - 1; i >= 1; i--) {
      String relation = args.get(i);
      int paren = relation.indexOf('(');
      String name = (paren < 0 ? relation : relation.substring(0, paren)).trim();
      if (!to.supportsRelation(name)) {
        dropped.add(0, relation);
        args.remove(i);
      }
    }
    return head + "(" + args.render() + text.substring(close);
  }
}
