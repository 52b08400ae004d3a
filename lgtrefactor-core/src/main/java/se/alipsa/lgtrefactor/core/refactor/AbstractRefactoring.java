package se.alipsa.lgtrefactor.core.refactor;

import se.alipsa.lgtrefactor.core.RefactorEnvironment;
import se.alipsa.lgtrefactor.core.RefactorException;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.Refactoring;
import se.alipsa.lgtrefactor.core.edit.EditAssembler;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.UserInput;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.RefactorTarget;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/** Shared plumbing: environment access, document opening and the final apply step. */
public abstract class AbstractRefactoring implements Refactoring {

  private final RefactorKind kind;
  private RefactorEnvironment env;

  protected AbstractRefactoring(RefactorKind kind) {
    this.kind = kind;
  }

  @Override
  public final RefactorKind kind() {
    return kind;
  }

  @Override
  public void configure(RefactorEnvironment env) {
    this.env = env;
  }

  protected RefactorEnvironment env() {
    if (env == null) throw new IllegalStateException(kind + " used before configure()");
    return env;
  }

  protected RefactorAction action(RefactorTarget target) {
    return new RefactorAction(kind, target);
  }

  protected List<RefactorAction> offer(RefactorTarget target) {
    return List.of(action(target));
  }

  protected Document open(String uri) throws RefactorException {
    try {
      return env().documents().open(uri);
    } catch (IOException e) {
      throw RefactorException.host("Cannot read " + uri + ": " + e.getMessage(), e);
    }
  }

  protected Optional<String> promptText(String prompt, String placeholder, UserInput.Validator validator) {
    return env().userInput().promptText(prompt, placeholder, validator);
  }

  protected Optional<String> promptChoice(String title, List<String> options) {
    return env().userInput().promptChoice(title, options);
  }

  /**
   * A new order for {@code n} positions (1-based old positions, new order). Two positions have
   * only one other order, which is returned without asking.
   */
  protected Optional<int[]> askPermutation(int n, String what) {
    if (n == 2) return Optional.of(new int[] {2, 1});
    StringBuilder identity = new StringBuilder();
    StringBuilder reversed = new StringBuilder();
    for (int i = 1; i <= n; i++) {
      if (i > 1) {
        identity.append(',');
        reversed.append(',');
      }
      identity.append(i);
      reversed.append(n + 1 - i);
    }
    return promptText("New order for " + what + " as old positions, e.g. " + reversed, identity.toString(),
        Validators.permutationOf(n))
        .map(v -> Validators.parsePermutation(v, n));
  }

  /**
   * Hand the assembled edits to the host. An empty batch is reported as applied without calling
   * the host.
   */
  protected RefactorResult apply(EditAssembler edits, String summary) throws RefactorException {
    var workspaceEdit = edits.toWorkspaceEdit();
    if (workspaceEdit.isEmpty()) {
      return RefactorResult.applied(workspaceEdit, summary + " (no changes needed)");
    }
    if (!env().editApplier().applyEdits(workspaceEdit)) {
      throw new RefactorException(RefactorException.Reason.HOST, "The editor rejected the edits for: " + summary);
    }
    return RefactorResult.applied(workspaceEdit, summary);
  }
}
