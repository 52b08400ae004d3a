package se.alipsa.lgtrefactor.workspace;

import se.alipsa.lgtrefactor.core.RefactorEnvironment;
import se.alipsa.lgtrefactor.core.RefactorSettings;
import se.alipsa.lgtrefactor.core.host.CancellationToken;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.host.EditApplier;
import se.alipsa.lgtrefactor.core.host.Notifier;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.host.UserInput;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** RefactorEnvironment used by the in-proc server bootstrap. */
final class DefaultRefactorEnvironment implements RefactorEnvironment {

  private final DocumentStore documents;
  private final SymbolProvider symbols;
  private final EditApplier editApplier;
  private final UserInput userInput;
  private final Notifier notifier;
  private final RefactorSettings settings;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  DefaultRefactorEnvironment(DocumentStore documents, SymbolProvider symbols, EditApplier editApplier,
                             UserInput userInput, Notifier notifier, RefactorSettings settings, Clock clock) {
    this.documents = Objects.requireNonNull(documents);
    this.symbols = Objects.requireNonNull(symbols);
    this.editApplier = Objects.requireNonNull(editApplier);
    this.userInput = Objects.requireNonNull(userInput);
    this.notifier = Objects.requireNonNull(notifier);
    this.settings = Objects.requireNonNull(settings);
    this.clock = Objects.requireNonNull(clock);
  }

  @Override public DocumentProvider documents() { return documents; }

  @Override public SymbolProvider symbols() { return symbols; }

  @Override public EditApplier editApplier() { return editApplier; }

  @Override public UserInput userInput() { return userInput; }

  @Override public Notifier notifier() { return notifier; }

  @Override public RefactorSettings settings() { return settings; }

  @Override public Clock clock() { return clock; }

  @Override public CancellationToken cancellation() { return cancelled::get; }

  void requestCancellation() {
    cancelled.set(true);
  }

  /** Called before each command; a cancel request only applies to the command it was made for. */
  void resetCancellation() {
    cancelled.set(false);
  }
}
