package se.alipsa.lgtrefactor.core;

import se.alipsa.lgtrefactor.core.host.CancellationToken;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.host.EditApplier;
import se.alipsa.lgtrefactor.core.host.Notifier;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.host.UserInput;

import java.time.Clock;

/** Host collaborators handed to every refactoring on registration. */
public interface RefactorEnvironment {
  DocumentProvider documents();
  SymbolProvider symbols();
  EditApplier editApplier();
  UserInput userInput();
  Notifier notifier();
  RefactorSettings settings();

  default Clock clock() { return Clock.systemDefaultZone(); }

  /** Token for the command currently running. */
  default CancellationToken cancellation() { return CancellationToken.NONE; }
}
