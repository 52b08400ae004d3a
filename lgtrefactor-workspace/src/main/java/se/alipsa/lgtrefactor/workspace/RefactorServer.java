package se.alipsa.lgtrefactor.workspace;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import se.alipsa.lgtrefactor.core.RefactorEngine;
import se.alipsa.lgtrefactor.core.RefactorFacade;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.RefactorSettings;
import se.alipsa.lgtrefactor.core.RefactoringRegistry;
import se.alipsa.lgtrefactor.core.host.EditApplier;
import se.alipsa.lgtrefactor.core.host.Notifier;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.host.UserInput;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * In-process refactoring server over a file system workspace.
 * - Tracks open editor buffers in a DocumentStore, falling back to disk for the rest
 * - Applies edits through a FileEditApplier
 * - Runs commands one at a time on its own worker thread
 */
public final class RefactorServer implements RefactorFacade, AutoCloseable {

  private static final Logger logger = LogManager.getLogger(RefactorServer.class);

  private final RefactorEngine engine;
  private final DocumentStore docs;
  private final DefaultRefactorEnvironment env;
  private final ExecutorService executor;

  private RefactorServer(RefactorEngine engine, DocumentStore docs, DefaultRefactorEnvironment env) {
    this.engine = Objects.requireNonNull(engine);
    this.docs = Objects.requireNonNull(docs);
    this.env = Objects.requireNonNull(env);
    this.executor = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "lgtrefactor-worker");
      t.setDaemon(true);
      return t;
    });
  }

  /** Server with settings loaded from system properties and refactorings discovered via ServiceLoader. */
  public static RefactorServer createDefault(SymbolProvider symbols, UserInput input, Notifier notifier) {
    return create(symbols, input, notifier, RefactorSettings.load(null), Clock.systemDefaultZone());
  }

  /** Advanced factory for hosts and tests that supply their own settings and clock. */
  public static RefactorServer create(SymbolProvider symbols,
                                      UserInput input,
                                      Notifier notifier,
                                      RefactorSettings settings,
                                      Clock clock) {
    DocumentStore docs = new DocumentStore();
    return create(docs, new FileEditApplier(docs), symbols, input, notifier, settings, clock);
  }

  /** Factory with a custom edit applier, e.g. one that defers to an editor's own apply call. */
  public static RefactorServer create(DocumentStore docs,
                                      EditApplier applier,
                                      SymbolProvider symbols,
                                      UserInput input,
                                      Notifier notifier,
                                      RefactorSettings settings,
                                      Clock clock) {
    DefaultRefactorEnvironment env = new DefaultRefactorEnvironment(docs, symbols, applier, input,
        Objects.requireNonNullElse(notifier, Notifier.NO_OP), settings, clock);
    RefactorEngine engine = new RefactorEngine(new RefactoringRegistry(env), env);
    return new RefactorServer(engine, docs, env);
  }

  // --- document lifecycle -----------------------------------------------------------------------

  public void openFile(String uri, String text) {
    docs.put(uri, text);
  }

  public void changeFile(String uri, String text) {
    docs.put(uri, text);
  }

  public void closeFile(String uri) {
    docs.remove(uri);
  }

  public DocumentStore documents() {
    return docs;
  }

  // --- RefactorFacade ---------------------------------------------------------------------------

  @Override
  public List<RefactorAction> availableRefactorings(String uri, Range range) {
    return engine.availableRefactorings(uri, range);
  }

  /** Runs the action on the calling thread. */
  @Override
  public RefactorResult execute(RefactorAction action) {
    env.resetCancellation();
    return engine.execute(action);
  }

  /** Queues the action on the worker thread; commands run strictly one after another. */
  public CompletableFuture<RefactorResult> executeAsync(RefactorAction action) {
    return CompletableFuture.supplyAsync(() -> execute(action), executor);
  }

  /** Asks the running command to stop at its next checkpoint. */
  public void cancel() {
    env.requestCancellation();
  }

  // --- lifecycle --------------------------------------------------------------------------------

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warn("Refactoring worker did not stop in time");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
