package test.alipsa.lgtrefactor.core;

import se.alipsa.lgtrefactor.core.RefactorEngine;
import se.alipsa.lgtrefactor.core.RefactorEnvironment;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.RefactorSettings;
import se.alipsa.lgtrefactor.core.RefactoringRegistry;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.DocumentProvider;
import se.alipsa.lgtrefactor.core.host.EditApplier;
import se.alipsa.lgtrefactor.core.host.Notifier;
import se.alipsa.lgtrefactor.core.host.SymbolProvider;
import se.alipsa.lgtrefactor.core.host.TextDocument;
import se.alipsa.lgtrefactor.core.host.UserInput;
import se.alipsa.lgtrefactor.core.model.Position;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.core.model.TextEdit;
import se.alipsa.lgtrefactor.core.model.WorkspaceEdit;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * In-memory host for refactoring tests: documents keyed by {@code mem:///ws/<name>}, scripted
 * prompts, recorded messages and a word-scanning symbol provider.
 */
public final class TestWorkspace implements RefactorEnvironment, DocumentProvider, EditApplier {

  public static final String ROOT = "mem:///ws/";

  private final Map<String, String> files = new LinkedHashMap<>();
  private final ScriptedInput input = new ScriptedInput();
  private final RecordingNotifier notifier = new RecordingNotifier();
  private final ScanningSymbolProvider symbols = new ScanningSymbolProvider(this);
  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  private RefactorSettings settings = RefactorSettings.defaults();
  private boolean rejectEdits;
  private WorkspaceEdit lastEdit;
  private RefactorEngine engine;

  /** Add a file and return its uri. */
  public String put(String name, String text) {
    String uri = ROOT + name;
    files.put(uri, text);
    return uri;
  }

  public String text(String uri) {
    String text = files.get(uri);
    assertNotNull(text, "No file " + uri);
    return text;
  }

  public boolean has(String uri) {
    return files.containsKey(uri);
  }

  public List<String> uris() {
    return new ArrayList<>(files.keySet());
  }

  public ScriptedInput input() {
    return input;
  }

  public RecordingNotifier messages() {
    return notifier;
  }

  public void setSettings(RefactorSettings settings) {
    this.settings = settings;
  }

  public void rejectEdits() {
    this.rejectEdits = true;
  }

  public WorkspaceEdit lastEdit() {
    return lastEdit;
  }

  public RefactorEngine engine() {
    if (engine == null) engine = new RefactorEngine(new RefactoringRegistry(this), this);
    return engine;
  }

  public List<RefactorAction> actions(String uri, Range range) {
    return engine().availableRefactorings(uri, range);
  }

  public Optional<RefactorAction> find(String uri, Range range, RefactorKind kind) {
    return actions(uri, range).stream().filter(a -> a.getKind() == kind).findFirst();
  }

  public boolean offers(String uri, Range range, RefactorKind kind) {
    return find(uri, range, kind).isPresent();
  }

  /** Detect {@code kind} at {@code range} and run it. */
  public RefactorResult run(String uri, Range range, RefactorKind kind) {
    RefactorAction action = find(uri, range, kind)
        .orElseThrow(() -> new AssertionError(kind + " not offered at " + range + " in " + uri));
    RefactorResult result = engine().execute(action);
    assertFalse(input.hasPending(), "Unused scripted answers: " + input.pending());
    return result;
  }

  /** Caret on the {@code nth} (0-based) occurrence of {@code needle}, {@code offset} characters in. */
  public Position caret(String uri, String needle, int nth, int offset) {
    String text = text(uri);
    int idx = -1;
    for (int k = 0; k <= nth; k++) {
      idx = text.indexOf(needle, idx + 1);
      assertTrue(idx >= 0, "'" + needle + "' occurrence " + nth + " not found in " + uri);
    }
    return positionAt(text, idx + offset);
  }

  public Range at(String uri, String needle) {
    return Range.caret(caret(uri, needle, 0, 0));
  }

  /** Selection covering the first occurrence of {@code needle}. */
  public Range selection(String uri, String needle) {
    Position start = caret(uri, needle, 0, 0);
    return new Range(start, positionAt(text(uri), text(uri).indexOf(needle) + needle.length()));
  }

  static Position positionAt(String text, int offset) {
    int line = 0;
    int col = 0;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == '\n') {
        line++;
        col = 0;
      } else {
        col++;
      }
    }
    return new Position(line, col);
  }

  @Override public DocumentProvider documents() { return this; }
  @Override public SymbolProvider symbols() { return symbols; }
  @Override public EditApplier editApplier() { return this; }
  @Override public UserInput userInput() { return input; }
  @Override public Notifier notifier() { return notifier; }
  @Override public RefactorSettings settings() { return settings; }
  @Override public Clock clock() { return clock; }

  @Override
  public Document open(String uri) throws IOException {
    String text = files.get(uri);
    if (text == null) throw new NoSuchFileException(uri);
    return TextDocument.of(uri, text);
  }

  @Override
  public boolean exists(String uri) {
    return files.containsKey(uri);
  }

  @Override
  public boolean applyEdits(WorkspaceEdit edit) {
    if (rejectEdits) return false;
    Map<String, String> next = new LinkedHashMap<>(files);
    next.putAll(edit.getCreatedFiles());
    for (Map.Entry<String, List<TextEdit>> e : edit.getEdits().entrySet()) {
      String base = next.get(e.getKey());
      if (base == null) return false;
      next.put(e.getKey(), TextDocument.of(e.getKey(), base).applyEdits(e.getValue()));
    }
    files.clear();
    files.putAll(next);
    lastEdit = edit;
    return true;
  }
}
