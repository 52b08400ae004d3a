package test.alipsa.lgtrefactor.it;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.RefactorSettings;
import se.alipsa.lgtrefactor.core.host.Notifier;
import se.alipsa.lgtrefactor.core.host.UserInput;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorAction;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import se.alipsa.lgtrefactor.workspace.DocumentStore;
import se.alipsa.lgtrefactor.workspace.FileEditApplier;
import se.alipsa.lgtrefactor.workspace.RefactorServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/** Refactorings run through the workspace server against real files. */
class WorkspaceRefactoringTest {

  @TempDir
  Path dir;

  private final Deque<String> answers = new ArrayDeque<>();
  private final List<String> infos = new ArrayList<>();
  private final List<String> errors = new ArrayList<>();
  private RefactorServer server;

  @BeforeEach
  void startServer() {
    UserInput input = new UserInput() {
      @Override public Optional<String> promptChoice(String title, List<String> options) {
        return Optional.ofNullable(answers.poll());
      }
      @Override public Optional<String> promptText(String prompt, String placeholder, Validator validator) {
        return Optional.ofNullable(answers.poll());
      }
    };
    Notifier notifier = new Notifier() {
      @Override public void info(String message) { infos.add(message); }
      @Override public void error(String message) { errors.add(message); }
    };
    DocumentStore docs = new DocumentStore();
    RegexSymbolProvider symbols = new RegexSymbolProvider(dir);
    symbols.useDocuments(docs);
    server = RefactorServer.create(docs, new FileEditApplier(docs), symbols, input, notifier,
        RefactorSettings.defaults().with(RefactorSettings.AUTHOR, "Test Author"),
        Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
  }

  @AfterEach
  void stopServer() {
    server.close();
  }

  @Test
  void reorderArgumentsAcrossFiles() throws Exception {
    String lib = write("lib.lgt", "swap(A, B) :- x(A, B).\n");
    String app = write("app.lgt", "run :- swap(1, 2).\n");

    RefactorResult result = run(lib, Range.of(0, 0, 0, 0), RefactorKind.REORDER_ARGUMENTS);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("swap(B, A) :- x(A, B).\n", read(lib));
    assertEquals("run :- swap(2, 1).\n", read(app));
    assertTrue(errors.isEmpty(), errors.toString());
  }

  @Test
  void removeArgumentUpdatesDeclarationsAndCallersOnDisk() throws Exception {
    String lib = write("lib.lgt", """
        :- public(foo/1).
        :- mode(foo(?integer), zero_or_one).

        foo(_).
        """);
    String app = write("app.lgt", """
        bar :-
        \tfoo(1).
        """);

    RefactorResult result = run(lib, Range.of(0, 10, 0, 10), RefactorKind.REMOVE_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("""
        :- public(foo/0).
        :- mode(foo, zero_or_one).

        foo.
        """, read(lib));
    assertEquals("""
        bar :-
        \tfoo.
        """, read(app));
  }

  @Test
  void addParameterRewritesMessageReceiversInOtherFiles() throws Exception {
    String stack = write("stack.lgt", """
        :- object(stack(_Type_),
        \timplements(stackp)).

        \tpush(X) :-
        \t\tparameter(1, T),
        \t\tcheck(T, X).

        :- end_object.
        """);
    String client = write("client.lgt", """
        :- object(client).

        \trun :-
        \t\tstack(integer)::push(1).

        :- end_object.
        """);
    answers.add("_Size_");
    answers.add("2");

    RefactorResult result = run(stack, Range.of(0, 11, 0, 11), RefactorKind.ADD_PARAMETER);

    assertTrue(result.isApplied(), result.toString());
    assertTrue(read(stack).startsWith(":- object(stack(_Type_, _Size_),\n"), read(stack));
    assertTrue(read(client).contains("\t\tstack(integer, _Size_)::push(1).\n"), read(client));
  }

  @Test
  void includeRoundTrip() throws Exception {
    String inline = """
        :- object(app).

        \thelper(1).
        \thelper(2).

        :- end_object.
        """;
    String app = write("app.lgt", inline);
    answers.add("helpers");

    RefactorResult extracted = run(app, Range.of(2, 0, 4, 0), RefactorKind.REPLACE_WITH_INCLUDE);

    assertTrue(extracted.isApplied(), extracted.toString());
    assertEquals("helper(1).\nhelper(2).\n", Files.readString(dir.resolve("helpers.lgt")));
    assertEquals(inline.replace("\thelper(1).\n\thelper(2).\n", "\t:- include('helpers.lgt').\n"), read(app));

    RefactorResult inlined = run(app, Range.of(2, 5, 2, 5), RefactorKind.REPLACE_INCLUDE_WITH_CONTENT);

    assertTrue(inlined.isApplied(), inlined.toString());
    assertEquals(inline, read(app));
  }

  @Test
  void extractToEntityCreatesDatedEntityFile() throws Exception {
    String app = write("app.lgt", "helper(1).\nmain :- helper(1).\n");
    answers.add("object");
    answers.add("helpers");

    RefactorResult result = server.executeAsync(find(app, Range.of(0, 0, 1, 0), RefactorKind.EXTRACT_TO_ENTITY))
        .get(10, TimeUnit.SECONDS);

    assertTrue(result.isApplied(), result.toString());
    String created = Files.readString(dir.resolve("helpers.lgt"));
    assertTrue(created.startsWith(":- object(helpers).\n"), created);
    assertTrue(created.contains("\t\tauthor is 'Test Author',\n"), created);
    assertTrue(created.contains("\t\tdate is 2024-05-01,\n"), created);
    assertTrue(created.contains("\thelper(1).\n"), created);
    assertEquals("main :- helper(1).\n", read(app));
  }

  @Test
  void unsavedBufferIsRefactoredAndWritten() throws Exception {
    String d = write("d.lgt", ":- public([b/1]).\n");
    server.openFile(d, ":- public([c/1, a/2]).\n");

    RefactorResult result = run(d, Range.of(0, 0, 0, 0), RefactorKind.SORT_DIRECTIVE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals(":- public([a/2, c/1]).\n", read(d));
    assertEquals(":- public([a/2, c/1]).\n", server.documents().get(d));
  }

  private RefactorResult run(String uri, Range range, RefactorKind kind) {
    RefactorResult result = server.execute(find(uri, range, kind));
    assertTrue(answers.isEmpty(), "Unused answers: " + answers);
    return result;
  }

  private RefactorAction find(String uri, Range range, RefactorKind kind) {
    return server.availableRefactorings(uri, range).stream()
        .filter(a -> a.getKind() == kind)
        .findFirst()
        .orElseThrow(() -> new AssertionError(kind + " not offered at " + range));
  }

  private String write(String name, String text) throws IOException {
    Path file = dir.resolve(name);
    Files.writeString(file, text);
    return file.toUri().toString();
  }

  private String read(String uri) throws IOException {
    return Files.readString(DocumentStore.toPath(uri));
  }
}
