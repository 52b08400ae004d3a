package test.alipsa.lgtrefactor.core.refactor;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.RefactorSettings;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import test.alipsa.lgtrefactor.core.TestWorkspace;

import static org.junit.jupiter.api.Assertions.*;

class ExtractRefactoringTest {

  @Test
  void extractPredicate_passesSharedVariables() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("r.lgt", """
        report(Items) :-
        \tlength(Items, N),
        \tN > 0,
        \tformat("~w~n", [N]).
        """);
    ws.input().answer("check_items");

    RefactorResult result = ws.run(uri, Range.of(1, 0, 3, 0), RefactorKind.EXTRACT_PREDICATE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("Extracted predicate check_items/2 from report/1", result.getMessage());
    assertEquals("""
        report(Items) :-
        \tcheck_items(Items, N),
        \tformat("~w~n", [N]).

        check_items(Items, N) :-
        \tlength(Items, N),
        \tN > 0.
        """, ws.text(uri));
  }

  @Test
  void extractPredicate_noSharedVariablesGivesAtom() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("r.lgt", "main :- foo(X), bar(X), baz.\n");
    ws.input().answer("helper");

    RefactorResult result = ws.run(uri, ws.selection(uri, "foo(X), bar(X)"), RefactorKind.EXTRACT_PREDICATE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("main :- helper, baz.\n\nhelper :-\n\tfoo(X), bar(X).\n", ws.text(uri));
  }

  @Test
  void extractToFile_movesTermsVerbatim() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "a.\nb.\nc.\n");
    ws.input().answer("part");

    RefactorResult result = ws.run(uri, Range.of(1, 0, 2, 0), RefactorKind.EXTRACT_TO_FILE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("a.\nc.\n", ws.text(uri));
    assertEquals("b.\n", ws.text(TestWorkspace.ROOT + "part.lgt"));
  }

  @Test
  void extractToFile_incompleteSelectionFails() {
    TestWorkspace ws = new TestWorkspace();
    String text = "foo :-\n\tbar,\n\tbaz.\n";
    String uri = ws.put("a.lgt", text);

    RefactorResult result = ws.run(uri, Range.of(0, 0, 2, 0), RefactorKind.EXTRACT_TO_FILE);

    assertEquals(RefactorResult.Status.FAILED, result.getStatus());
    assertTrue(result.getMessage().contains("incomplete terms"), result.getMessage());
    assertEquals(text, ws.text(uri));
  }

  @Test
  void extractToEntity_wrapsCodeInNewObject() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "helper(1).\nhelper(2).\nmain :- helper(1).\n");
    ws.input().answer("object", "helpers");

    RefactorResult result = ws.run(uri, Range.of(0, 0, 2, 0), RefactorKind.EXTRACT_TO_ENTITY);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("Code extracted to new object helpers", result.getMessage());
    assertEquals("main :- helper(1).\n", ws.text(uri));
    assertEquals("""
        :- object(helpers).

        \t:- info([
        \t\tversion is 1:0:0,
        \t\tauthor is 'Author',
        \t\tdate is 2024-05-01,
        \t\tcomment is 'Extracted object entity'
        \t]).

        \thelper(1).
        \thelper(2).

        :- end_object.
        """, ws.text(TestWorkspace.ROOT + "helpers.lgt"));
  }

  @Test
  void extractToEntity_usesConfiguredAuthor() {
    TestWorkspace ws = new TestWorkspace();
    ws.setSettings(ws.settings().with(RefactorSettings.AUTHOR, "Jane O'Hara"));
    String uri = ws.put("a.lgt", "helper(1).\n");
    ws.input().answer("category", "helpers");

    ws.run(uri, Range.of(0, 0, 0, 10), RefactorKind.EXTRACT_TO_ENTITY);

    String created = ws.text(TestWorkspace.ROOT + "helpers.lgt");
    assertTrue(created.startsWith(":- category(helpers).\n"), created);
    assertTrue(created.contains("author is 'Jane O''Hara',"), created);
    assertTrue(created.endsWith(":- end_category.\n"), created);
  }

  @Test
  void extractToExistingEntity_appendsBeforeEndDirective() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        :- object(util).

        \tid(X, X).

        :- end_object.

        double(X, Y) :-
        \tY is X * 2.
        """);
    ws.input().answer("a.lgt");

    RefactorResult result = ws.run(uri, Range.of(6, 0, 8, 0), RefactorKind.EXTRACT_TO_EXISTING_ENTITY);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("Code moved to object util", result.getMessage());
    assertEquals("""
        :- object(util).

        \tid(X, X).

        \tdouble(X, Y) :-
        \t\tY is X * 2.

        :- end_object.

        """, ws.text(uri));
  }

  @Test
  void extractToExistingEntity_missingFileFails() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "double(X, Y) :-\n\tY is X * 2.\n");
    ws.input().answer("nowhere.lgt");

    RefactorResult result = ws.run(uri, Range.of(0, 0, 2, 0), RefactorKind.EXTRACT_TO_EXISTING_ENTITY);

    assertEquals(RefactorResult.Status.FAILED, result.getStatus());
    assertEquals("File nowhere.lgt not found", result.getMessage());
  }
}
