package test.alipsa.lgtrefactor.core.refactor;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import test.alipsa.lgtrefactor.core.TestWorkspace;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentRefactoringTest {

  @Test
  void addArgument_appendsToHeadAndKeepsBody() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "foo(X) :- bar(X).\n");
    ws.input().answer("Y", "2");

    RefactorResult result = ws.run(uri, Range.of(0, 0, 0, 0), RefactorKind.ADD_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("foo(X, Y) :- bar(X).\n", ws.text(uri));
    assertEquals(2, ws.input().prompts().size());
    assertEquals(1, ws.messages().infos.size());
  }

  @Test
  void addArgument_cancelLeavesFileAlone() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "foo(X) :- bar(X).\n");
    ws.input().cancel();

    RefactorResult result = ws.run(uri, Range.of(0, 0, 0, 0), RefactorKind.ADD_ARGUMENT);

    assertEquals(RefactorResult.Status.CANCELLED, result.getStatus());
    assertEquals("foo(X) :- bar(X).\n", ws.text(uri));
    assertNull(ws.lastEdit());
  }

  @Test
  void removeArgument_soleArgumentUpdatesDirectivesAndCalls() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        :- public(foo/1).
        :- mode(foo(?integer), zero_or_one).

        foo(_).

        bar :-
        \tfoo(1).
        """);

    RefactorResult result = ws.run(uri, Range.of(0, 10, 0, 10), RefactorKind.REMOVE_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertTrue(ws.input().prompts().isEmpty());
    assertEquals("""
        :- public(foo/0).
        :- mode(foo, zero_or_one).

        foo.

        bar :-
        \tfoo.
        """, ws.text(uri));
  }

  @Test
  void removeArgument_leavesOtherAritiesUntouched() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        pair(A, B) :- use(A).
        pair(A) :- use(A).
        run :- pair(1, 2), pair(3).
        """);
    ws.input().answer("2");

    RefactorResult result = ws.run(uri, Range.of(0, 0, 0, 0), RefactorKind.REMOVE_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("""
        pair(A) :- use(A).
        pair(A) :- use(A).
        run :- pair(1), pair(3).
        """, ws.text(uri));
  }

  @Test
  void removeArgument_notOfferedForAtom() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "run :- halt.\n");
    Range caret = Range.of(0, 8, 0, 8);
    assertTrue(ws.offers(uri, caret, RefactorKind.ADD_ARGUMENT));
    assertFalse(ws.offers(uri, caret, RefactorKind.REMOVE_ARGUMENT));
    assertFalse(ws.offers(uri, caret, RefactorKind.REORDER_ARGUMENTS));
  }

  @Test
  void reorderArguments_twoArgumentsSwapWithoutPrompt() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", "swap(A, B) :- x(A, B).\nrun :- swap(1, 2).\n");

    RefactorResult result = ws.run(uri, Range.of(0, 0, 0, 0), RefactorKind.REORDER_ARGUMENTS);

    assertTrue(result.isApplied(), result.toString());
    assertTrue(ws.input().prompts().isEmpty());
    assertEquals("swap(B, A) :- x(A, B).\nrun :- swap(2, 1).\n", ws.text(uri));
  }

  @Test
  void reorderArguments_identityOrderChangesNothing() {
    TestWorkspace ws = new TestWorkspace();
    String text = "baz(A, B, C) :- true.\n";
    String uri = ws.put("a.lgt", text);
    ws.input().answer("1,2,3");

    RefactorResult result = ws.run(uri, Range.of(0, 0, 0, 0), RefactorKind.REORDER_ARGUMENTS);

    assertTrue(result.isApplied());
    assertTrue(result.getMessage().endsWith("(no changes needed)"), result.getMessage());
    assertEquals(text, ws.text(uri));
    assertNull(ws.lastEdit());
  }

  @Test
  void addArgument_updatesInfoListsAndExamples() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        :- public(foo/1).
        :- mode(foo(+integer), one).
        :- info(foo/1, [
        \tcomment is 'Foo.',
        \targnames is ['N'],
        \targuments is [
        \t\t'N' - 'Number'
        \t],
        \texamples is ['One' - foo(1) - {yes}]
        ]).

        foo(1).
        """);
    ws.input().answer("Y", "2");

    RefactorResult result = ws.run(uri, Range.of(0, 10, 0, 10), RefactorKind.ADD_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("Added argument Y at position 2 of foo/1 (now foo/2)", result.getMessage());
    assertEquals("""
        :- public(foo/2).
        :- mode(foo(+integer, ?), one).
        :- info(foo/2, [
        \tcomment is 'Foo.',
        \targnames is ['N', 'Y'],
        \targuments is [
        \t\t'N' - 'Number',
        \t\t'Y' - ''
        \t],
        \texamples is ['One' - foo(1, Y) - {yes}]
        ]).

        foo(1, Y).
        """, ws.text(uri));
  }

  @Test
  void addArgument_usesModeAndMetaPlaceholders() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        :- public(map/2).
        :- meta_predicate(map(1, *)).
        :- mode(map(+callable, ?list), zero_or_more).

        map(G, L) :- call(G, L).
        """);
    ws.input().answer("Acc", "1");

    RefactorResult result = ws.run(uri, Range.of(0, 10, 0, 10), RefactorKind.ADD_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("""
        :- public(map/3).
        :- meta_predicate(map(*, 1, *)).
        :- mode(map(?, +callable, ?list), zero_or_more).

        map(Acc, G, L) :- call(G, L).
        """, ws.text(uri));
  }

  @Test
  void removeArgument_nonTerminalKeepsGrammarRules() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        :- public(greeting//1).

        greeting(_) --> [hello].

        run(L) :- phrase(greeting(world), L).
        """);

    RefactorResult result = ws.run(uri, Range.of(0, 10, 0, 10), RefactorKind.REMOVE_ARGUMENT);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("Removed argument at position 1 of greeting//1 (now greeting//0)", result.getMessage());
    assertEquals("""
        :- public(greeting//0).

        greeting --> [hello].

        run(L) :- phrase(greeting, L).
        """, ws.text(uri));
  }

  @Test
  void reorderArguments_rewritesConsecutiveClausesOnly() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("a.lgt", """
        len([], 0).
        len([_|T], N) :-
        \tlen(T, M),
        \tN is M + 1.
        len(X) :- len(X, _).
        """);

    RefactorResult result = ws.run(uri, Range.of(0, 0, 0, 0), RefactorKind.REORDER_ARGUMENTS);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("""
        len(0, []).
        len(N, [_|T]) :-
        \tlen(M, T),
        \tN is M + 1.
        len(X) :- len(_, X).
        """, ws.text(uri));
  }

  @Test
  void addThenRemoveArgument_restoresOriginal() {
    TestWorkspace ws = new TestWorkspace();
    String original = """
        :- public(foo/1).
        :- mode(foo(+atom), one).
        :- info(foo/1, [
        \targnames is ['X'],
        \targuments is ['X' - 'Input']
        ]).

        foo(X) :- bar(X).

        run :- foo(a).
        """;
    String uri = ws.put("a.lgt", original);
    ws.input().answer("Y", "2");
    assertTrue(ws.run(uri, Range.of(0, 10, 0, 10), RefactorKind.ADD_ARGUMENT).isApplied());
    assertTrue(ws.text(uri).contains("argnames is ['X', 'Y']"), ws.text(uri));
    assertTrue(ws.text(uri).contains("run :- foo(a, Y)."), ws.text(uri));

    ws.input().answer("2");
    assertTrue(ws.run(uri, Range.of(0, 10, 0, 10), RefactorKind.REMOVE_ARGUMENT).isApplied());

    assertEquals(original, ws.text(uri));
  }
}
