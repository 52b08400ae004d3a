package test.alipsa.lgtrefactor.core.refactor;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import test.alipsa.lgtrefactor.core.TestWorkspace;

import static org.junit.jupiter.api.Assertions.*;

class ReplaceMagicNumberTest {

  private static final String LIMITS = """
      :- object(limits).

      \tcheck(X) :-
      \t\tX > 100.

      :- end_object.
      """;

  @Test
  void publicScope_addsDeclarationsAndFactBeforeClause() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("limits.lgt", LIMITS);
    ws.input().answer("max_value", "public");

    RefactorResult result = ws.run(uri, Range.of(3, 7, 3, 7), RefactorKind.REPLACE_MAGIC_NUMBER);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("Replaced 100 with max_value/1", result.getMessage());
    assertEquals("""
        :- object(limits).

        \t:- public(max_value/1).
        \t:- mode(max_value(?integer), zero_or_one).
        \t:- info(max_value/1, [
        \t\tcomment is '',
        \t\targnames is ['MaxValue']
        \t]).

        \tmax_value(100).

        \tcheck(X) :-
        \t\tmax_value(MaxValue),
        \t\tX > MaxValue.

        :- end_object.
        """, ws.text(uri));
  }

  @Test
  void localScope_addsOnlyTheFact() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("limits.lgt", LIMITS);
    ws.input().answer("max_value", "local");

    ws.run(uri, ws.selection(uri, "100"), RefactorKind.REPLACE_MAGIC_NUMBER);

    assertEquals("""
        :- object(limits).

        \tmax_value(100).

        \tcheck(X) :-
        \t\tmax_value(MaxValue),
        \t\tX > MaxValue.

        :- end_object.
        """, ws.text(uri));
  }

  @Test
  void floatLiteral_usesFloatModeAndFreshVariableName() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("tax.lgt", "price(Net, Rate) :-\n\tRate is Net * 0.25.\n");
    ws.input().answer("rate", "private");

    ws.run(uri, ws.at(uri, "0.25"), RefactorKind.REPLACE_MAGIC_NUMBER);

    String text = ws.text(uri);
    assertTrue(text.contains(":- mode(rate(?float), zero_or_one)."), text);
    assertTrue(text.contains("argnames is ['Rate2']"), text);
    assertTrue(text.endsWith("price(Net, Rate) :-\n\trate(Rate2),\n\tRate is Net * Rate2.\n"), text);
  }

  @Test
  void notOfferedInHeadsFactsOrComments() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("n.lgt", "size(10).\nlimit(X) :- X < 5. % max 99\nname(abc1) :- true.\n");
    assertFalse(ws.offers(uri, Range.of(0, 5, 0, 5), RefactorKind.REPLACE_MAGIC_NUMBER));
    assertFalse(ws.offers(uri, Range.of(1, 26, 1, 26), RefactorKind.REPLACE_MAGIC_NUMBER));
    assertFalse(ws.offers(uri, Range.of(2, 8, 2, 8), RefactorKind.REPLACE_MAGIC_NUMBER));
    assertTrue(ws.offers(uri, Range.of(1, 16, 1, 16), RefactorKind.REPLACE_MAGIC_NUMBER));
  }
}
