package test.alipsa.lgtrefactor.core.refactor;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.RefactorResult;
import se.alipsa.lgtrefactor.core.model.Range;
import se.alipsa.lgtrefactor.core.model.RefactorKind;
import test.alipsa.lgtrefactor.core.TestWorkspace;

import static org.junit.jupiter.api.Assertions.*;

class VariableRefactoringTest {

  @Test
  void inlineVariable_bracketsOperatorTermsAndDropsGoal() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("v.lgt", "area(W, H, A) :-\n\tProduct = W * H,\n\tA is Product.\n");

    RefactorResult result = ws.run(uri, ws.at(uri, "Product"), RefactorKind.INLINE_VARIABLE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("area(W, H, A) :-\n\tA is (W * H).\n", ws.text(uri));
  }

  @Test
  void inlineVariable_lastGoalTurnsRuleIntoFact() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("v.lgt", "answer(X) :-\n\tX = 42.\n");

    RefactorResult result = ws.run(uri, Range.of(0, 7, 0, 7), RefactorKind.INLINE_VARIABLE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("answer(42).\n", ws.text(uri));
  }

  @Test
  void inlineVariable_notOfferedWithoutBinding() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("v.lgt", "foo(X) :- bar(X).\n");
    assertFalse(ws.offers(uri, Range.of(0, 4, 0, 4), RefactorKind.INLINE_VARIABLE));
  }

  @Test
  void unifyWithNewVariable_addsUnificationBeforeGoal() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("v.lgt", "total(X, Y) :-\n\tY is X * 100.\n");
    ws.input().answer("Rate");

    RefactorResult result = ws.run(uri, ws.selection(uri, "100"), RefactorKind.UNIFY_WITH_NEW_VARIABLE);

    assertTrue(result.isApplied(), result.toString());
    assertEquals("total(X, Y) :-\n\tRate = 100,\n\tY is X * Rate.\n", ws.text(uri));
  }

  @Test
  void unifyWithNewVariable_notOfferedForWholeGoalOrVariable() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("v.lgt", "total(X, Y) :-\n\tY is X * 100.\n");
    assertFalse(ws.offers(uri, ws.selection(uri, "Y is X * 100"), RefactorKind.UNIFY_WITH_NEW_VARIABLE));
    assertFalse(ws.offers(uri, Range.of(1, 6, 1, 7), RefactorKind.UNIFY_WITH_NEW_VARIABLE));
  }

  @Test
  void incrementThenDecrementNumberedVariables() {
    TestWorkspace ws = new TestWorkspace();
    String original = "step(S0, S) :-\n\tfoo(S0, S1),\n\tbar(S1, S2),\n\tbaz(S2, S).\n";
    String uri = ws.put("v.lgt", original);
    Range onS1 = ws.at(uri, "S1");
    assertFalse(ws.offers(uri, onS1, RefactorKind.DECREMENT_NUMBERED_VARIABLES));

    RefactorResult inc = ws.run(uri, onS1, RefactorKind.INCREMENT_NUMBERED_VARIABLES);

    assertTrue(inc.isApplied(), inc.toString());
    assertEquals("step(S0, S) :-\n\tfoo(S0, S2),\n\tbar(S2, S3),\n\tbaz(S3, S).\n", ws.text(uri));

    RefactorResult dec = ws.run(uri, ws.at(uri, "S2"), RefactorKind.DECREMENT_NUMBERED_VARIABLES);

    assertTrue(dec.isApplied(), dec.toString());
    assertEquals(original, ws.text(uri));
  }

  @Test
  void numberedVariables_notOfferedOnPlainVariable() {
    TestWorkspace ws = new TestWorkspace();
    String uri = ws.put("v.lgt", "step(S0, S) :-\n\tfoo(S0, S).\n");
    Range onS = Range.of(0, 9, 0, 9);
    assertFalse(ws.offers(uri, onS, RefactorKind.INCREMENT_NUMBERED_VARIABLES));
    assertFalse(ws.offers(uri, onS, RefactorKind.DECREMENT_NUMBERED_VARIABLES));
  }
}
