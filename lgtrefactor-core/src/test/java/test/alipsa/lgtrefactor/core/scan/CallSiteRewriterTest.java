package test.alipsa.lgtrefactor.core.scan;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.scan.CallSiteRewriter;
import se.alipsa.lgtrefactor.core.scan.CallSiteRewriter.Mode;
import se.alipsa.lgtrefactor.core.scan.IndicatorRewriter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallSiteRewriterTest {

  @Test
  void rewrite_onlyTouchesMatchingArity() {
    String text = "foo(1), foo(1, 2), foo, food(3)";
    String out = CallSiteRewriter.rewrite(text, "foo", 1, Mode.PREDICATE,
        (name, args) -> name + "(" + args.render() + ", x)");
    assertEquals("foo(1, x), foo(1, 2), foo, food(3)", out);
  }

  @Test
  void rewrite_handlesNestedCalls() {
    String out = CallSiteRewriter.rewrite("foo(foo(a))", "foo", 1, Mode.PREDICATE,
        (name, args) -> "bar(" + args.render() + ")");
    assertEquals("bar(bar(a))", out);
  }

  @Test
  void rewrite_skipsSitesTheFilterRejects() {
    String text = "foo(1)::bar, foo(2)";
    String out = CallSiteRewriter.rewrite(text, "foo", 1, Mode.ENTITY, (name, args) -> name,
        (t, site) -> t.startsWith("::", site.getEnd()));
    assertEquals("foo::bar, foo(2)", out);
  }

  @Test
  void findCalls_bareAtomsAreArityZeroButIndicatorsAreNot() {
    assertEquals(1, CallSiteRewriter.findCalls("run :- foo, X = foo/1.", "foo", 0, Mode.PREDICATE).size());
    assertTrue(CallSiteRewriter.findCalls("X = 'foo(1)'", "foo", 1, Mode.PREDICATE).isEmpty());
  }

  @Test
  void containsCall_distinguishesReceiversFromPredicates() {
    assertFalse(CallSiteRewriter.containsCall("stack::push(1)", "stack", 0, Mode.PREDICATE));
    assertTrue(CallSiteRewriter.containsCall("stack::push(1)", "stack", 0, Mode.ENTITY));
  }

  @Test
  void indicatorRewriter_replacesOnlyCodeOccurrences() {
    Indicator from = Indicator.predicate("foo", 1);
    Indicator to = Indicator.predicate("foo", 2);
    String text = ":- public([foo/1, foo//1, foo/10]). % foo/1";
    assertEquals(List.of(11), IndicatorRewriter.find(text, from));
    assertEquals(":- public([foo/2, foo//1, foo/10]). % foo/1", IndicatorRewriter.replace(text, from, to));
    assertTrue(IndicatorRewriter.contains(text, Indicator.nonTerminal("foo", 1)));
  }
}
