package test.alipsa.lgtrefactor.core.boundary;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.boundary.CursorInspector;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.TextDocument;
import se.alipsa.lgtrefactor.core.model.Indicator;
import se.alipsa.lgtrefactor.core.model.Position;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CursorInspectorTest {

  @Test
  void wordAt_acceptsCaretJustAfterWord() {
    assertArrayEquals(new int[] {4, 7}, CursorInspector.wordAt("foo(Bar)", 5).orElseThrow());
    assertArrayEquals(new int[] {4, 7}, CursorInspector.wordAt("foo(Bar)", 7).orElseThrow());
    assertTrue(CursorInspector.wordAt("a :- b", 2).isEmpty());
  }

  @Test
  void variableAt_skipsAtomsAndQuotes() {
    assertEquals(Optional.of("Bar"), CursorInspector.variableAt("foo(Bar)", 5));
    assertTrue(CursorInspector.variableAt("foo(bar)", 5).isEmpty());
    assertTrue(CursorInspector.variableAt("X = 'Abc'", 6).isEmpty());
  }

  @Test
  void indicatorAt_findsPredicateAndNonTerminalIndicators() {
    assertEquals(Optional.of(Indicator.predicate("foo", 2)), CursorInspector.indicatorAt(":- public(foo/2).", 11));
    assertEquals(Optional.of(Indicator.nonTerminal("digits", 1)),
        CursorInspector.indicatorAt(":- public(digits//1).", 12));
    assertTrue(CursorInspector.indicatorAt("% foo/2", 3).isEmpty());
  }

  @Test
  void callAt_countsArgumentsAcrossLines() {
    Document doc = TextDocument.of("mem:///c.lgt", "run :-\n\tfoo(a,\n\t\tb(c, d)),\n\thalt,\n\tstack::push(1).");
    assertEquals(Optional.of(Indicator.predicate("foo", 2)), CursorInspector.callAt(doc, new Position(1, 1)));
    assertEquals(Optional.of(Indicator.predicate("halt", 0)), CursorInspector.callAt(doc, new Position(3, 2)));
    assertTrue(CursorInspector.callAt(doc, new Position(4, 2)).isEmpty());
  }

  @Test
  void callAt_ignoresDirectiveNames() {
    Document doc = TextDocument.of("mem:///c.lgt", ":- initialization(main).");
    assertTrue(CursorInspector.callAt(doc, new Position(0, 4)).isEmpty());
  }
}
