package test.alipsa.lgtrefactor.core.boundary;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.boundary.SelectionValidator;
import se.alipsa.lgtrefactor.core.host.Document;
import se.alipsa.lgtrefactor.core.host.TextDocument;
import se.alipsa.lgtrefactor.core.model.Range;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SelectionValidatorTest {

  private final Document doc = TextDocument.of("mem:///s.lgt", """
      foo(X) :-
      \tbar(X),
      \tbaz(X).
      qux.
      """);

  @Test
  void validateCompleteTerms_acceptsWholeClauses() {
    assertEquals(Optional.empty(), SelectionValidator.validateCompleteTerms(doc, Range.of(0, 0, 3, 0)));
    assertEquals(Optional.empty(), SelectionValidator.validateCompleteTerms(doc, Range.of(0, 0, 3, 4)));
  }

  @Test
  void validateCompleteTerms_rejectsSelectionStartingMidClause() {
    Optional<String> problem = SelectionValidator.validateCompleteTerms(doc, Range.of(1, 0, 3, 0));
    assertTrue(problem.orElseThrow().contains("middle of a term"), problem.get());
  }

  @Test
  void validateCompleteTerms_rejectsTrailingComma() {
    Optional<String> problem = SelectionValidator.validateCompleteTerms(doc, Range.of(0, 0, 2, 0));
    assertTrue(problem.orElseThrow().contains("incomplete terms"), problem.get());
  }

  @Test
  void validateCompleteTerms_rejectsBlankSelection() {
    Document d = TextDocument.of("mem:///s.lgt", "foo.\n\n\nbar.");
    assertEquals(Optional.of("The selection is empty."), SelectionValidator.validateCompleteTerms(d, Range.of(1, 0, 2, 0)));
  }

  @Test
  void lineSpan_excludesLineEndingAtColumnZero() {
    assertArrayEquals(new int[] {0, 2}, SelectionValidator.lineSpan(Range.of(0, 0, 3, 0)));
    assertArrayEquals(new int[] {1, 1}, SelectionValidator.lineSpan(Range.of(1, 0, 1, 0)));
  }

  @Test
  void textHelpers_normaliseIndentation() {
    assertEquals("\tfoo.", SelectionValidator.processSelectedCode("\n\n\tfoo.\n\n"));
    assertEquals("foo :-\n\tbar.\n\nbaz.", SelectionValidator.stripCommonIndent("\t\tfoo :-\n\t\t\tbar.\n\n\t\tbaz."));
    assertEquals("\ta\n\n\tb", SelectionValidator.indent("a\n\nb", "\t"));
  }
}
