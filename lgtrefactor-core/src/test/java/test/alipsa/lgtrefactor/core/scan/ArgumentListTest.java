package test.alipsa.lgtrefactor.core.scan;

import org.junit.jupiter.api.Test;
import se.alipsa.lgtrefactor.core.scan.ArgumentList;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentListTest {

  @Test
  void insert_keepsOnePerLineLayout() {
    ArgumentList list = ArgumentList.parse("\n\ta,\n\tb\n");
    list.insert(2, "c");
    assertEquals("\n\ta,\n\tb,\n\tc\n", list.render());
  }

  @Test
  void insert_atFrontOfInlineList() {
    ArgumentList list = ArgumentList.parse("a, b");
    list.insert(0, "Z");
    assertEquals("Z, a, b", list.render());
  }

  @Test
  void insert_intoEmptyList() {
    ArgumentList list = ArgumentList.parse("");
    list.insert(0, "X");
    assertEquals("X", list.render());
  }

  @Test
  void remove_firstMiddleAndLast() {
    ArgumentList first = ArgumentList.parse("\n\ta,\n\tb\n");
    first.remove(0);
    assertEquals("\n\tb\n", first.render());

    ArgumentList middle = ArgumentList.parse("a, b, c");
    middle.remove(1);
    assertEquals("a, c", middle.render());

    ArgumentList last = ArgumentList.parse("a, b, c");
    last.remove(2);
    assertEquals("a, b", last.render());
  }

  @Test
  void reorder_placesOldElementsAtNewPositions() {
    ArgumentList list = ArgumentList.parse("x, y, z");
    list.reorder(new int[] {2, 0, 1});
    assertEquals("z, x, y", list.render());
    assertEquals(List.of("z", "x", "y"), list.elements());
  }

  @Test
  void reorder_rejectsNonPermutation() {
    ArgumentList list = ArgumentList.parse("x, y");
    assertThrows(IllegalArgumentException.class, () -> list.reorder(new int[] {0, 0}));
    assertThrows(IllegalArgumentException.class, () -> list.reorder(new int[] {0}));
  }

  @Test
  void parse_keepsLeadingCommentsInLayout() {
    ArgumentList list = ArgumentList.parse("a, % the b\n\tb");
    assertEquals(List.of("a", "b"), list.elements());
    list.insert(2, "c");
    assertEquals("a, % the b\n\tb, c", list.render());
  }

  @Test
  void offsetOf_pointsIntoRenderedText() {
    ArgumentList list = ArgumentList.parse(" foo(1),\n\tbar ");
    assertEquals("bar", list.render().substring(list.offsetOf(1), list.offsetOf(1) + 3));
  }
}
