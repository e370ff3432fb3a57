package ca.gc.cra.scribe.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("historySize", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("historySize", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("historySize", 65, 1, 64));
  }

  @Test
  void parseIntInRangeTrimsInput() {
    assertEquals(42, Numbers.parseIntInRange("historySize", " 42 ", 1, 100));
  }

  @Test
  void parseIntInRangeRejectsGarbage() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("historySize", "4x", 1, 100));
    assertEquals("historySize must be an integer (was 4x)", ex.getMessage());
  }
}
