package ca.gc.cra.match.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("workers", 1, 1, 4));
    assertEquals(4, Numbers.requireRange("workers", 4, 1, 4));
  }

  @Test
  void requireRangeNamesTheValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("workers", 5, 1, 4));
    assertTrue(ex.getMessage().startsWith("workers must be between 1 and 4"));
  }

  @Test
  void unitIntervalRejectsNaN() {
    assertEquals(0.5, Numbers.requireUnitInterval("floor", 0.5));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireUnitInterval("floor", Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireUnitInterval("floor", 1.01));
  }
}
