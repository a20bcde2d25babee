package ca.gc.cra.match.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "  "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\tb"));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("env=prod", Strings.requirePrintableAscii("attrs", "env=prod", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=prod", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }
}
