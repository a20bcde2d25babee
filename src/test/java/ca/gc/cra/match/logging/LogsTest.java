package ca.gc.cra.match.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("42", Logs.quote(42));
    assertEquals("<null>", Logs.quote(null));
  }

  @Test
  void longValuesAreTruncatedOnCharacterBoundary() {
    String truncated = Logs.truncate("é".repeat(10), 5);

    assertTrue(truncated.startsWith("éé..."), truncated);
    assertTrue(truncated.contains("5 of 20 bytes"));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
