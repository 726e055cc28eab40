package ca.gc.cra.sluice.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseLongAcceptsUnderscoresAndFallsBackWhenBlank() {
    assertEquals(104_857_600L, Numbers.parseLong("sizeBytes", "104_857_600", 0, 0, Long.MAX_VALUE));
    assertEquals(7L, Numbers.parseLong("sizeBytes", "  ", 7, 0, 10));
    assertEquals(7L, Numbers.parseLong("sizeBytes", null, 7, 0, 10));
  }

  @Test
  void rangeViolationNamesTheOption() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("chunkBytes", "0", 1, 1, 10));
    assertTrue(ex.getMessage().startsWith("chunkBytes must be between 1 and 10"));
  }

  @Test
  void nonNumericInputRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseLong("latencyMs", "ten", 0, 0, 100));
    assertEquals("latencyMs must be an integer (was 'ten')", ex.getMessage());
  }
}
