package ca.gc.cra.lookout.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("hello", Logs.truncate("hello", 16));
  }

  @Test
  void truncateReportsSizes() {
    assertEquals("abc... (truncated, 3 of 6 bytes)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncateNeverSplitsCharacters() {
    String value = "café ok";

    String truncated = Logs.truncate(value, 4);

    assertTrue(truncated.startsWith("caf..."), truncated);
  }

  @Test
  void previewCollapsesLineBreaks() {
    assertEquals("line one line two", Logs.preview("line one\r\n\tline two\n", 64));
  }

  @Test
  void nullBecomesPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 4));
    assertEquals("<null>", Logs.preview(null, 4));
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
