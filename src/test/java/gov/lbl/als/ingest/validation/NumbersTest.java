package gov.lbl.als.ingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseInRangeAcceptsBounds() {
    assertEquals(1, Numbers.parseInRange("timeout", "1", 1, 600));
    assertEquals(600, Numbers.parseInRange("timeout", " 600 ", 1, 600));
  }

  @Test
  void parseInRangeRejectsOutOfRangeAndGarbage() {
    IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("timeout", "601", 1, 600));
    assertTrue(range.getMessage().contains("between 1 and 600"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("timeout", "ten", 1, 600));
  }
}
