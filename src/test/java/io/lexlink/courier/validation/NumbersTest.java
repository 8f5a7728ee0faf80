package io.lexlink.courier.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseRangeAcceptsBounds() {
    assertEquals(1L, Numbers.parseRange("attempts", "1", 1, 5));
    assertEquals(5L, Numbers.parseRange("attempts", " 5 ", 1, 5));
  }

  @Test
  void parseRangeReportsOffendingKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("attempts", "6", 1, 5));
    assertTrue(ex.getMessage().startsWith("attempts must be between 1 and 5"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("attempts", "1.5", 1, 5));
  }

  @Test
  void requireRangeReturnsValue() {
    assertEquals(30L, Numbers.requireRange("cap", 30, 0, 30));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("cap", -1, 0, 30));
  }
}
