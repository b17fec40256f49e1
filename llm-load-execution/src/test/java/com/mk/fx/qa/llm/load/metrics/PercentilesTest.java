package com.mk.fx.qa.llm.load.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class PercentilesTest {

  @Test
  void at_usesFloorIndexClampedToLast() {
    var values = List.of(1L, 2L, 3L, 4L, 5L);

    assertEquals(5L, Percentiles.at(values, 0.95));
    assertEquals(5L, Percentiles.at(values, 0.99));
    assertEquals(1L, Percentiles.at(values, 0.0));
    assertEquals(5L, Percentiles.at(values, 1.0));
  }

  @Test
  void at_overHundredValues() {
    List<Long> values = LongStream.rangeClosed(1, 100).boxed().collect(Collectors.toList());

    assertEquals(96L, Percentiles.at(values, 0.95));
    assertEquals(100L, Percentiles.at(values, 0.99));
  }

  @Test
  void median_oddAndEven() {
    assertEquals(3.0, Percentiles.median(List.of(1L, 2L, 3L, 4L, 5L)));
    assertEquals(2.5, Percentiles.median(List.of(1L, 2L, 3L, 4L)));
    assertEquals(7.0, Percentiles.median(List.of(7L)));
  }

  @Test
  void mean() {
    assertEquals(2.5, Percentiles.mean(List.of(1L, 2L, 3L, 4L)));
  }

  @Test
  void emptyInput_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> Percentiles.at(List.of(), 0.5));
    assertThrows(IllegalArgumentException.class, () -> Percentiles.median(List.of()));
    assertThrows(IllegalArgumentException.class, () -> Percentiles.at(List.of(1L), 1.5));
  }
}
