package org.alerttuning.engine.statistics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatisticsTest {

  @Test
  void testEmptyInputsReturnZero() {
    assertEquals(0.0, Statistics.mean(List.of()));
    assertEquals(0.0, Statistics.median(List.of()));
    assertEquals(0.0, Statistics.stdDev(List.of()));
    assertEquals(0.0, Statistics.percentile(List.of(), 90));
    assertEquals(0.0, Statistics.min(List.of()));
    assertEquals(0.0, Statistics.max(List.of()));
  }

  @Test
  void testPercentileUsesNearestRank() {
    List<Integer> values = List.of(5, 3, 1, 4, 2);
    assertEquals(5.0, Statistics.percentile(values, 90));
    assertEquals(4.0, Statistics.percentile(values, 75));
    assertEquals(3.0, Statistics.percentile(values, 50));
    assertEquals(1.0, Statistics.percentile(values, 0));
    assertEquals(5.0, Statistics.percentile(values, 100));
  }

  @Test
  void testPopulationStdDev() {
    List<Integer> values = List.of(2, 4, 4, 4, 5, 5, 7, 9);
    assertEquals(5.0, Statistics.mean(values));
    assertEquals(2.0, Statistics.stdDev(values), 1e-9);
  }

  @Test
  void testMedianMinMax() {
    assertEquals(2.5, Statistics.median(List.of(4, 1, 3, 2)));
    assertEquals(3.0, Statistics.median(List.of(5, 1, 3)));
    assertEquals(-1.5, Statistics.min(List.of(3.0, -1.5, 2.0)));
    assertEquals(3.0, Statistics.max(List.of(3.0, -1.5, 2.0)));
  }
}
