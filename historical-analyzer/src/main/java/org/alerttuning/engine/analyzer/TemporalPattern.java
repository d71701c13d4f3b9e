package org.alerttuning.engine.analyzer;

import java.util.List;
import java.util.SortedMap;
import lombok.Value;

/** Alert counts by hour of day (0-23) and day of week (0 is Sunday). */
@Value
public class TemporalPattern {
  List<Integer> peakHours;
  List<Integer> peakDays;
  SortedMap<Integer, Long> hourlyDistribution;
  SortedMap<Integer, Long> dailyDistribution;
}
