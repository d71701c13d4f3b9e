package org.alerttuning.engine.analyzer;

import java.time.Instant;
import lombok.Value;

@Value
public class TimeRange {
  Instant start;
  Instant end;
}
