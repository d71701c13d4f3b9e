package org.alerttuning.engine.suppressor;

import java.util.Map;
import lombok.Value;

@Value
public class SuppressionSummary {
  long total;
  long suppressedCount;
  long allowedCount;
  double suppressionRatePercent;
  Map<String, Long> byRule;
}
