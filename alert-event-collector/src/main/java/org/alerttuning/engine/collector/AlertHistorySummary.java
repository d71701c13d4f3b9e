package org.alerttuning.engine.collector;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertHistorySummary {
  long totalAlerts;
  Map<String, Long> alertsByService;
  Map<String, Long> alertsByType;
  Map<String, Long> alertsBySeverity;
  Map<String, Long> alertsByState;
  Instant collectionTimestamp;
}
