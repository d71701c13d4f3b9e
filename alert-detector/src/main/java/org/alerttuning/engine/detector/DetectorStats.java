package org.alerttuning.engine.detector;

import lombok.Value;

@Value
public class DetectorStats {
  int activeAlertCount;
  long recentRequestCount;
  long recentErrorCount;
}
