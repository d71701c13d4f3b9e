package org.alerttuning.engine.event.datamodel;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Detector thresholds for one service, as exported by the threshold tuner. */
@Value
@Builder
@Jacksonized
public class ServiceThresholds {
  int errorBurstThreshold;
  long errorBurstWindow;
  long highLatencyThreshold;
  double availabilityErrorRate;
}
