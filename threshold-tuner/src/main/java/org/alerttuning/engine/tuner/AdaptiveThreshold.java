package org.alerttuning.engine.tuner;

import lombok.Builder;
import lombok.Value;
import org.alerttuning.engine.event.datamodel.AlertType;

/** A recommended replacement for one detector threshold of one service. */
@Value
@Builder
public class AdaptiveThreshold {
  String serviceName;
  AlertType alertType;
  double currentThreshold;
  double recommendedThreshold;
  double adjustmentPercentage;
  Confidence confidence;
  String rationale;
  long basedOnSamples;
}
