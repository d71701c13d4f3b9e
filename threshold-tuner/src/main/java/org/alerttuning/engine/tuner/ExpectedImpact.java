package org.alerttuning.engine.tuner;

import lombok.Value;

@Value
public class ExpectedImpact {
  long totalAlerts;
  double estimatedFpReduction;
  long alertsSaved;
  double noiseReductionPercentage;
}
