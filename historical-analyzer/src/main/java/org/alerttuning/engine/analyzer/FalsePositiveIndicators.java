package org.alerttuning.engine.analyzer;

import java.util.List;
import lombok.Value;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;

@Value
public class FalsePositiveIndicators {
  List<NormalizedAlertEvent> quickResolves;
  long repetitiveCount;
  double estimatedFpRate;
}
