package org.alerttuning.engine.suppressor;

import lombok.Value;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;

@Value
public class SuppressionResult {
  NormalizedAlertEvent alert;
  boolean suppressed;
  String reason;
  // id of the matching rule, null when allowed
  String ruleApplied;
}
