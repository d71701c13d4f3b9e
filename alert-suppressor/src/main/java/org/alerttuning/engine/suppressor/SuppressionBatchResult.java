package org.alerttuning.engine.suppressor;

import java.util.List;
import lombok.Value;

@Value
public class SuppressionBatchResult {
  List<SuppressionResult> suppressed;
  List<SuppressionResult> allowed;
  SuppressionSummary summary;
}
