package org.alerttuning.engine;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.alerttuning.engine.analyzer.AnalysisReport;
import org.alerttuning.engine.collector.AlertHistorySummary;
import org.alerttuning.engine.event.datamodel.ThresholdConfig;
import org.alerttuning.engine.suppressor.SuppressionBatchResult;
import org.alerttuning.engine.tuner.AdaptiveThreshold;
import org.alerttuning.engine.tuner.ExpectedImpact;

/** Everything one pipeline run produced, also written to the output directory. */
@Value
@Builder
public class PipelineResult {
  AlertHistorySummary alertSummary;
  AnalysisReport analysisReport;
  List<AdaptiveThreshold> thresholdRecommendations;
  ThresholdConfig thresholdConfig;
  ExpectedImpact expectedImpact;
  SuppressionBatchResult suppression;
  int failedOutputs;
}
