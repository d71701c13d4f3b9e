package org.alerttuning.engine.analyzer;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnalysisReport {
  Instant generatedAt;
  long totalAlertsAnalyzed;
  // absent when there are no alerts
  TimeRange timeRange;
  Map<String, ServiceBaseline> serviceBaselines;
  FalsePositiveIndicators falsePositiveAnalysis;
  TemporalPattern temporalPatterns;
  List<String> recommendations;
}
