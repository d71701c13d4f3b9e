package org.alerttuning.engine.analyzer;

import lombok.Builder;
import lombok.Value;

/** Observed alerting behaviour of one service over the analyzed history. */
@Value
@Builder
public class ServiceBaseline {
  String serviceName;
  long totalAlerts;
  double avgErrorCount;
  double avgResponseTime;
  double avgAlertDuration;
  double falsePositiveRate;
  double alertRatePerHour;
  double avgCpuUsage;
  double avgMemoryUsage;
}
