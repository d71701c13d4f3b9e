package org.alerttuning.engine.detector;

import lombok.Value;

/**
 * Point-in-time view of the host process. A percentage that could not be read is negative or
 * NaN.
 */
@Value
public class ProcessSnapshot {
  public static final ProcessSnapshot UNAVAILABLE = new ProcessSnapshot(0L, Double.NaN, -1d);

  long heapUsedBytes;
  double heapUsagePercent;
  double cpuUsagePercent;

  public boolean hasHeapUsage() {
    return !Double.isNaN(heapUsagePercent) && heapUsagePercent >= 0;
  }

  public boolean hasCpuUsage() {
    return !Double.isNaN(cpuUsagePercent) && cpuUsagePercent >= 0;
  }
}
