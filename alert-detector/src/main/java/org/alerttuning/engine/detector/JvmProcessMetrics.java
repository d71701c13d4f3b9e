package org.alerttuning.engine.detector;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;

/**
 * Heap usage against the maximum heap, and CPU as cumulative process CPU time over process
 * uptime. CPU is reported as -1 on JVMs without the {@code com.sun.management} extension.
 */
public class JvmProcessMetrics implements ProcessMetrics {
  private final MemoryMXBean memoryMXBean = ManagementFactory.getMemoryMXBean();
  private final RuntimeMXBean runtimeMXBean = ManagementFactory.getRuntimeMXBean();
  private final OperatingSystemMXBean operatingSystemMXBean =
      ManagementFactory.getOperatingSystemMXBean();

  @Override
  public ProcessSnapshot snapshot() {
    MemoryUsage heap = memoryMXBean.getHeapMemoryUsage();
    long heapLimit = heap.getMax() > 0 ? heap.getMax() : Runtime.getRuntime().maxMemory();
    double heapPercent = heapLimit > 0 ? heap.getUsed() * 100d / heapLimit : Double.NaN;
    return new ProcessSnapshot(heap.getUsed(), heapPercent, cpuUsagePercent());
  }

  private double cpuUsagePercent() {
    if (!(operatingSystemMXBean instanceof com.sun.management.OperatingSystemMXBean)) {
      return -1;
    }
    long cpuTimeNanos =
        ((com.sun.management.OperatingSystemMXBean) operatingSystemMXBean).getProcessCpuTime();
    long uptimeMillis = runtimeMXBean.getUptime();
    if (cpuTimeNanos < 0 || uptimeMillis <= 0) {
      return -1;
    }
    return cpuTimeNanos / (uptimeMillis * 1_000_000d) * 100;
  }
}
