package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.detector.ProcessSnapshot;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

public class CpuUsageSignal extends ThresholdSignal {
  public static final String NAME = "high_cpu_usage";

  public CpuUsageSignal(double thresholdPercent, double resolvePercent) {
    super(NAME, AlertType.RESOURCE, Direction.ABOVE, thresholdPercent, resolvePercent);
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    ProcessSnapshot snapshot = context.getProcessSnapshot();
    return snapshot.hasCpuUsage()
        ? OptionalDouble.of(snapshot.getCpuUsagePercent())
        : OptionalDouble.empty();
  }

  @Override
  protected Severity severityOf(double percent) {
    if (percent >= 95) {
      return Severity.CRITICAL;
    }
    return percent >= 90 ? Severity.HIGH : Severity.MEDIUM;
  }
}
