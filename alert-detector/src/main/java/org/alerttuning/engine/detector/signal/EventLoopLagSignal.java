package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

/**
 * Rolling average of how late the periodic check ran compared to its schedule. A saturated
 * worker pool shows up here the same way a blocked event loop does.
 */
public class EventLoopLagSignal extends ThresholdSignal {
  public static final String NAME = "event_loop_lag";

  public EventLoopLagSignal(long threshold, long resolveThreshold) {
    super(NAME, AlertType.PERFORMANCE, Direction.ABOVE, threshold, resolveThreshold);
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    return context.getWindow().getAverageSchedulerDrift();
  }

  @Override
  protected Severity severityOf(double lagMillis) {
    if (lagMillis >= 500) {
      return Severity.CRITICAL;
    }
    if (lagMillis >= 300) {
      return Severity.HIGH;
    }
    return lagMillis >= 200 ? Severity.MEDIUM : Severity.LOW;
  }
}
