package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

/** Current request rate as a multiple of the traffic baseline. */
public class TrafficSpikeSignal extends ThresholdSignal {
  public static final String NAME = "traffic_spike";

  public TrafficSpikeSignal(double multiplier, double resolveMultiplier) {
    super(NAME, AlertType.TRAFFIC, Direction.ABOVE, multiplier, resolveMultiplier);
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    return context.getWindow().getTrafficRatio(context.getNow());
  }

  @Override
  protected Severity severityOf(double ratio) {
    if (ratio >= 5) {
      return Severity.HIGH;
    }
    return ratio >= 4 ? Severity.MEDIUM : Severity.LOW;
  }
}
