package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

public class TrafficDropSignal extends ThresholdSignal {
  public static final String NAME = "traffic_drop";

  public TrafficDropSignal(double multiplier, double resolveMultiplier) {
    super(NAME, AlertType.TRAFFIC, Direction.BELOW, multiplier, resolveMultiplier);
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    return context.getWindow().getTrafficRatio(context.getNow());
  }

  @Override
  protected Severity severityOf(double ratio) {
    double dropPercent = (1 - ratio) * 100;
    if (dropPercent >= 90) {
      return Severity.CRITICAL;
    }
    if (dropPercent >= 80) {
      return Severity.HIGH;
    }
    return dropPercent >= 70 ? Severity.MEDIUM : Severity.LOW;
  }
}
