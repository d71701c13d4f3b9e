package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

public class AuthFailureSpikeSignal extends ThresholdSignal {
  public static final String NAME = "auth_failure_spike";

  public AuthFailureSpikeSignal(int threshold, int resolveThreshold) {
    super(NAME, AlertType.SECURITY, Direction.ABOVE, threshold, resolveThreshold);
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    return OptionalDouble.of(context.getWindow().getAuthFailureCount());
  }

  @Override
  protected Severity severityOf(double failures) {
    if (failures >= 50) {
      return Severity.CRITICAL;
    }
    if (failures >= 30) {
      return Severity.HIGH;
    }
    return failures >= 20 ? Severity.MEDIUM : Severity.LOW;
  }
}
