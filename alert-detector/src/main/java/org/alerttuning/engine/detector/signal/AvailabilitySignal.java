package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.detector.DetectorWindow;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

/** Error rate over the whole request window, once it holds enough samples. */
public class AvailabilitySignal extends ThresholdSignal {
  public static final String NAME = "availability_issue";

  private final int minSamples;

  public AvailabilitySignal(double errorRate, int minSamples) {
    super(NAME, AlertType.AVAILABILITY, Direction.ABOVE, errorRate, errorRate);
    this.minSamples = minSamples;
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    DetectorWindow window = context.getWindow();
    if (window.getRequestCount() < minSamples) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((double) window.getErrorCount() / window.getRequestCount());
  }

  @Override
  protected Severity severityOf(double errorRate) {
    if (errorRate >= 0.8) {
      return Severity.HIGH;
    }
    return errorRate >= 0.65 ? Severity.MEDIUM : Severity.LOW;
  }
}
