package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

/** Errors within the burst window. */
public class ErrorBurstSignal extends ThresholdSignal {
  public static final String NAME = "error_burst";

  private final long window;

  public ErrorBurstSignal(int threshold, long window) {
    super(NAME, AlertType.ERROR, Direction.ABOVE, threshold, threshold);
    this.window = window;
  }

  @Override
  protected OptionalDouble measure(SignalContext context) {
    return OptionalDouble.of(context.getWindow().countErrorsSince(context.getNow() - window));
  }

  @Override
  protected Severity severityOf(double errors) {
    if (errors >= 10) {
      return Severity.HIGH;
    }
    return errors >= 7 ? Severity.MEDIUM : Severity.LOW;
  }
}
