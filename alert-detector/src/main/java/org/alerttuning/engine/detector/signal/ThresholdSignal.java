package org.alerttuning.engine.detector.signal;

import java.util.OptionalDouble;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

/**
 * A signal over a single measured value with separate fire and resolve thresholds. Values
 * between the two thresholds leave the alert state unchanged.
 */
public abstract class ThresholdSignal extends Signal {

  public enum Direction {
    ABOVE,
    BELOW
  }

  private final Direction direction;
  private final double fireThreshold;
  private final double resolveThreshold;

  protected ThresholdSignal(
      String alertName,
      AlertType alertType,
      Direction direction,
      double fireThreshold,
      double resolveThreshold) {
    super(alertName, alertType);
    this.direction = direction;
    this.fireThreshold = fireThreshold;
    this.resolveThreshold = resolveThreshold;
  }

  /** The measured value, or empty when it cannot be determined for this check. */
  protected abstract OptionalDouble measure(SignalContext context);

  protected abstract Severity severityOf(double value);

  @Override
  public SignalReading evaluate(SignalContext context) {
    OptionalDouble measured = measure(context);
    if (measured.isEmpty()) {
      return SignalReading.hold();
    }
    double value = measured.getAsDouble();
    if (direction == Direction.ABOVE) {
      if (value >= fireThreshold) {
        return SignalReading.fire(severityOf(value));
      }
      return value < resolveThreshold ? SignalReading.resolve() : SignalReading.hold();
    }
    if (value <= fireThreshold) {
      return SignalReading.fire(severityOf(value));
    }
    return value > resolveThreshold ? SignalReading.resolve() : SignalReading.hold();
  }
}
