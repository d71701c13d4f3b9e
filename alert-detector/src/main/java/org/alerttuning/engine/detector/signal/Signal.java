package org.alerttuning.engine.detector.signal;

import lombok.Getter;
import org.alerttuning.engine.event.datamodel.AlertType;

/**
 * A named anomaly condition. Implementations only decide; the detector keeps the active alert
 * bookkeeping, so a reading of {@code FIRE} for an already active alert is ignored.
 */
@Getter
public abstract class Signal {
  private final String alertName;
  private final AlertType alertType;

  protected Signal(String alertName, AlertType alertType) {
    this.alertName = alertName;
    this.alertType = alertType;
  }

  public abstract SignalReading evaluate(SignalContext context);
}
