package org.alerttuning.engine.detector.signal;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.alerttuning.engine.event.datamodel.Severity;

/** Outcome of evaluating a signal: fire with a severity, resolve, or leave the state as is. */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SignalReading {
  public enum Action {
    FIRE,
    RESOLVE,
    HOLD
  }

  private static final SignalReading RESOLVE = new SignalReading(Action.RESOLVE, null);
  private static final SignalReading HOLD = new SignalReading(Action.HOLD, null);

  private final Action action;
  private final Severity severity;

  public static SignalReading fire(Severity severity) {
    return new SignalReading(Action.FIRE, severity);
  }

  public static SignalReading resolve() {
    return RESOLVE;
  }

  public static SignalReading hold() {
    return HOLD;
  }

  public Optional<Severity> getSeverity() {
    return Optional.ofNullable(severity);
  }

  @Override
  public String toString() {
    return severity == null ? action.name() : action.name() + "(" + severity + ")";
  }
}
