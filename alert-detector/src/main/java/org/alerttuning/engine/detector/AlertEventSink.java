package org.alerttuning.engine.detector;

import org.alerttuning.engine.event.datamodel.AlertEvent;

@FunctionalInterface
public interface AlertEventSink {
  /** Records the event. Implementations must not throw on storage failures. */
  void append(AlertEvent alertEvent);
}
