package org.alerttuning.engine.detector.signal;

import lombok.Value;
import org.alerttuning.engine.detector.DetectorWindow;
import org.alerttuning.engine.detector.ProcessSnapshot;

@Value
public class SignalContext {
  long now;
  DetectorWindow window;
  ProcessSnapshot processSnapshot;
}
