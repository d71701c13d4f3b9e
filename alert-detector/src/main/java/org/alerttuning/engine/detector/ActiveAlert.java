package org.alerttuning.engine.detector;

import java.time.Instant;
import lombok.Value;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

@Value
public class ActiveAlert {
  String alertName;
  AlertType alertType;
  Instant firedAt;
  Severity severity;
}
