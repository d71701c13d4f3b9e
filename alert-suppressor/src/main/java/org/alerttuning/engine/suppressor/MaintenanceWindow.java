package org.alerttuning.engine.suppressor;

import java.time.Instant;
import lombok.Value;

/** Alerts of the service with an event time in [startTime, endTime] are suppressed. */
@Value
public class MaintenanceWindow {
  String serviceName;
  Instant startTime;
  Instant endTime;
  String reason;

  boolean covers(String service, Instant eventTime) {
    return serviceName.equals(service)
        && !eventTime.isBefore(startTime)
        && !eventTime.isAfter(endTime);
  }
}
