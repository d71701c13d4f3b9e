package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One line of a service's alert log. An event is written once, when a signal fires or resolves,
 * and never rewritten.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertEvent {

  /** Resolved alerts that cleared faster than this are treated as likely false positives. */
  public static final long QUICK_RESOLVE_MILLIS = 30_000L;

  Instant timestamp;
  String serviceName;
  String alertName;
  AlertType alertType;
  AlertState alertState;
  Severity severity;

  // only present on resolved events
  Long alertDuration;

  long requestCount;
  long errorCount;
  double averageResponseTime;
  double processCpuUsage;
  double processMemoryUsage;
  Double eventLoopLag;
  Double trafficRate;

  @JsonIgnore
  public boolean isResolved() {
    return alertState == AlertState.RESOLVED;
  }

  @JsonIgnore
  public boolean isQuickResolve() {
    return isResolved() && alertDuration != null && alertDuration < QUICK_RESOLVE_MILLIS;
  }
}
