package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Value;

/** An {@link AlertEvent} as merged by the collector, tagged with its epoch-millis timestamp. */
@Value
public class NormalizedAlertEvent {

  @JsonUnwrapped AlertEvent event;
  long normalizedTimestamp;
  ServiceType serviceType;

  public static NormalizedAlertEvent of(AlertEvent event, ServiceType serviceType) {
    return new NormalizedAlertEvent(event, event.getTimestamp().toEpochMilli(), serviceType);
  }

  @JsonIgnore
  public String getServiceName() {
    return event.getServiceName();
  }

  @JsonIgnore
  public String getAlertName() {
    return event.getAlertName();
  }

  @JsonIgnore
  public AlertType getAlertType() {
    return event.getAlertType();
  }

  @JsonIgnore
  public AlertState getAlertState() {
    return event.getAlertState();
  }

  @JsonIgnore
  public Severity getSeverity() {
    return event.getSeverity();
  }
}
