package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;

/** Newline-delimited JSON encoding of {@link AlertEvent}, one event per line. */
public class AlertEventCodec {

  private AlertEventCodec() {}

  public static String toJsonLine(AlertEvent alertEvent) throws JsonProcessingException {
    return ObjectMapperProvider.get().writeValueAsString(alertEvent);
  }

  /**
   * Parses a single log line. Unknown fields are ignored, optional context fields may be
   * missing, but the identifying fields of the event must be present.
   *
   * @throws IOException if the line is not a JSON object or lacks an identifying field
   */
  public static AlertEvent fromJsonLine(String line) throws IOException {
    AlertEvent alertEvent = ObjectMapperProvider.get().readValue(line, AlertEvent.class);
    if (alertEvent == null) {
      throw new IOException(String.format("Alert event line is not a JSON object: %s", line));
    }
    if (alertEvent.getTimestamp() == null
        || alertEvent.getServiceName() == null
        || alertEvent.getAlertName() == null
        || alertEvent.getAlertType() == null
        || alertEvent.getAlertState() == null
        || alertEvent.getSeverity() == null) {
      throw new IOException(String.format("Alert event is missing a required field: %s", line));
    }
    return alertEvent;
  }
}
