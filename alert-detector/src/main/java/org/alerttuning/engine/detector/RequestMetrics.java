package org.alerttuning.engine.detector;

import lombok.Value;

@Value
public class RequestMetrics {
  long timestamp;
  long duration;
  boolean error;
  String errorType;
}
