package org.alerttuning.engine.detector;

import lombok.Value;

/** Number of requests seen in the minute before {@code timestamp}. */
@Value
public class TrafficSample {
  long timestamp;
  long count;
}
