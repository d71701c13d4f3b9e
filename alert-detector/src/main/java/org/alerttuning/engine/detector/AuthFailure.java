package org.alerttuning.engine.detector;

import lombok.Value;

@Value
public class AuthFailure {
  long timestamp;
  String failureType;
}
