package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum AlertType {
  ERROR("error"),
  LATENCY("latency"),
  AVAILABILITY("availability"),
  RESOURCE("resource"),
  TRAFFIC("traffic"),
  SECURITY("security"),
  PERFORMANCE("performance");

  private final String value;

  AlertType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static AlertType fromValue(String value) {
    return Arrays.stream(values())
        .filter(candidate -> candidate.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException(String.format("Unknown AlertType:%s", value)));
  }

  @Override
  public String toString() {
    return value;
  }
}
