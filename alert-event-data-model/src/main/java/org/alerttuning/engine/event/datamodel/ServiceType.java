package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum ServiceType {
  JAVA("java"),
  NODEJS("nodejs");

  private final String value;

  ServiceType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ServiceType fromValue(String value) {
    return Arrays.stream(values())
        .filter(candidate -> candidate.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException(String.format("Unknown ServiceType:%s", value)));
  }

  @Override
  public String toString() {
    return value;
  }
}
