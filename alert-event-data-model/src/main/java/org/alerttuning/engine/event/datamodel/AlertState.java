package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum AlertState {
  FIRED("fired"),
  RESOLVED("resolved");

  private final String value;

  AlertState(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static AlertState fromValue(String value) {
    return Arrays.stream(values())
        .filter(candidate -> candidate.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException(String.format("Unknown AlertState:%s", value)));
  }

  @Override
  public String toString() {
    return value;
  }
}
