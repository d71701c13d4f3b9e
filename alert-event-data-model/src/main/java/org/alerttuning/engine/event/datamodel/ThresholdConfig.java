package org.alerttuning.engine.event.datamodel;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ThresholdConfig {
  Instant generatedAt;
  @Singular Map<String, ServiceThresholds> thresholds;

  public Optional<ServiceThresholds> getServiceThresholds(String serviceName) {
    return Optional.ofNullable(thresholds.get(serviceName));
  }
}
