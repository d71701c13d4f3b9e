package org.alerttuning.engine.detector;

import com.typesafe.config.Config;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Builder;
import lombok.Value;
import org.alerttuning.engine.event.datamodel.ObjectMapperProvider;
import org.alerttuning.engine.event.datamodel.ServiceThresholds;
import org.alerttuning.engine.event.datamodel.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Thresholds and windows of one detector instance. All durations are in milliseconds. */
@Value
@Builder(toBuilder = true)
public class DetectorConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorConfig.class);

  public static final String DETECTOR_CONFIG = "detector";
  static final String THRESHOLD_CONFIG_FILE = "thresholdConfigFile";

  String serviceName;
  Path logDirectory;
  long checkInterval;
  long metricsWindow;

  int errorBurstThreshold;
  long errorBurstWindow;

  long highLatencyThreshold;
  int highLatencySampleCount;

  double availabilityErrorRate;
  int availabilityMinSamples;

  double memoryThresholdPercent;
  double memoryResolvePercent;

  double cpuThresholdPercent;
  double cpuResolvePercent;

  long eventLoopLagThreshold;
  long eventLoopLagResolveThreshold;
  int eventLoopLagSampleCount;

  long trafficRateWindow;
  long trafficHistoryWindow;
  int trafficBaselineMinSamples;
  double trafficSpikeMultiplier;
  double trafficSpikeResolveMultiplier;
  double trafficDropMultiplier;
  double trafficDropResolveMultiplier;

  int authFailureThreshold;
  int authFailureResolveThreshold;
  long authFailureWindow;

  /**
   * Reads the {@code detector} block, then applies the tuner's exported thresholds for this
   * service when {@code detector.thresholdConfigFile} is set.
   */
  public static DetectorConfig fromConfig(Config appConfig) {
    Config config = appConfig.getConfig(DETECTOR_CONFIG);
    DetectorConfig detectorConfig =
        DetectorConfig.builder()
            .serviceName(config.getString("serviceName"))
            .logDirectory(Paths.get(config.getString("logDirectory")))
            .checkInterval(config.getDuration("checkInterval").toMillis())
            .metricsWindow(config.getDuration("metricsWindow").toMillis())
            .errorBurstThreshold(config.getInt("errorBurst.threshold"))
            .errorBurstWindow(config.getDuration("errorBurst.window").toMillis())
            .highLatencyThreshold(config.getDuration("highLatency.threshold").toMillis())
            .highLatencySampleCount(config.getInt("highLatency.sampleCount"))
            .availabilityErrorRate(config.getDouble("availability.errorRate"))
            .availabilityMinSamples(config.getInt("availability.minSamples"))
            .memoryThresholdPercent(config.getDouble("memory.thresholdPercent"))
            .memoryResolvePercent(config.getDouble("memory.resolvePercent"))
            .cpuThresholdPercent(config.getDouble("cpu.thresholdPercent"))
            .cpuResolvePercent(config.getDouble("cpu.resolvePercent"))
            .eventLoopLagThreshold(config.getDuration("eventLoopLag.threshold").toMillis())
            .eventLoopLagResolveThreshold(
                config.getDuration("eventLoopLag.resolveThreshold").toMillis())
            .eventLoopLagSampleCount(config.getInt("eventLoopLag.sampleCount"))
            .trafficRateWindow(config.getDuration("traffic.rateWindow").toMillis())
            .trafficHistoryWindow(config.getDuration("traffic.historyWindow").toMillis())
            .trafficBaselineMinSamples(config.getInt("traffic.baselineMinSamples"))
            .trafficSpikeMultiplier(config.getDouble("traffic.spikeMultiplier"))
            .trafficSpikeResolveMultiplier(config.getDouble("traffic.spikeResolveMultiplier"))
            .trafficDropMultiplier(config.getDouble("traffic.dropMultiplier"))
            .trafficDropResolveMultiplier(config.getDouble("traffic.dropResolveMultiplier"))
            .authFailureThreshold(config.getInt("authFailure.threshold"))
            .authFailureResolveThreshold(config.getInt("authFailure.resolveThreshold"))
            .authFailureWindow(config.getDuration("authFailure.window").toMillis())
            .build();

    if (!config.hasPath(THRESHOLD_CONFIG_FILE)) {
      return detectorConfig;
    }
    Path thresholdFile = Paths.get(config.getString(THRESHOLD_CONFIG_FILE));
    try {
      ThresholdConfig thresholdConfig =
          ObjectMapperProvider.get().readValue(thresholdFile.toFile(), ThresholdConfig.class);
      return thresholdConfig
          .getServiceThresholds(detectorConfig.getServiceName())
          .map(detectorConfig::withServiceThresholds)
          .orElse(detectorConfig);
    } catch (IOException e) {
      throw new RuntimeException(
          String.format("Unable to read threshold config file:%s", thresholdFile), e);
    }
  }

  public DetectorConfig withServiceThresholds(ServiceThresholds serviceThresholds) {
    LOGGER.info(
        "Applying tuned thresholds for service:{} {}", serviceName, serviceThresholds);
    return toBuilder()
        .errorBurstThreshold(serviceThresholds.getErrorBurstThreshold())
        .errorBurstWindow(serviceThresholds.getErrorBurstWindow())
        .highLatencyThreshold(serviceThresholds.getHighLatencyThreshold())
        .availabilityErrorRate(serviceThresholds.getAvailabilityErrorRate())
        .build();
  }
}
