package org.alerttuning.engine.collector;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.alerttuning.engine.event.datamodel.AlertEvent;
import org.alerttuning.engine.event.datamodel.AlertEventCodec;
import org.alerttuning.engine.event.datamodel.JsonOutputWriter;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.event.datamodel.ServiceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the alert logs of several services into one chronologically ordered history. Missing
 * files and unparsable lines are skipped.
 */
public class AlertEventCollector {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEventCollector.class);

  public static final String COLLECTOR_CONFIG = "collector";
  private static final String SOURCES_CONFIG = "sources";
  private static final String SERVICE_TYPES_CONFIG = "serviceTypes";
  private static final String DEFAULT_SERVICE_TYPE_CONFIG = "defaultServiceType";

  private final List<AlertLogSource> sources;
  private final Map<String, ServiceType> serviceTypes;
  private final ServiceType defaultServiceType;
  private final Clock clock;

  public AlertEventCollector(Config appConfig) {
    this(appConfig, Clock.systemUTC());
  }

  public AlertEventCollector(Config appConfig, Clock clock) {
    Config collectorConfig = appConfig.getConfig(COLLECTOR_CONFIG);
    ImmutableList.Builder<AlertLogSource> sourcesBuilder = ImmutableList.builder();
    collectorConfig
        .getConfigList(SOURCES_CONFIG)
        .forEach(sourceConfig -> sourcesBuilder.add(AlertLogSource.fromConfig(sourceConfig)));
    this.sources = sourcesBuilder.build();

    ImmutableMap.Builder<String, ServiceType> serviceTypesBuilder = ImmutableMap.builder();
    if (collectorConfig.hasPath(SERVICE_TYPES_CONFIG)) {
      for (Map.Entry<String, ConfigValue> entry :
          collectorConfig.getObject(SERVICE_TYPES_CONFIG).entrySet()) {
        serviceTypesBuilder.put(
            entry.getKey(), ServiceType.fromValue(entry.getValue().unwrapped().toString()));
      }
    }
    this.serviceTypes = serviceTypesBuilder.build();
    this.defaultServiceType =
        ServiceType.fromValue(collectorConfig.getString(DEFAULT_SERVICE_TYPE_CONFIG));
    this.clock = clock;
  }

  public List<AlertLogSource> getSources() {
    return sources;
  }

  public List<NormalizedAlertEvent> collectAllAlerts() {
    LOGGER.info("Starting alert data collection from {} sources", sources.size());
    List<NormalizedAlertEvent> allAlerts = new ArrayList<>();
    for (AlertLogSource source : sources) {
      for (AlertEvent alertEvent : readServiceAlertLog(source)) {
        allAlerts.add(NormalizedAlertEvent.of(alertEvent, serviceTypeOf(alertEvent)));
      }
    }
    allAlerts.sort(Comparator.comparingLong(NormalizedAlertEvent::getNormalizedTimestamp));
    LOGGER.info("Total alerts collected: {}", allAlerts.size());
    return allAlerts;
  }

  List<AlertEvent> readServiceAlertLog(AlertLogSource source) {
    Path path = source.getPath();
    if (!Files.exists(path)) {
      LOGGER.warn("Alert file not found for service:{} path:{}", source.getServiceName(), path);
      return List.of();
    }

    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      LOGGER.error("Failed to read alert file for service:{}", source.getServiceName(), e);
      return List.of();
    }

    List<AlertEvent> events = new ArrayList<>();
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      try {
        events.add(AlertEventCodec.fromJsonLine(line));
      } catch (IOException e) {
        LOGGER.warn(
            "Skipping unparsable line in alert file of service:{} - {}",
            source.getServiceName(),
            e.getMessage());
      }
    }
    LOGGER.info("Read {} alert events from {}", events.size(), source.getServiceName());
    return events;
  }

  ServiceType serviceTypeOf(AlertEvent alertEvent) {
    return serviceTypes.getOrDefault(alertEvent.getServiceName(), defaultServiceType);
  }

  public AlertHistorySummary generateSummary(List<NormalizedAlertEvent> alerts) {
    return AlertHistorySummary.builder()
        .totalAlerts(alerts.size())
        .alertsByService(countBy(alerts, NormalizedAlertEvent::getServiceName))
        .alertsByType(countBy(alerts, alert -> alert.getAlertType().getValue()))
        .alertsBySeverity(countBy(alerts, alert -> alert.getSeverity().getValue()))
        .alertsByState(countBy(alerts, alert -> alert.getAlertState().getValue()))
        .collectionTimestamp(clock.instant())
        .build();
  }

  public void writeCombinedAlertHistory(List<NormalizedAlertEvent> alerts, Path outputPath)
      throws IOException {
    JsonOutputWriter.write(alerts, outputPath);
    LOGGER.info("Combined alert history written to: {}", outputPath);
  }

  public void writeSummary(AlertHistorySummary summary, Path outputPath) throws IOException {
    JsonOutputWriter.write(summary, outputPath);
    LOGGER.info("Summary written to: {}", outputPath);
  }

  private static Map<String, Long> countBy(
      List<NormalizedAlertEvent> alerts, Function<NormalizedAlertEvent, String> key) {
    Map<String, Long> counts = new LinkedHashMap<>();
    alerts.forEach(alert -> counts.merge(key.apply(alert), 1L, Long::sum));
    return counts;
  }
}
