package org.alerttuning.engine.collector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.event.datamodel.ObjectMapperProvider;
import org.alerttuning.engine.event.datamodel.ServiceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AlertEventCollectorTest {
  private static final Instant NOW = Instant.parse("2025-03-04T08:00:00Z");

  @TempDir Path tempDir;
  private AlertEventCollector collector;

  private static String line(String timestamp, String service, String name, String state) {
    return String.format(
        "{\"timestamp\":\"%s\",\"service_name\":\"%s\",\"alert_name\":\"%s\","
            + "\"alert_type\":\"error\",\"alert_state\":\"%s\",\"severity\":\"low\","
            + "\"request_count\":12,\"error_count\":6,\"average_response_time\":140,"
            + "\"process_cpu_usage\":3.5,\"process_memory_usage\":1000}",
        timestamp, service, name, state);
  }

  @BeforeEach
  void setUp() throws Exception {
    Path orders = tempDir.resolve("orders-service-alert-data.ndjson");
    Files.write(
        orders,
        List.of(
            line("2025-03-03T10:00:05Z", "orders-service", "error_burst", "fired"),
            "",
            "{not json",
            "null",
            "[]",
            "{\"timestamp\":\"2025-03-03T10:00:06Z\",\"service_name\":\"orders-service\"}",
            line("2025-03-03T10:00:40Z", "orders-service", "error_burst", "resolved")));
    Path users = tempDir.resolve("users-service-alert-data.ndjson");
    Files.write(
        users,
        List.of(
            line("2025-03-03T10:00:05Z", "users-service", "availability_issue", "fired"),
            line("2025-03-03T09:59:00Z", "users-service", "high_latency", "fired")));

    Config appConfig =
        ConfigFactory.parseMap(
                Map.of(
                    "collector.sources",
                    List.of(
                        Map.of("serviceName", "orders-service", "path", orders.toString()),
                        Map.of(
                            "serviceName",
                            "payments-service",
                            "path",
                            tempDir.resolve("missing.ndjson").toString()),
                        Map.of("serviceName", "users-service", "path", users.toString()))))
            .withFallback(ConfigFactory.defaultReference());
    collector = new AlertEventCollector(appConfig, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void testCollectSkipsBadLinesAndSortsStably() {
    List<NormalizedAlertEvent> alerts = collector.collectAllAlerts();

    assertEquals(4, alerts.size());
    assertEquals("high_latency", alerts.get(0).getAlertName());
    // equal timestamps keep source order
    assertEquals("orders-service", alerts.get(1).getServiceName());
    assertEquals("users-service", alerts.get(2).getServiceName());
    assertEquals("error_burst", alerts.get(3).getAlertName());
    assertEquals(
        Instant.parse("2025-03-03T10:00:05Z").toEpochMilli(),
        alerts.get(1).getNormalizedTimestamp());
  }

  @Test
  void testServiceTypeFromConfig() {
    List<NormalizedAlertEvent> alerts = collector.collectAllAlerts();

    assertEquals(ServiceType.JAVA, alerts.get(0).getServiceType());
    assertEquals(ServiceType.NODEJS, alerts.get(1).getServiceType());
  }

  @Test
  void testSummaryCounts() {
    AlertHistorySummary summary = collector.generateSummary(collector.collectAllAlerts());

    assertEquals(4, summary.getTotalAlerts());
    assertEquals(Long.valueOf(2), summary.getAlertsByService().get("orders-service"));
    assertEquals(Long.valueOf(2), summary.getAlertsByService().get("users-service"));
    assertEquals(Long.valueOf(4), summary.getAlertsByType().get("error"));
    assertEquals(Long.valueOf(3), summary.getAlertsByState().get("fired"));
    assertEquals(Long.valueOf(1), summary.getAlertsByState().get("resolved"));
    assertEquals(NOW, summary.getCollectionTimestamp());
  }

  @Test
  void testWritesCombinedHistoryAsFlatJson() throws Exception {
    Path output = tempDir.resolve("output").resolve("combined-alert-history.json");

    collector.writeCombinedAlertHistory(collector.collectAllAlerts(), output);

    JsonNode written = ObjectMapperProvider.get().readTree(output.toFile());
    assertTrue(written.isArray());
    assertEquals(4, written.size());
    JsonNode first = written.get(0);
    assertEquals("users-service", first.get("service_name").asText());
    assertEquals("java", first.get("service_type").asText());
    assertEquals(
        Instant.parse("2025-03-03T09:59:00Z").toEpochMilli(),
        first.get("normalized_timestamp").asLong());
    assertEquals("2025-03-03T09:59:00Z", first.get("timestamp").asText());
  }

  @Test
  void testEmptyWhenNoSourceExists() {
    Config appConfig =
        ConfigFactory.parseMap(
                Map.of(
                    "collector.sources",
                    List.of(
                        Map.of(
                            "serviceName",
                            "orders-service",
                            "path",
                            tempDir.resolve("nothing.ndjson").toString()))))
            .withFallback(ConfigFactory.defaultReference());

    assertTrue(new AlertEventCollector(appConfig).collectAllAlerts().isEmpty());
  }
}
