package org.alerttuning.engine.event.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class AlertEventCodecTest {

  @Test
  void testWritesSnakeCaseFieldsAndOmitsAbsentOptionals() throws IOException {
    AlertEvent alertEvent =
        AlertEvent.builder()
            .timestamp(Instant.parse("2025-03-01T10:15:30Z"))
            .serviceName("orders-service")
            .alertName("error_burst")
            .alertType(AlertType.ERROR)
            .alertState(AlertState.FIRED)
            .severity(Severity.MEDIUM)
            .requestCount(40)
            .errorCount(7)
            .averageResponseTime(120)
            .build();

    String line = AlertEventCodec.toJsonLine(alertEvent);

    assertTrue(line.contains("\"timestamp\":\"2025-03-01T10:15:30Z\""));
    assertTrue(line.contains("\"service_name\":\"orders-service\""));
    assertTrue(line.contains("\"alert_type\":\"error\""));
    assertTrue(line.contains("\"alert_state\":\"fired\""));
    assertTrue(line.contains("\"severity\":\"medium\""));
    assertFalse(line.contains("alert_duration"));
    assertFalse(line.contains("event_loop_lag"));
    assertFalse(line.contains("quick_resolve"));
    assertFalse(line.contains("\n"));
  }

  @Test
  void testReadsLineWithUnknownAndMissingOptionalFields() throws IOException {
    AlertEvent alertEvent =
        AlertEventCodec.fromJsonLine(
            "{\"timestamp\":\"2025-03-01T10:15:30.123Z\",\"service_name\":\"users-service\","
                + "\"alert_name\":\"high_memory_usage\",\"alert_type\":\"resource\","
                + "\"alert_state\":\"resolved\",\"alert_duration\":12000,\"severity\":\"critical\","
                + "\"request_count\":3,\"error_count\":0,\"average_response_time\":40,"
                + "\"process_cpu_usage\":-1,\"process_memory_usage\":123456,"
                + "\"region\":\"eu-west-1\"}");

    assertEquals(AlertType.RESOURCE, alertEvent.getAlertType());
    assertEquals(Severity.CRITICAL, alertEvent.getSeverity());
    assertEquals(12000L, alertEvent.getAlertDuration());
    assertEquals(-1.0, alertEvent.getProcessCpuUsage());
    assertNull(alertEvent.getTrafficRate());
    assertTrue(alertEvent.isQuickResolve());
  }

  @Test
  void testRejectsMalformedAndIncompleteLines() {
    assertThrows(IOException.class, () -> AlertEventCodec.fromJsonLine("{not json"));
    assertThrows(IOException.class, () -> AlertEventCodec.fromJsonLine("null"));
    assertThrows(IOException.class, () -> AlertEventCodec.fromJsonLine("[1, 2]"));
    assertThrows(
        IOException.class,
        () -> AlertEventCodec.fromJsonLine("{\"service_name\":\"orders-service\"}"));
    assertThrows(
        IOException.class,
        () ->
            AlertEventCodec.fromJsonLine(
                "{\"timestamp\":\"2025-03-01T10:15:30Z\",\"service_name\":\"a\","
                    + "\"alert_name\":\"x\",\"alert_type\":\"bogus\",\"alert_state\":\"fired\","
                    + "\"severity\":\"low\"}"));
  }

  @Test
  void testObjectMapperIsSharedAcrossThreads() throws Exception {
    CompletableFuture<Object> other = CompletableFuture.supplyAsync(ObjectMapperProvider::get);

    assertSame(ObjectMapperProvider.get(), other.get());
  }
}
