package org.alerttuning.engine.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import org.alerttuning.engine.detector.signal.AuthFailureSpikeSignal;
import org.alerttuning.engine.detector.signal.AvailabilitySignal;
import org.alerttuning.engine.detector.signal.CpuUsageSignal;
import org.alerttuning.engine.detector.signal.DatabaseConnectionSignal;
import org.alerttuning.engine.detector.signal.ErrorBurstSignal;
import org.alerttuning.engine.detector.signal.EventLoopLagSignal;
import org.alerttuning.engine.detector.signal.HighLatencySignal;
import org.alerttuning.engine.detector.signal.MemoryUsageSignal;
import org.alerttuning.engine.detector.signal.Signal;
import org.alerttuning.engine.detector.signal.SignalContext;
import org.alerttuning.engine.detector.signal.SignalReading;
import org.alerttuning.engine.detector.signal.TrafficDropSignal;
import org.alerttuning.engine.detector.signal.TrafficSpikeSignal;
import org.alerttuning.engine.event.datamodel.AlertEvent;
import org.alerttuning.engine.event.datamodel.AlertState;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertDetectorTest {
  private static final ProcessSnapshot HEALTHY_PROCESS = new ProcessSnapshot(50_000_000L, 40, 20);

  private DetectorConfig config;
  private MutableClock clock;
  private List<AlertEvent> events;
  private ProcessMetrics processMetrics;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    config =
        DetectorConfig.fromConfig(
            ConfigFactory.parseMap(
                    Map.of(
                        "detector.serviceName", "orders",
                        "detector.logDirectory", Paths.get("target", "alert-logs").toString()))
                .withFallback(ConfigFactory.defaultReference()));
    clock = new MutableClock(Instant.parse("2025-03-03T10:00:00Z"));
    events = new ArrayList<>();
    processMetrics = mock(ProcessMetrics.class);
    when(processMetrics.snapshot()).thenReturn(HEALTHY_PROCESS);
    meterRegistry = new SimpleMeterRegistry();
  }

  private AlertDetector newDetector(Optional<DatastoreProbe> datastoreProbe) {
    return new AlertDetector(
        config, events::add, processMetrics, datastoreProbe, clock, meterRegistry);
  }

  private List<AlertEvent> eventsFor(String alertName) {
    return events.stream()
        .filter(event -> event.getAlertName().equals(alertName))
        .collect(Collectors.toList());
  }

  @Test
  void testErrorBurstFiresAndResolvesAfterWindowEmpties() {
    AlertDetector detector = newDetector(Optional.empty());
    for (int i = 0; i < 5; i++) {
      detector.recordRequest(100, true, "ValidationError");
      clock.advance(Duration.ofSeconds(1));
    }

    List<AlertEvent> burstEvents = eventsFor(ErrorBurstSignal.NAME);
    assertEquals(1, burstEvents.size());
    AlertEvent fired = burstEvents.get(0);
    assertEquals(AlertState.FIRED, fired.getAlertState());
    assertEquals(AlertType.ERROR, fired.getAlertType());
    assertEquals(Severity.LOW, fired.getSeverity());
    assertEquals("orders", fired.getServiceName());
    assertEquals(5, fired.getErrorCount());
    assertNull(fired.getAlertDuration());
    assertTrue(detector.getActiveAlerts().containsKey(ErrorBurstSignal.NAME));

    clock.advance(Duration.ofSeconds(61));
    detector.recordRequest(100, true, "ValidationError");

    burstEvents = eventsFor(ErrorBurstSignal.NAME);
    assertEquals(2, burstEvents.size());
    AlertEvent resolved = burstEvents.get(1);
    assertEquals(AlertState.RESOLVED, resolved.getAlertState());
    assertEquals(Severity.LOW, resolved.getSeverity());
    assertEquals(Long.valueOf(62_000L), resolved.getAlertDuration());
    assertFalse(detector.getActiveAlerts().containsKey(ErrorBurstSignal.NAME));
  }

  @Test
  void testSeverityIsFrozenAtFireTime() {
    AlertDetector detector = newDetector(Optional.empty());
    for (int i = 0; i < 12; i++) {
      detector.recordRequest(100, true);
    }
    clock.advance(Duration.ofSeconds(90));
    detector.runPeriodicCheck();

    List<AlertEvent> burstEvents = eventsFor(ErrorBurstSignal.NAME);
    assertEquals(2, burstEvents.size());
    assertEquals(Severity.LOW, burstEvents.get(0).getSeverity());
    assertEquals(Severity.LOW, burstEvents.get(1).getSeverity());
    assertEquals(AlertState.RESOLVED, burstEvents.get(1).getAlertState());
  }

  @Test
  void testAtMostOneActiveAlertPerName() {
    AlertDetector detector = newDetector(Optional.empty());
    Random random = new Random(42);
    for (int i = 0; i < 500; i++) {
      detector.recordRequest(random.nextInt(8000), random.nextInt(3) == 0);
      clock.advance(Duration.ofMillis(random.nextInt(4000)));
    }

    Map<String, AlertState> lastState = new HashMap<>();
    Map<String, Severity> firedSeverity = new HashMap<>();
    for (AlertEvent event : events) {
      AlertState previous = lastState.get(event.getAlertName());
      if (event.getAlertState() == AlertState.FIRED) {
        assertTrue(previous == null || previous == AlertState.RESOLVED);
        firedSeverity.put(event.getAlertName(), event.getSeverity());
      } else {
        assertEquals(AlertState.FIRED, previous);
        assertEquals(firedSeverity.get(event.getAlertName()), event.getSeverity());
      }
      lastState.put(event.getAlertName(), event.getAlertState());
    }
    long active =
        lastState.values().stream().filter(state -> state == AlertState.FIRED).count();
    assertEquals(active, detector.getStats().getActiveAlertCount());
  }

  @Test
  void testHighLatencyNeedsThreeSlowSuccessfulRequests() {
    AlertDetector detector = newDetector(Optional.empty());
    detector.recordRequest(4200, false);
    detector.recordRequest(4600, false);
    assertTrue(eventsFor(HighLatencySignal.NAME).isEmpty());

    detector.recordRequest(4700, false);
    List<AlertEvent> latencyEvents = eventsFor(HighLatencySignal.NAME);
    assertEquals(1, latencyEvents.size());
    assertEquals(Severity.MEDIUM, latencyEvents.get(0).getSeverity());
    assertEquals(4500, latencyEvents.get(0).getAverageResponseTime());

    // errors do not count towards latency
    detector.recordRequest(50, true);
    assertEquals(1, eventsFor(HighLatencySignal.NAME).size());

    detector.recordRequest(120, false);
    latencyEvents = eventsFor(HighLatencySignal.NAME);
    assertEquals(2, latencyEvents.size());
    assertEquals(AlertState.RESOLVED, latencyEvents.get(1).getAlertState());
    assertEquals(Severity.MEDIUM, latencyEvents.get(1).getSeverity());
  }

  @Test
  void testAvailabilityWaitsForMinimumSamples() {
    AlertDetector detector = newDetector(Optional.empty());
    for (int i = 0; i < 4; i++) {
      detector.recordRequest(100, false);
    }
    for (int i = 0; i < 5; i++) {
      detector.recordRequest(100, true);
    }
    assertTrue(eventsFor(AvailabilitySignal.NAME).isEmpty());

    detector.recordRequest(100, true);
    List<AlertEvent> availabilityEvents = eventsFor(AvailabilitySignal.NAME);
    assertEquals(1, availabilityEvents.size());
    assertEquals(Severity.LOW, availabilityEvents.get(0).getSeverity());
    assertEquals(AlertType.AVAILABILITY, availabilityEvents.get(0).getAlertType());
  }

  @Test
  void testMemoryUsageHysteresis() {
    AlertDetector detector = newDetector(Optional.empty());
    when(processMetrics.snapshot())
        .thenReturn(new ProcessSnapshot(900L, 87, 20))
        .thenReturn(new ProcessSnapshot(800L, 82, 20))
        .thenReturn(new ProcessSnapshot(700L, 79, 20));

    detector.runPeriodicCheck();
    assertEquals(1, eventsFor(MemoryUsageSignal.NAME).size());
    AlertEvent fired = eventsFor(MemoryUsageSignal.NAME).get(0);
    assertEquals(Severity.MEDIUM, fired.getSeverity());
    assertEquals(900, fired.getProcessMemoryUsage());

    detector.runPeriodicCheck();
    assertEquals(1, eventsFor(MemoryUsageSignal.NAME).size());
    assertTrue(detector.getActiveAlerts().containsKey(MemoryUsageSignal.NAME));

    detector.runPeriodicCheck();
    assertEquals(2, eventsFor(MemoryUsageSignal.NAME).size());
    assertEquals(AlertState.RESOLVED, eventsFor(MemoryUsageSignal.NAME).get(1).getAlertState());
  }

  @Test
  void testCpuUsageHysteresis() {
    AlertDetector detector = newDetector(Optional.empty());
    when(processMetrics.snapshot())
        .thenReturn(new ProcessSnapshot(1L, 40, 96.456))
        .thenReturn(new ProcessSnapshot(1L, 40, 75))
        .thenReturn(new ProcessSnapshot(1L, 40, 69));

    detector.runPeriodicCheck();
    AlertEvent fired = eventsFor(CpuUsageSignal.NAME).get(0);
    assertEquals(Severity.CRITICAL, fired.getSeverity());
    assertEquals(96.46, fired.getProcessCpuUsage());

    detector.runPeriodicCheck();
    assertEquals(1, eventsFor(CpuUsageSignal.NAME).size());

    detector.runPeriodicCheck();
    List<AlertEvent> cpuEvents = eventsFor(CpuUsageSignal.NAME);
    assertEquals(2, cpuEvents.size());
    assertEquals(Severity.CRITICAL, cpuEvents.get(1).getSeverity());
  }

  @Test
  void testUnreadableProcessMetricsHoldResourceSignals() {
    AlertDetector detector = newDetector(Optional.empty());
    when(processMetrics.snapshot())
        .thenReturn(new ProcessSnapshot(1L, 96, 96))
        .thenThrow(new IllegalStateException("not supported"))
        .thenReturn(ProcessSnapshot.UNAVAILABLE);

    detector.runPeriodicCheck();
    detector.runPeriodicCheck();
    detector.runPeriodicCheck();

    assertEquals(1, eventsFor(MemoryUsageSignal.NAME).size());
    assertEquals(1, eventsFor(CpuUsageSignal.NAME).size());
    assertTrue(detector.getActiveAlerts().containsKey(MemoryUsageSignal.NAME));
    assertTrue(detector.getActiveAlerts().containsKey(CpuUsageSignal.NAME));
  }

  @Test
  void testEventLoopLagUsesRollingSchedulerDrift() {
    AlertDetector detector = newDetector(Optional.empty());
    detector.runPeriodicCheck();
    assertTrue(eventsFor(EventLoopLagSignal.NAME).isEmpty());

    detector.runPeriodicCheck(150);
    List<AlertEvent> lagEvents = eventsFor(EventLoopLagSignal.NAME);
    assertEquals(1, lagEvents.size());
    assertEquals(Severity.LOW, lagEvents.get(0).getSeverity());
    assertEquals(150.0, lagEvents.get(0).getEventLoopLag());

    // average 85ms, inside the hysteresis band
    detector.runPeriodicCheck(20);
    assertEquals(1, eventsFor(EventLoopLagSignal.NAME).size());

    // average 56.67ms
    detector.runPeriodicCheck(0);
    lagEvents = eventsFor(EventLoopLagSignal.NAME);
    assertEquals(2, lagEvents.size());
    assertEquals(AlertState.RESOLVED, lagEvents.get(1).getAlertState());
    assertEquals(56.67, lagEvents.get(1).getEventLoopLag());
  }

  @Test
  void testTrafficBaselineIsFrozenAndDrivesSpikeAndDrop() {
    AlertDetector detector = newDetector(Optional.empty());
    // one request every 10s: samples of 1..5 requests in the last minute
    for (int i = 0; i < 5; i++) {
      detector.recordRequest(100, false);
      clock.advance(Duration.ofSeconds(10));
    }
    assertEquals(0.05, detector.getTrafficBaseline().getAsDouble(), 1e-9);

    for (int i = 0; i < 4; i++) {
      detector.recordRequest(100, false);
    }
    List<AlertEvent> spikeEvents = eventsFor(TrafficSpikeSignal.NAME);
    assertEquals(1, spikeEvents.size());
    assertEquals(Severity.LOW, spikeEvents.get(0).getSeverity());
    assertEquals(0.15, spikeEvents.get(0).getTrafficRate());
    assertEquals(0.05, detector.getTrafficBaseline().getAsDouble(), 1e-9);

    clock.advance(Duration.ofMinutes(2));
    detector.runPeriodicCheck();

    spikeEvents = eventsFor(TrafficSpikeSignal.NAME);
    assertEquals(2, spikeEvents.size());
    assertEquals(AlertState.RESOLVED, spikeEvents.get(1).getAlertState());
    List<AlertEvent> dropEvents = eventsFor(TrafficDropSignal.NAME);
    assertEquals(1, dropEvents.size());
    assertEquals(Severity.CRITICAL, dropEvents.get(0).getSeverity());
    assertEquals(0.05, detector.getTrafficBaseline().getAsDouble(), 1e-9);
  }

  @Test
  void testTrafficSignalsHoldWithoutBaseline() {
    AlertDetector detector = newDetector(Optional.empty());
    for (int i = 0; i < 5; i++) {
      detector.runPeriodicCheck();
    }
    for (int i = 0; i < 20; i++) {
      detector.recordRequest(100, false);
    }
    // baseline was frozen at zero by the idle checks
    assertEquals(0.0, detector.getTrafficBaseline().getAsDouble());
    assertTrue(eventsFor(TrafficSpikeSignal.NAME).isEmpty());
    assertTrue(eventsFor(TrafficDropSignal.NAME).isEmpty());
  }

  @Test
  void testAuthFailureSpikeHysteresis() {
    AlertDetector detector = newDetector(Optional.empty());
    for (int i = 0; i < 3; i++) {
      detector.recordAuthFailure("invalid_token");
    }
    clock.advance(Duration.ofMinutes(2));
    for (int i = 0; i < 7; i++) {
      detector.recordAuthFailure("invalid_password");
    }
    assertTrue(eventsFor(AuthFailureSpikeSignal.NAME).isEmpty());

    detector.runPeriodicCheck();
    List<AlertEvent> authEvents = eventsFor(AuthFailureSpikeSignal.NAME);
    assertEquals(1, authEvents.size());
    assertEquals(AlertType.SECURITY, authEvents.get(0).getAlertType());
    assertEquals(Severity.LOW, authEvents.get(0).getSeverity());

    // the first three expire, seven remain
    clock.advance(Duration.ofMinutes(3).plusSeconds(1));
    detector.runPeriodicCheck();
    assertEquals(1, eventsFor(AuthFailureSpikeSignal.NAME).size());

    clock.advance(Duration.ofMinutes(2));
    detector.runPeriodicCheck();
    authEvents = eventsFor(AuthFailureSpikeSignal.NAME);
    assertEquals(2, authEvents.size());
    assertEquals(AlertState.RESOLVED, authEvents.get(1).getAlertState());
  }

  @Test
  void testDatabaseSignalOnlyWithProbe() {
    DatastoreProbe datastoreProbe = mock(DatastoreProbe.class);
    when(datastoreProbe.isConnected()).thenReturn(false).thenReturn(true);
    AlertDetector detector = newDetector(Optional.of(datastoreProbe));

    detector.runPeriodicCheck();
    List<AlertEvent> databaseEvents = eventsFor(DatabaseConnectionSignal.NAME);
    assertEquals(1, databaseEvents.size());
    assertEquals(Severity.CRITICAL, databaseEvents.get(0).getSeverity());

    detector.runPeriodicCheck();
    assertEquals(2, eventsFor(DatabaseConnectionSignal.NAME).size());

    AlertDetector withoutProbe = newDetector(Optional.empty());
    events.clear();
    withoutProbe.runPeriodicCheck();
    assertTrue(eventsFor(DatabaseConnectionSignal.NAME).isEmpty());
  }

  @Test
  void testFailingSignalDoesNotStopOtherSignals() {
    Signal failing =
        new Signal("broken_signal", AlertType.PERFORMANCE) {
          @Override
          public SignalReading evaluate(SignalContext context) {
            throw new IllegalStateException("boom");
          }
        };
    Signal alwaysFiring =
        new Signal("always_firing", AlertType.ERROR) {
          @Override
          public SignalReading evaluate(SignalContext context) {
            return SignalReading.fire(Severity.HIGH);
          }
        };
    AlertDetector detector =
        new AlertDetector(
            config,
            events::add,
            processMetrics,
            List.of(failing, alwaysFiring),
            clock,
            meterRegistry);

    detector.runPeriodicCheck();
    detector.runPeriodicCheck();

    assertEquals(1, events.size());
    assertEquals("always_firing", events.get(0).getAlertName());
    assertEquals(Severity.HIGH, events.get(0).getSeverity());
  }

  @Test
  void testStatsAndMetrics() {
    AlertDetector detector = newDetector(Optional.empty());
    for (int i = 0; i < 6; i++) {
      detector.recordRequest(100, i % 2 == 0);
    }
    detector.recordRequest(100, true);
    detector.recordRequest(100, true);

    DetectorStats stats = detector.getStats();
    assertEquals(8, stats.getRecentRequestCount());
    assertEquals(5, stats.getRecentErrorCount());
    assertEquals(1, stats.getActiveAlertCount());
    assertEquals(
        1.0,
        meterRegistry
            .get(AlertDetector.EVENTS_COUNTER)
            .tag("alert_name", ErrorBurstSignal.NAME)
            .tag("alert_state", "fired")
            .counter()
            .count());
    assertEquals(1.0, meterRegistry.get(AlertDetector.ACTIVE_ALERTS_GAUGE).gauge().value());

    clock.advance(Duration.ofMinutes(6));
    stats = detector.getStats();
    assertEquals(0, stats.getRecentRequestCount());
    assertEquals(0, stats.getRecentErrorCount());
    // reading stats leaves the window untouched
    assertEquals(8, detector.getWindow().getRequestCount());
    assertEquals(1, detector.getStats().getActiveAlertCount());
  }
}
