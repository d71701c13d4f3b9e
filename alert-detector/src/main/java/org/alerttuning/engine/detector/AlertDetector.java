package org.alerttuning.engine.detector;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.alerttuning.engine.detector.signal.Signal;
import org.alerttuning.engine.detector.signal.SignalContext;
import org.alerttuning.engine.detector.signal.SignalProvider;
import org.alerttuning.engine.detector.signal.SignalReading;
import org.alerttuning.engine.event.datamodel.AlertEvent;
import org.alerttuning.engine.event.datamodel.AlertState;
import org.alerttuning.engine.event.datamodel.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-process anomaly detector. Request samples and periodic checks update a set of sliding
 * windows, and every check evaluates each {@link Signal} against them. A signal fires at most
 * once until it resolves; the resolve event carries the severity the alert fired with.
 *
 * <p>All state changes go through this object's monitor, so request threads and the scheduler
 * thread may call in concurrently.
 */
public class AlertDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDetector.class);

  static final String EVENTS_COUNTER = "alert.detector.events";
  static final String ACTIVE_ALERTS_GAUGE = "alert.detector.active.alerts";

  private final DetectorConfig config;
  private final AlertEventSink eventSink;
  private final ProcessMetrics processMetrics;
  private final Clock clock;
  private final List<Signal> signals;
  private final DetectorWindow window;
  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, ActiveAlert> activeAlerts = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> eventCounters = new ConcurrentHashMap<>();

  public AlertDetector(DetectorConfig config, Optional<DatastoreProbe> datastoreProbe) {
    this(
        config,
        new NdjsonAlertEventLog(config.getLogDirectory(), config.getServiceName()),
        new JvmProcessMetrics(),
        datastoreProbe,
        Clock.systemUTC(),
        Metrics.globalRegistry);
  }

  public AlertDetector(
      DetectorConfig config,
      AlertEventSink eventSink,
      ProcessMetrics processMetrics,
      Optional<DatastoreProbe> datastoreProbe,
      Clock clock,
      MeterRegistry meterRegistry) {
    this(
        config,
        eventSink,
        processMetrics,
        SignalProvider.getSignals(config, datastoreProbe),
        clock,
        meterRegistry);
  }

  AlertDetector(
      DetectorConfig config,
      AlertEventSink eventSink,
      ProcessMetrics processMetrics,
      List<Signal> signals,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.eventSink = eventSink;
    this.processMetrics = processMetrics;
    this.signals = List.copyOf(signals);
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.window = new DetectorWindow(config);
    Gauge.builder(ACTIVE_ALERTS_GAUGE, activeAlerts, Map::size)
        .tag("service_name", config.getServiceName())
        .register(meterRegistry);
  }

  public void recordRequest(long durationMillis, boolean isError) {
    recordRequest(durationMillis, isError, null);
  }

  public synchronized void recordRequest(long durationMillis, boolean isError, String errorType) {
    long now = clock.millis();
    window.addRequest(new RequestMetrics(now, durationMillis, isError, errorType));
    checkAlertConditions(now);
  }

  /** Adds to the rolling auth-failure count; it is evaluated on the next check. */
  public synchronized void recordAuthFailure(String failureType) {
    window.addAuthFailure(new AuthFailure(clock.millis(), failureType));
  }

  public synchronized void runPeriodicCheck() {
    checkAlertConditions(clock.millis());
  }

  /**
   * Periodic check fed by the scheduler, which reports how late this run started compared to its
   * schedule.
   */
  public synchronized void runPeriodicCheck(long schedulerDriftMillis) {
    window.addSchedulerDrift(schedulerDriftMillis);
    checkAlertConditions(clock.millis());
  }

  /** Read only; expired samples are excluded from the counts but left for the next prune. */
  public synchronized DetectorStats getStats() {
    long since = clock.millis() - config.getMetricsWindow();
    return new DetectorStats(
        activeAlerts.size(), window.countRequestsSince(since), window.countErrorsSince(since));
  }

  public Map<String, ActiveAlert> getActiveAlerts() {
    return Map.copyOf(activeAlerts);
  }

  public synchronized OptionalDouble getTrafficBaseline() {
    return window.getTrafficBaseline();
  }

  DetectorWindow getWindow() {
    return window;
  }

  private void checkAlertConditions(long now) {
    window.prune(now);
    window.recordTrafficSample(now);
    ProcessSnapshot processSnapshot = readProcessSnapshot();
    SignalContext context = new SignalContext(now, window, processSnapshot);

    for (Signal signal : signals) {
      try {
        SignalReading reading = signal.evaluate(context);
        apply(signal, reading, context);
      } catch (RuntimeException e) {
        LOGGER.error("Failed to evaluate signal:{}", signal.getAlertName(), e);
      }
    }
  }

  private void apply(Signal signal, SignalReading reading, SignalContext context) {
    String alertName = signal.getAlertName();
    switch (reading.getAction()) {
      case FIRE:
        if (activeAlerts.containsKey(alertName)) {
          return;
        }
        Severity severity = reading.getSeverity().orElse(Severity.LOW);
        Instant firedAt = Instant.ofEpochMilli(context.getNow());
        activeAlerts.put(
            alertName, new ActiveAlert(alertName, signal.getAlertType(), firedAt, severity));
        emit(
            newEvent(context, alertName, AlertState.FIRED, severity)
                .alertType(signal.getAlertType())
                .build());
        LOGGER.warn("Alert fired: {} severity:{}", alertName, severity);
        break;
      case RESOLVE:
        ActiveAlert activeAlert = activeAlerts.remove(alertName);
        if (activeAlert == null) {
          return;
        }
        long duration =
            Duration.between(activeAlert.getFiredAt(), Instant.ofEpochMilli(context.getNow()))
                .toMillis();
        emit(
            newEvent(context, alertName, AlertState.RESOLVED, activeAlert.getSeverity())
                .alertType(activeAlert.getAlertType())
                .alertDuration(duration)
                .build());
        LOGGER.info("Alert resolved: {} after {}ms", alertName, duration);
        break;
      default:
        break;
    }
  }

  private AlertEvent.AlertEventBuilder newEvent(
      SignalContext context, String alertName, AlertState alertState, Severity severity) {
    ProcessSnapshot processSnapshot = context.getProcessSnapshot();
    OptionalDouble drift = window.getAverageSchedulerDrift();
    return AlertEvent.builder()
        .timestamp(Instant.ofEpochMilli(context.getNow()))
        .serviceName(config.getServiceName())
        .alertName(alertName)
        .alertState(alertState)
        .severity(severity)
        .requestCount(window.getRequestCount())
        .errorCount(window.getErrorCount())
        .averageResponseTime(Math.round(window.getAverageResponseTime()))
        .processCpuUsage(
            processSnapshot.hasCpuUsage() ? round2(processSnapshot.getCpuUsagePercent()) : -1)
        .processMemoryUsage(processSnapshot.getHeapUsedBytes())
        .eventLoopLag(drift.isPresent() ? round2(drift.getAsDouble()) : null)
        .trafficRate(round2(window.getCurrentTrafficRate(context.getNow())));
  }

  private void emit(AlertEvent alertEvent) {
    eventCounters
        .computeIfAbsent(
            alertEvent.getAlertName() + "/" + alertEvent.getAlertState(),
            key ->
                Counter.builder(EVENTS_COUNTER)
                    .tag("service_name", config.getServiceName())
                    .tag("alert_name", alertEvent.getAlertName())
                    .tag("alert_state", alertEvent.getAlertState().getValue())
                    .register(meterRegistry))
        .increment();
    eventSink.append(alertEvent);
  }

  private ProcessSnapshot readProcessSnapshot() {
    try {
      return processMetrics.snapshot();
    } catch (RuntimeException e) {
      LOGGER.warn("Unable to read process metrics", e);
      return ProcessSnapshot.UNAVAILABLE;
    }
  }

  private static double round2(double value) {
    return Math.round(value * 100) / 100d;
  }
}
