package org.alerttuning.engine.detector.signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.alerttuning.engine.detector.DatastoreProbe;
import org.alerttuning.engine.detector.DetectorConfig;

public class SignalProvider {

  private SignalProvider() {}

  /** The built-in signals in evaluation order. */
  public static List<Signal> getSignals(
      DetectorConfig config, Optional<DatastoreProbe> datastoreProbe) {
    List<Signal> signals = new ArrayList<>();
    signals.add(
        new ErrorBurstSignal(config.getErrorBurstThreshold(), config.getErrorBurstWindow()));
    signals.add(
        new HighLatencySignal(
            config.getHighLatencyThreshold(), config.getHighLatencySampleCount()));
    signals.add(
        new AvailabilitySignal(
            config.getAvailabilityErrorRate(), config.getAvailabilityMinSamples()));
    signals.add(
        new MemoryUsageSignal(
            config.getMemoryThresholdPercent(), config.getMemoryResolvePercent()));
    signals.add(new CpuUsageSignal(config.getCpuThresholdPercent(), config.getCpuResolvePercent()));
    signals.add(
        new EventLoopLagSignal(
            config.getEventLoopLagThreshold(), config.getEventLoopLagResolveThreshold()));
    signals.add(
        new TrafficSpikeSignal(
            config.getTrafficSpikeMultiplier(), config.getTrafficSpikeResolveMultiplier()));
    signals.add(
        new TrafficDropSignal(
            config.getTrafficDropMultiplier(), config.getTrafficDropResolveMultiplier()));
    signals.add(
        new AuthFailureSpikeSignal(
            config.getAuthFailureThreshold(), config.getAuthFailureResolveThreshold()));
    datastoreProbe.ifPresent(probe -> signals.add(new DatabaseConnectionSignal(probe)));
    return signals;
  }
}
