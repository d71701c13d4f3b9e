package org.alerttuning.engine.detector.signal;

import java.util.List;
import org.alerttuning.engine.detector.RequestMetrics;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.Severity;

/** Fires when every one of the most recent successful requests exceeded the latency threshold. */
public class HighLatencySignal extends Signal {
  public static final String NAME = "high_latency";

  private final long threshold;
  private final int sampleCount;

  public HighLatencySignal(long threshold, int sampleCount) {
    super(NAME, AlertType.LATENCY);
    this.threshold = threshold;
    this.sampleCount = sampleCount;
  }

  @Override
  public SignalReading evaluate(SignalContext context) {
    List<RequestMetrics> recent = context.getWindow().getLastSuccessfulRequests(sampleCount);
    if (recent.size() < sampleCount) {
      return SignalReading.hold();
    }
    boolean allSlow = recent.stream().allMatch(request -> request.getDuration() > threshold);
    if (!allSlow) {
      return SignalReading.resolve();
    }
    double average = recent.stream().mapToLong(RequestMetrics::getDuration).average().orElse(0);
    if (average > 5000) {
      return SignalReading.fire(Severity.HIGH);
    }
    return SignalReading.fire(average > 4000 ? Severity.MEDIUM : Severity.LOW);
  }
}
