package org.alerttuning.engine.detector;

import com.google.common.collect.EvictingQueue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import org.alerttuning.engine.statistics.Statistics;

/**
 * Sliding windows kept by one detector: recent requests, auth failures, per-minute traffic
 * samples and scheduler drift. Not thread safe; the owning detector serializes access.
 */
public class DetectorWindow {
  private final DetectorConfig config;
  private final Deque<RequestMetrics> requests = new ArrayDeque<>();
  private final Deque<AuthFailure> authFailures = new ArrayDeque<>();
  private final Deque<TrafficSample> trafficHistory = new ArrayDeque<>();
  private final EvictingQueue<Long> schedulerDrift;
  // mean request count per rate window
  private OptionalDouble baselineCount = OptionalDouble.empty();

  public DetectorWindow(DetectorConfig config) {
    this.config = config;
    this.schedulerDrift = EvictingQueue.create(config.getEventLoopLagSampleCount());
  }

  void addRequest(RequestMetrics requestMetrics) {
    requests.addLast(requestMetrics);
  }

  void addAuthFailure(AuthFailure authFailure) {
    authFailures.addLast(authFailure);
  }

  void addSchedulerDrift(long driftMillis) {
    schedulerDrift.add(Math.max(0L, driftMillis));
  }

  void prune(long now) {
    long requestCutoff = now - config.getMetricsWindow();
    while (!requests.isEmpty() && requests.peekFirst().getTimestamp() <= requestCutoff) {
      requests.pollFirst();
    }
    long authCutoff = now - config.getAuthFailureWindow();
    while (!authFailures.isEmpty() && authFailures.peekFirst().getTimestamp() <= authCutoff) {
      authFailures.pollFirst();
    }
  }

  /**
   * Records the request count of the last rate window. The first time enough samples are held,
   * their mean rate becomes the traffic baseline, which is never recomputed.
   */
  void recordTrafficSample(long now) {
    long count = countRequestsSince(now - config.getTrafficRateWindow());
    trafficHistory.addLast(new TrafficSample(now, count));
    long historyCutoff = now - config.getTrafficHistoryWindow();
    while (!trafficHistory.isEmpty()
        && trafficHistory.peekFirst().getTimestamp() <= historyCutoff) {
      trafficHistory.pollFirst();
    }
    if (baselineCount.isEmpty()
        && trafficHistory.size() >= config.getTrafficBaselineMinSamples()) {
      List<Long> counts = new ArrayList<>();
      trafficHistory.forEach(sample -> counts.add(sample.getCount()));
      baselineCount = OptionalDouble.of(Statistics.mean(counts));
    }
  }

  public List<RequestMetrics> getRequests() {
    return List.copyOf(requests);
  }

  public long getRequestCount() {
    return requests.size();
  }

  public long getErrorCount() {
    return requests.stream().filter(RequestMetrics::isError).count();
  }

  public double getAverageResponseTime() {
    if (requests.isEmpty()) {
      return 0;
    }
    return requests.stream().mapToLong(RequestMetrics::getDuration).average().orElse(0);
  }

  public long countErrorsSince(long since) {
    return requests.stream()
        .filter(request -> request.isError() && request.getTimestamp() > since)
        .count();
  }

  public long countRequestsSince(long since) {
    return requests.stream().filter(request -> request.getTimestamp() > since).count();
  }

  /** The most recent {@code limit} successful requests, oldest first. */
  public List<RequestMetrics> getLastSuccessfulRequests(int limit) {
    List<RequestMetrics> successful = new ArrayList<>();
    requests
        .descendingIterator()
        .forEachRemaining(
            request -> {
              if (!request.isError() && successful.size() < limit) {
                successful.add(0, request);
              }
            });
    return successful;
  }

  public int getAuthFailureCount() {
    return authFailures.size();
  }

  public OptionalDouble getAverageSchedulerDrift() {
    if (schedulerDrift.isEmpty()) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Statistics.mean(schedulerDrift));
  }

  /** Baseline request rate in requests per second. */
  public OptionalDouble getTrafficBaseline() {
    return baselineCount.isPresent()
        ? OptionalDouble.of(baselineCount.getAsDouble() / rateWindowSeconds())
        : OptionalDouble.empty();
  }

  /** Current rate as a multiple of the baseline, empty until a non-zero baseline exists. */
  public OptionalDouble getTrafficRatio(long now) {
    if (baselineCount.isEmpty() || baselineCount.getAsDouble() <= 0) {
      return OptionalDouble.empty();
    }
    long current = countRequestsSince(now - config.getTrafficRateWindow());
    return OptionalDouble.of(current / baselineCount.getAsDouble());
  }

  /** Requests per second over the last rate window. */
  public double getCurrentTrafficRate(long now) {
    return countRequestsSince(now - config.getTrafficRateWindow()) / rateWindowSeconds();
  }

  private double rateWindowSeconds() {
    return config.getTrafficRateWindow() / 1000d;
  }
}
