package org.alerttuning.engine.analyzer;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.statistics.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives per-service baselines, false-positive indicators and temporal patterns from a merged
 * alert history. The history must already be sorted by normalized timestamp.
 */
public class HistoricalAnalyzer {
  private static final Logger LOGGER = LoggerFactory.getLogger(HistoricalAnalyzer.class);

  static final long REPETITIVE_WINDOW_MILLIS = 300_000L;
  private static final double MILLIS_PER_HOUR = 3_600_000d;
  private static final double PEAK_HOUR_FACTOR = 1.5;
  private static final double PEAK_DAY_FACTOR = 1.2;

  private final List<NormalizedAlertEvent> alerts;
  private final ZoneId zoneId;
  private final Clock clock;

  public HistoricalAnalyzer(List<NormalizedAlertEvent> alerts) {
    this(alerts, ZoneId.systemDefault(), Clock.systemUTC());
  }

  public HistoricalAnalyzer(List<NormalizedAlertEvent> alerts, ZoneId zoneId, Clock clock) {
    this.alerts = List.copyOf(alerts);
    this.zoneId = zoneId;
    this.clock = clock;
  }

  public AnalysisReport analyze() {
    LOGGER.info("Starting analysis of {} alerts", alerts.size());
    Map<String, ServiceBaseline> baselines = calculateServiceBaselines();
    FalsePositiveIndicators falsePositives = detectFalsePositives();
    TemporalPattern temporalPattern = analyzeTemporalPatterns();
    AnalysisReport report =
        AnalysisReport.builder()
            .generatedAt(clock.instant())
            .totalAlertsAnalyzed(alerts.size())
            .timeRange(getTimeRange().orElse(null))
            .serviceBaselines(baselines)
            .falsePositiveAnalysis(falsePositives)
            .temporalPatterns(temporalPattern)
            .recommendations(generateRecommendations(baselines, falsePositives, temporalPattern))
            .build();
    LOGGER.info("Analysis complete");
    return report;
  }

  public Optional<TimeRange> getTimeRange() {
    if (alerts.isEmpty()) {
      return Optional.empty();
    }
    long start =
        alerts.stream().mapToLong(NormalizedAlertEvent::getNormalizedTimestamp).min().getAsLong();
    long end =
        alerts.stream().mapToLong(NormalizedAlertEvent::getNormalizedTimestamp).max().getAsLong();
    return Optional.of(new TimeRange(Instant.ofEpochMilli(start), Instant.ofEpochMilli(end)));
  }

  /** Baselines keyed by service name, in order of each service's first alert. */
  public Map<String, ServiceBaseline> calculateServiceBaselines() {
    ImmutableListMultimap<String, NormalizedAlertEvent> alertsByService =
        Multimaps.index(alerts, NormalizedAlertEvent::getServiceName);

    Map<String, ServiceBaseline> baselines = new LinkedHashMap<>();
    for (String service : alertsByService.keySet()) {
      List<NormalizedAlertEvent> serviceAlerts = alertsByService.get(service);
      List<NormalizedAlertEvent> resolved = resolvedOf(serviceAlerts);

      ServiceBaseline baseline =
          ServiceBaseline.builder()
              .serviceName(service)
              .totalAlerts(serviceAlerts.size())
              .avgErrorCount(
                  Statistics.mean(
                      collect(serviceAlerts, alert -> alert.getEvent().getErrorCount())))
              .avgResponseTime(
                  Statistics.mean(
                      collect(serviceAlerts, alert -> alert.getEvent().getAverageResponseTime())))
              .avgAlertDuration(
                  Statistics.mean(
                      resolved.stream()
                          .map(alert -> alert.getEvent().getAlertDuration())
                          .filter(duration -> duration != null)
                          .collect(Collectors.toList())))
              .falsePositiveRate(quickResolveRate(resolved))
              .alertRatePerHour(alertRatePerHour(serviceAlerts))
              // hosts that cannot read CPU report -1
              .avgCpuUsage(
                  Statistics.mean(
                      serviceAlerts.stream()
                          .map(alert -> alert.getEvent().getProcessCpuUsage())
                          .filter(cpu -> cpu > 0)
                          .collect(Collectors.toList())))
              .avgMemoryUsage(
                  Statistics.mean(
                      collect(serviceAlerts, alert -> alert.getEvent().getProcessMemoryUsage())))
              .build();
      baselines.put(service, baseline);
      LOGGER.info(
          "{}: {} alerts, FP rate: {}%",
          service,
          serviceAlerts.size(),
          String.format(Locale.ROOT, "%.1f", baseline.getFalsePositiveRate() * 100));
    }
    return baselines;
  }

  /**
   * Quick resolves over all resolved alerts, and the number of alert pairs with the same
   * service, type and name less than five minutes apart.
   */
  public FalsePositiveIndicators detectFalsePositives() {
    List<NormalizedAlertEvent> resolved = resolvedOf(alerts);
    List<NormalizedAlertEvent> quickResolves =
        resolved.stream()
            .filter(alert -> alert.getEvent().isQuickResolve())
            .collect(Collectors.toList());

    long repetitiveCount = 0;
    for (int i = 0; i < alerts.size() - 1; i++) {
      NormalizedAlertEvent first = alerts.get(i);
      for (int j = i + 1; j < alerts.size(); j++) {
        NormalizedAlertEvent second = alerts.get(j);
        long gap = Math.abs(second.getNormalizedTimestamp() - first.getNormalizedTimestamp());
        if (gap > REPETITIVE_WINDOW_MILLIS) {
          break;
        }
        if (first.getServiceName().equals(second.getServiceName())
            && first.getAlertType() == second.getAlertType()
            && first.getAlertName().equals(second.getAlertName())) {
          repetitiveCount++;
        }
      }
    }

    double fpRate = quickResolveRate(resolved);
    LOGGER.info(
        "Quick resolves: {}, Repetitive: {}, FP rate: {}%",
        quickResolves.size(),
        repetitiveCount,
        String.format(Locale.ROOT, "%.1f", fpRate * 100));
    return new FalsePositiveIndicators(quickResolves, repetitiveCount, fpRate);
  }

  public TemporalPattern analyzeTemporalPatterns() {
    SortedMap<Integer, Long> hourCounts = new TreeMap<>();
    SortedMap<Integer, Long> dayCounts = new TreeMap<>();
    for (NormalizedAlertEvent alert : alerts) {
      ZonedDateTime time = Instant.ofEpochMilli(alert.getNormalizedTimestamp()).atZone(zoneId);
      hourCounts.merge(time.getHour(), 1L, Long::sum);
      // DayOfWeek runs Monday=1 to Sunday=7
      dayCounts.merge(time.getDayOfWeek().getValue() % 7, 1L, Long::sum);
    }

    List<Integer> peakHours = peaksOf(hourCounts, PEAK_HOUR_FACTOR);
    List<Integer> peakDays = peaksOf(dayCounts, PEAK_DAY_FACTOR);
    LOGGER.info("Peak hours: {}, Peak days: {}", peakHours, peakDays);
    return new TemporalPattern(peakHours, peakDays, hourCounts, dayCounts);
  }

  public List<String> generateRecommendations(
      Map<String, ServiceBaseline> baselines,
      FalsePositiveIndicators falsePositives,
      TemporalPattern temporalPattern) {
    List<String> recommendations = new ArrayList<>();

    if (falsePositives.getEstimatedFpRate() > 0.3) {
      recommendations.add(
          String.format(
              Locale.ROOT,
              "High false positive rate detected (%.1f%%). Consider increasing alert thresholds.",
              falsePositives.getEstimatedFpRate() * 100));
    }

    baselines.forEach(
        (service, baseline) -> {
          if (baseline.getFalsePositiveRate() > 0.4) {
            recommendations.add(
                String.format(
                    Locale.ROOT,
                    "%s: %.1f%% false positive rate. Recommend threshold adjustment.",
                    service,
                    baseline.getFalsePositiveRate() * 100));
          }
          if (baseline.getAlertRatePerHour() > 10) {
            recommendations.add(
                String.format(
                    Locale.ROOT,
                    "%s: High alert rate (%.1f/hour). Consider alert suppression or threshold"
                        + " tuning.",
                    service,
                    baseline.getAlertRatePerHour()));
          }
        });

    if (falsePositives.getRepetitiveCount() > 50) {
      recommendations.add(
          String.format(
              "%d repetitive alert patterns detected. Consider alert suppression rules.",
              falsePositives.getRepetitiveCount()));
    }

    if (!temporalPattern.getPeakHours().isEmpty()) {
      recommendations.add(
          String.format(
              "Peak alert hours detected: %s. Consider time-based threshold adjustments.",
              temporalPattern.getPeakHours().stream()
                  .map(String::valueOf)
                  .collect(Collectors.joining(", "))));
    }

    if (recommendations.isEmpty()) {
      recommendations.add("Alert patterns appear normal. Continue monitoring.");
    }
    return recommendations;
  }

  private static List<NormalizedAlertEvent> resolvedOf(List<NormalizedAlertEvent> alerts) {
    return alerts.stream()
        .filter(alert -> alert.getEvent().isResolved())
        .collect(Collectors.toList());
  }

  private static double quickResolveRate(List<NormalizedAlertEvent> resolved) {
    if (resolved.isEmpty()) {
      return 0;
    }
    long quick = resolved.stream().filter(alert -> alert.getEvent().isQuickResolve()).count();
    return (double) quick / resolved.size();
  }

  private static double alertRatePerHour(List<NormalizedAlertEvent> serviceAlerts) {
    if (serviceAlerts.isEmpty()) {
      return 0;
    }
    long min =
        serviceAlerts.stream()
            .mapToLong(NormalizedAlertEvent::getNormalizedTimestamp)
            .min()
            .getAsLong();
    long max =
        serviceAlerts.stream()
            .mapToLong(NormalizedAlertEvent::getNormalizedTimestamp)
            .max()
            .getAsLong();
    double spanHours = (max - min) / MILLIS_PER_HOUR;
    return spanHours > 0 ? serviceAlerts.size() / spanHours : 0;
  }

  private static List<Integer> peaksOf(SortedMap<Integer, Long> counts, double factor) {
    double mean = Statistics.mean(counts.values());
    return counts.entrySet().stream()
        .filter(entry -> entry.getValue() > mean * factor)
        .map(Map.Entry::getKey)
        .collect(Collectors.toList());
  }

  private static <T extends Number> List<T> collect(
      List<NormalizedAlertEvent> alerts, Function<NormalizedAlertEvent, T> extractor) {
    return alerts.stream().map(extractor).collect(Collectors.toList());
  }
}
