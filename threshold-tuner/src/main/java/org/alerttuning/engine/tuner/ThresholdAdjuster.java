package org.alerttuning.engine.tuner;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.typesafe.config.Config;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.alerttuning.engine.analyzer.ServiceBaseline;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.event.datamodel.ServiceThresholds;
import org.alerttuning.engine.event.datamodel.ThresholdConfig;
import org.alerttuning.engine.statistics.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recalibrates the error burst and availability thresholds of each service from its alert
 * history. Services with fewer than {@link #MIN_SAMPLES} relevant alerts keep their current
 * thresholds.
 */
public class ThresholdAdjuster {
  private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdAdjuster.class);

  public static final String CURRENT_THRESHOLDS_CONFIG = "tuner.currentThresholds";
  static final int MIN_SAMPLES = 5;
  static final int MIN_ERROR_BURST_THRESHOLD = 3;
  static final double MIN_AVAILABILITY_ERROR_RATE = 0.3;
  static final double MAX_AVAILABILITY_ERROR_RATE = 0.8;
  static final double TARGET_FP_REDUCTION = 0.4;

  private final ImmutableListMultimap<String, NormalizedAlertEvent> alertsByService;
  private final List<NormalizedAlertEvent> alerts;
  private final Map<String, ServiceBaseline> baselines;
  private final ServiceThresholds currentThresholds;
  private final Clock clock;

  public ThresholdAdjuster(
      List<NormalizedAlertEvent> alerts,
      Map<String, ServiceBaseline> baselines,
      ServiceThresholds currentThresholds,
      Clock clock) {
    this.alerts = List.copyOf(alerts);
    this.alertsByService = Multimaps.index(this.alerts, NormalizedAlertEvent::getServiceName);
    this.baselines = baselines;
    this.currentThresholds = currentThresholds;
    this.clock = clock;
  }

  public static ServiceThresholds currentThresholdsFrom(Config appConfig) {
    Config config = appConfig.getConfig(CURRENT_THRESHOLDS_CONFIG);
    return ServiceThresholds.builder()
        .errorBurstThreshold(config.getInt("errorBurstThreshold"))
        .errorBurstWindow(config.getDuration("errorBurstWindow").toMillis())
        .highLatencyThreshold(config.getDuration("highLatencyThreshold").toMillis())
        .availabilityErrorRate(config.getDouble("availabilityErrorRate"))
        .build();
  }

  /** Error burst then availability recommendation for every service, in first-seen order. */
  public List<AdaptiveThreshold> calculateAdaptiveThresholds() {
    List<AdaptiveThreshold> recommendations = new ArrayList<>();
    for (String service : alertsByService.keySet()) {
      List<NormalizedAlertEvent> serviceAlerts = alertsByService.get(service);
      AdaptiveThreshold errorThreshold = calculateErrorBurstThreshold(service, serviceAlerts);
      AdaptiveThreshold availabilityThreshold =
          calculateAvailabilityThreshold(service, serviceAlerts);
      recommendations.add(errorThreshold);
      recommendations.add(availabilityThreshold);
      LOGGER.info(
          "{}: error {} -> {}, availability {} -> {}",
          service,
          errorThreshold.getCurrentThreshold(),
          errorThreshold.getRecommendedThreshold(),
          availabilityThreshold.getCurrentThreshold(),
          availabilityThreshold.getRecommendedThreshold());
    }
    return recommendations;
  }

  /**
   * {@code max(3, ceil(max(mean + k * stddev, p75)))} over the error counts of the service's
   * error alerts, where k grows with the share of quickly resolved error alerts.
   */
  AdaptiveThreshold calculateErrorBurstThreshold(
      String service, List<NormalizedAlertEvent> serviceAlerts) {
    List<NormalizedAlertEvent> errorAlerts = ofType(serviceAlerts, AlertType.ERROR);
    double current = currentThresholds.getErrorBurstThreshold();
    if (errorAlerts.size() < MIN_SAMPLES) {
      return defaultThreshold(service, AlertType.ERROR, current);
    }

    List<Long> errorCounts =
        errorAlerts.stream()
            .map(alert -> alert.getEvent().getErrorCount())
            .collect(Collectors.toList());
    double mean = Statistics.mean(errorCounts);
    double std = Statistics.stdDev(errorCounts);
    double p75 = Statistics.percentile(errorCounts, 75);
    double fpRate = quickResolveRate(errorAlerts);

    double k = 1.5;
    if (fpRate > 0.4) {
      k = 2.5;
    } else if (fpRate > 0.2) {
      k = 2.0;
    }
    double recommended =
        Math.max(MIN_ERROR_BURST_THRESHOLD, Math.ceil(Math.max(mean + k * std, p75)));

    String rationale =
        String.format(
            Locale.ROOT,
            "Statistical analysis: mean=%.1f, std=%.1f, p75=%.1f, FP rate=%.1f%%, k=%s",
            mean,
            std,
            p75,
            fpRate * 100,
            k);
    return AdaptiveThreshold.builder()
        .serviceName(service)
        .alertType(AlertType.ERROR)
        .currentThreshold(current)
        .recommendedThreshold(recommended)
        .adjustmentPercentage(adjustmentPercentage(current, recommended))
        .confidence(confidenceOf(errorCounts.size(), 20, 10))
        .rationale(withBaseline(service, rationale))
        .basedOnSamples(errorCounts.size())
        .build();
  }

  /** The 90th percentile of per-alert error rates, clamped to [0.3, 0.8]. */
  AdaptiveThreshold calculateAvailabilityThreshold(
      String service, List<NormalizedAlertEvent> serviceAlerts) {
    List<NormalizedAlertEvent> availabilityAlerts = ofType(serviceAlerts, AlertType.AVAILABILITY);
    double current = currentThresholds.getAvailabilityErrorRate();
    if (availabilityAlerts.size() < MIN_SAMPLES) {
      return defaultThreshold(service, AlertType.AVAILABILITY, current);
    }

    List<Double> errorRates =
        availabilityAlerts.stream()
            .map(
                alert ->
                    alert.getEvent().getRequestCount() > 0
                        ? (double) alert.getEvent().getErrorCount()
                            / alert.getEvent().getRequestCount()
                        : 0d)
            .collect(Collectors.toList());
    double mean = Statistics.mean(errorRates);
    double p90 = Statistics.percentile(errorRates, 90);
    double p95 = Statistics.percentile(errorRates, 95);
    double recommended =
        Math.max(MIN_AVAILABILITY_ERROR_RATE, Math.min(MAX_AVAILABILITY_ERROR_RATE, p90));

    String rationale =
        String.format(
            Locale.ROOT,
            "Percentile analysis: mean=%.1f%%, p90=%.1f%%, p95=%.1f%%",
            mean * 100,
            p90 * 100,
            p95 * 100);
    return AdaptiveThreshold.builder()
        .serviceName(service)
        .alertType(AlertType.AVAILABILITY)
        .currentThreshold(current)
        .recommendedThreshold(Math.round(recommended * 100) / 100d)
        .adjustmentPercentage(adjustmentPercentage(current, recommended))
        .confidence(confidenceOf(availabilityAlerts.size(), 15, 8))
        .rationale(withBaseline(service, rationale))
        .basedOnSamples(availabilityAlerts.size())
        .build();
  }

  /** Per service: the two recommended thresholds plus the unchanged window and latency. */
  public ThresholdConfig exportThresholdConfig() {
    ThresholdConfig.ThresholdConfigBuilder builder =
        ThresholdConfig.builder().generatedAt(clock.instant());
    for (String service : alertsByService.keySet()) {
      List<NormalizedAlertEvent> serviceAlerts = alertsByService.get(service);
      AdaptiveThreshold errorThreshold = calculateErrorBurstThreshold(service, serviceAlerts);
      AdaptiveThreshold availabilityThreshold =
          calculateAvailabilityThreshold(service, serviceAlerts);
      builder.threshold(
          service,
          ServiceThresholds.builder()
              .errorBurstThreshold((int) errorThreshold.getRecommendedThreshold())
              .errorBurstWindow(currentThresholds.getErrorBurstWindow())
              .highLatencyThreshold(currentThresholds.getHighLatencyThreshold())
              .availabilityErrorRate(availabilityThreshold.getRecommendedThreshold())
              .build());
    }
    return builder.build();
  }

  public ExpectedImpact calculateExpectedImpact() {
    double currentFpRate = quickResolveRate(alerts);
    double estimatedReduction = currentFpRate * TARGET_FP_REDUCTION;
    long alertsSaved = (long) Math.floor(alerts.size() * estimatedReduction);
    return new ExpectedImpact(
        alerts.size(), TARGET_FP_REDUCTION, alertsSaved, estimatedReduction * 100);
  }

  private AdaptiveThreshold defaultThreshold(String service, AlertType alertType, double current) {
    return AdaptiveThreshold.builder()
        .serviceName(service)
        .alertType(alertType)
        .currentThreshold(current)
        .recommendedThreshold(current)
        .adjustmentPercentage(0)
        .confidence(Confidence.LOW)
        .rationale(
            String.format("Insufficient data for adjustment (< %d samples)", MIN_SAMPLES))
        .basedOnSamples(0)
        .build();
  }

  private String withBaseline(String service, String rationale) {
    ServiceBaseline baseline = baselines.get(service);
    if (baseline == null) {
      return rationale;
    }
    return String.format(
        Locale.ROOT,
        "%s; service baseline FP rate=%.1f%%",
        rationale,
        baseline.getFalsePositiveRate() * 100);
  }

  private static List<NormalizedAlertEvent> ofType(
      List<NormalizedAlertEvent> alerts, AlertType alertType) {
    return alerts.stream()
        .filter(alert -> alert.getAlertType() == alertType)
        .collect(Collectors.toList());
  }

  private static double quickResolveRate(List<NormalizedAlertEvent> alerts) {
    long resolved = alerts.stream().filter(alert -> alert.getEvent().isResolved()).count();
    if (resolved == 0) {
      return 0;
    }
    long quick = alerts.stream().filter(alert -> alert.getEvent().isQuickResolve()).count();
    return (double) quick / resolved;
  }

  private static double adjustmentPercentage(double current, double recommended) {
    return current == 0 ? 0 : (recommended - current) / current * 100;
  }

  private static Confidence confidenceOf(int samples, int high, int medium) {
    if (samples > high) {
      return Confidence.HIGH;
    }
    return samples > medium ? Confidence.MEDIUM : Confidence.LOW;
  }
}
