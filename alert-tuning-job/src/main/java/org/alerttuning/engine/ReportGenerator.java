package org.alerttuning.engine;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.alerttuning.engine.analyzer.AnalysisReport;
import org.alerttuning.engine.analyzer.FalsePositiveIndicators;
import org.alerttuning.engine.analyzer.ServiceBaseline;
import org.alerttuning.engine.analyzer.TemporalPattern;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.tuner.AdaptiveThreshold;
import org.alerttuning.engine.tuner.ExpectedImpact;
import org.apache.commons.lang3.StringUtils;

/** Renders the operator facing Markdown report of one tuning run. */
public class ReportGenerator {
  private static final String[] DAY_NAMES = {
    "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
  };
  private static final int MAX_BAR_LENGTH = 50;
  private static final String NO_PEAKS = "No significant peaks detected";

  private final Clock clock;

  public ReportGenerator(Clock clock) {
    this.clock = clock;
  }

  public String generateMarkdownReport(
      AnalysisReport report, List<AdaptiveThreshold> recommendations, ExpectedImpact impact) {
    StringBuilder markdown = new StringBuilder();
    markdown.append("# Adaptive Alert Tuning Report\n\n");
    markdown.append("**Generated:** ").append(clock.instant()).append("\n\n");
    markdown.append("---\n\n");

    appendExecutiveSummary(markdown, report);
    appendServiceBaselines(markdown, report.getServiceBaselines());
    appendRecommendations(markdown, recommendations);
    appendTemporalPatterns(markdown, report.getTemporalPatterns());

    markdown.append("## Actionable Recommendations\n\n");
    report.getRecommendations().forEach(line -> markdown.append("- ").append(line).append('\n'));
    markdown.append('\n');

    appendExpectedImpact(markdown, report.getFalsePositiveAnalysis(), impact);
    appendImplementationGuide(markdown, recommendations);

    markdown.append("---\n\n");
    markdown.append("## Data Sources\n\n");
    markdown.append("- **Alert Data Files:** Combined from all configured services\n");
    markdown.append("- **Analysis Period:** ").append(timeRange(report)).append('\n');
    markdown
        .append("- **Services Monitored:** ")
        .append(String.join(", ", report.getServiceBaselines().keySet()))
        .append("\n\n");

    markdown.append("## Methodology\n\n");
    markdown.append("**Historical Analysis:**\n");
    markdown.append("- Statistical analysis (mean, standard deviation, percentiles)\n");
    markdown.append("- False positive detection (quick resolves < 30s)\n");
    markdown.append("- Temporal pattern analysis\n\n");
    markdown.append("**Threshold Adjustment:**\n");
    markdown.append("- Adaptive thresholds using mean + k*std\n");
    markdown.append("- Sensitivity factor k raised with the false positive rate\n");
    markdown.append("- Percentile floors (75th, 90th percentiles)\n");
    markdown.append("- Confidence scoring based on sample size\n\n");
    markdown.append("---\n\n");
    markdown.append(
        "*Details are in analysis-report.json and threshold-recommendations.json*\n");
    return markdown.toString();
  }

  private static void appendExecutiveSummary(StringBuilder markdown, AnalysisReport report) {
    FalsePositiveIndicators fp = report.getFalsePositiveAnalysis();
    markdown.append("## Executive Summary\n\n");
    markdown
        .append("- **Total Alerts Analyzed:** ")
        .append(report.getTotalAlertsAnalyzed())
        .append('\n');
    markdown.append("- **Time Range:** ").append(timeRange(report)).append('\n');
    markdown
        .append("- **Services Analyzed:** ")
        .append(report.getServiceBaselines().size())
        .append('\n');
    markdown
        .append("- **Overall False Positive Rate:** ")
        .append(percent(fp.getEstimatedFpRate()))
        .append('\n');
    markdown
        .append("- **Quick Resolves (< 30s):** ")
        .append(fp.getQuickResolves().size())
        .append('\n');
    markdown
        .append("- **Repetitive Alert Patterns:** ")
        .append(fp.getRepetitiveCount())
        .append("\n\n");
  }

  private static void appendServiceBaselines(
      StringBuilder markdown, Map<String, ServiceBaseline> baselines) {
    markdown.append("## Service Baselines\n\n");
    markdown.append(
        "| Service | Total Alerts | Avg Error Count | Avg Response Time | FP Rate "
            + "| Alert Rate/Hour |\n");
    markdown.append(
        "|---------|--------------|-----------------|-------------------|---------"
            + "|-----------------|\n");
    for (ServiceBaseline baseline : baselines.values()) {
      markdown.append(
          String.format(
              Locale.ROOT,
              "| %s | %d | %.1f | %.0fms | %s | %.2f |%n",
              baseline.getServiceName(),
              baseline.getTotalAlerts(),
              baseline.getAvgErrorCount(),
              baseline.getAvgResponseTime(),
              percent(baseline.getFalsePositiveRate()),
              baseline.getAlertRatePerHour()));
    }
    markdown.append('\n');
  }

  private static void appendRecommendations(
      StringBuilder markdown, List<AdaptiveThreshold> recommendations) {
    markdown.append("## Adaptive Threshold Recommendations\n\n");
    markdown.append(
        "| Service | Alert Type | Current | Recommended | Change | Confidence | Samples |\n");
    markdown.append(
        "|---------|------------|---------|-------------|--------|------------|---------|\n");
    for (AdaptiveThreshold threshold : recommendations) {
      markdown.append(
          String.format(
              Locale.ROOT,
              "| %s | %s | %s | %s | %s | %s | %d |%n",
              threshold.getServiceName(),
              threshold.getAlertType(),
              formatNumber(threshold.getCurrentThreshold()),
              formatNumber(threshold.getRecommendedThreshold()),
              formatChange(threshold.getAdjustmentPercentage()),
              threshold.getConfidence(),
              threshold.getBasedOnSamples()));
    }
    markdown.append('\n');

    markdown.append("### Detailed Rationale\n\n");
    for (AdaptiveThreshold threshold : recommendations) {
      markdown
          .append("**")
          .append(threshold.getServiceName())
          .append(" - ")
          .append(threshold.getAlertType())
          .append(":**\n");
      markdown.append("- ").append(threshold.getRationale()).append('\n');
      markdown.append("- Based on ").append(threshold.getBasedOnSamples()).append(" samples\n");
      markdown.append("- Confidence: ").append(threshold.getConfidence()).append("\n\n");
    }
  }

  private static void appendTemporalPatterns(StringBuilder markdown, TemporalPattern temporal) {
    markdown.append("## Temporal Patterns\n\n");
    if (temporal.getPeakHours().isEmpty()) {
      markdown.append("**Peak Hours:** ").append(NO_PEAKS).append("\n\n");
    } else {
      markdown
          .append("**Peak Hours:** ")
          .append(
              temporal.getPeakHours().stream()
                  .map(String::valueOf)
                  .collect(Collectors.joining(", ")))
          .append("\n\n");
    }
    if (temporal.getPeakDays().isEmpty()) {
      markdown.append("**Peak Days:** ").append(NO_PEAKS).append("\n\n");
    } else {
      markdown
          .append("**Peak Days:** ")
          .append(
              temporal.getPeakDays().stream()
                  .map(day -> DAY_NAMES[day])
                  .collect(Collectors.joining(", ")))
          .append("\n\n");
    }

    markdown.append("### Hourly Alert Distribution\n\n");
    markdown.append("```\n");
    Map<Integer, Long> hourly = temporal.getHourlyDistribution();
    long maxCount = hourly.isEmpty() ? 0 : Collections.max(hourly.values());
    for (int hour = 0; hour < 24; hour++) {
      long count = hourly.getOrDefault(hour, 0L);
      int barLength = maxCount == 0 ? 0 : (int) (count * MAX_BAR_LENGTH / maxCount);
      markdown.append(
          String.format(
              Locale.ROOT, "%02d:00 | %s %d%n", hour, StringUtils.repeat('#', barLength), count));
    }
    markdown.append("```\n\n");
  }

  private static void appendExpectedImpact(
      StringBuilder markdown, FalsePositiveIndicators fp, ExpectedImpact impact) {
    double currentFpRate = fp.getEstimatedFpRate();
    markdown.append("## Expected Impact\n\n");
    markdown.append("By applying these adaptive thresholds:\n\n");
    markdown
        .append("- **Target False Positive Reduction:** ")
        .append(percent(impact.getEstimatedFpReduction()))
        .append('\n');
    markdown.append("- **Current FP Rate:** ").append(percent(currentFpRate)).append('\n');
    markdown
        .append("- **Expected FP Rate:** ")
        .append(percent(currentFpRate * (1 - impact.getEstimatedFpReduction())))
        .append('\n');
    markdown
        .append("- **Estimated Alerts Saved:** ~")
        .append(impact.getAlertsSaved())
        .append(" alerts\n");
    markdown
        .append("- **Noise Reduction:** ")
        .append(String.format(Locale.ROOT, "%.1f%%", impact.getNoiseReductionPercentage()))
        .append("\n\n");
  }

  private static void appendImplementationGuide(
      StringBuilder markdown, List<AdaptiveThreshold> recommendations) {
    markdown.append("## Implementation Guide\n\n");
    markdown.append("### Step 1: Review Recommendations\n");
    markdown.append(
        "Check the recommendations above against your operational requirements.\n\n");
    markdown.append("### Step 2: Apply Thresholds\n");
    markdown.append(
        "Point `detector.thresholdConfigFile` of each service at "
            + "adaptive-threshold-config.json, or override the detector block directly:\n\n");
    markdown.append("```\n");
    markdown.append("detector {\n");
    markdown
        .append("  errorBurst.threshold = ")
        .append(firstRecommended(recommendations, AlertType.ERROR).orElse("5"))
        .append('\n');
    markdown
        .append("  availability.errorRate = ")
        .append(firstRecommended(recommendations, AlertType.AVAILABILITY).orElse("0.5"))
        .append('\n');
    markdown.append("}\n");
    markdown.append("```\n\n");
    markdown.append("### Step 3: Monitor Impact\n");
    markdown.append("After applying changes:\n");
    markdown.append("1. Monitor alert volumes for 24-48 hours\n");
    markdown.append("2. Track false positive rates\n");
    markdown.append("3. Gather operator feedback\n");
    markdown.append("4. Re-run the tuning job to validate improvements\n\n");
  }

  private static Optional<String> firstRecommended(
      List<AdaptiveThreshold> recommendations, AlertType alertType) {
    return recommendations.stream()
        .filter(threshold -> threshold.getAlertType() == alertType)
        .findFirst()
        .map(threshold -> formatNumber(threshold.getRecommendedThreshold()));
  }

  private static String timeRange(AnalysisReport report) {
    if (report.getTimeRange() == null) {
      return "n/a";
    }
    return report.getTimeRange().getStart() + " to " + report.getTimeRange().getEnd();
  }

  static String formatChange(double adjustmentPercentage) {
    if (adjustmentPercentage == 0) {
      return "0%";
    }
    String direction = adjustmentPercentage > 0 ? "+" : "-";
    return String.format(Locale.ROOT, "%s%.1f%%", direction, Math.abs(adjustmentPercentage));
  }

  static String formatNumber(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
  }
}
