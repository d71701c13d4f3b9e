package org.alerttuning.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.alerttuning.engine.analyzer.AnalysisReport;
import org.alerttuning.engine.analyzer.HistoricalAnalyzer;
import org.alerttuning.engine.event.datamodel.AlertEvent;
import org.alerttuning.engine.event.datamodel.AlertState;
import org.alerttuning.engine.event.datamodel.AlertType;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.event.datamodel.ServiceThresholds;
import org.alerttuning.engine.event.datamodel.ServiceType;
import org.alerttuning.engine.event.datamodel.Severity;
import org.alerttuning.engine.tuner.ThresholdAdjuster;
import org.junit.jupiter.api.Test;

class ReportGeneratorTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-03-05T12:00:00Z"), ZoneOffset.UTC);

  @Test
  void testFormatting() {
    assertEquals("5", ReportGenerator.formatNumber(5.0));
    assertEquals("0.5", ReportGenerator.formatNumber(0.5));
    assertEquals("0%", ReportGenerator.formatChange(0));
    assertEquals("+40.0%", ReportGenerator.formatChange(40));
    assertEquals("-12.5%", ReportGenerator.formatChange(-12.5));
  }

  @Test
  void testReportSections() {
    List<NormalizedAlertEvent> alerts = new ArrayList<>();
    Instant start = Instant.parse("2025-03-03T10:00:00Z");
    for (int i = 0; i < 3; i++) {
      alerts.add(
          NormalizedAlertEvent.of(
              AlertEvent.builder()
                  .timestamp(start.plusSeconds(i * 60L))
                  .serviceName("users-service")
                  .alertName("availability_issue")
                  .alertType(AlertType.AVAILABILITY)
                  .alertState(AlertState.FIRED)
                  .severity(Severity.HIGH)
                  .requestCount(20)
                  .errorCount(12)
                  .averageResponseTime(80)
                  .build(),
              ServiceType.JAVA));
    }
    AnalysisReport report = new HistoricalAnalyzer(alerts, ZoneOffset.UTC, CLOCK).analyze();
    ThresholdAdjuster adjuster =
        new ThresholdAdjuster(
            alerts,
            report.getServiceBaselines(),
            ServiceThresholds.builder()
                .errorBurstThreshold(5)
                .errorBurstWindow(60_000L)
                .highLatencyThreshold(3_000L)
                .availabilityErrorRate(0.5)
                .build(),
            CLOCK);

    String markdown =
        new ReportGenerator(CLOCK)
            .generateMarkdownReport(
                report, adjuster.calculateAdaptiveThresholds(), adjuster.calculateExpectedImpact());

    assertTrue(markdown.contains("**Generated:** 2025-03-05T12:00:00Z"));
    assertTrue(markdown.contains("- **Total Alerts Analyzed:** 3"));
    assertTrue(markdown.contains("| users-service | availability | 0.5 | 0.5 | 0% | low | 0 |"));
    assertTrue(markdown.contains("**Peak Hours:** No significant peaks detected"));
    assertTrue(markdown.contains("10:00 | " + "#".repeat(50) + " 3"));
    assertTrue(markdown.contains("  availability.errorRate = 0.5"));
    assertTrue(markdown.contains("- **Services Monitored:** users-service"));
  }
}
