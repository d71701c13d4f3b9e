package org.alerttuning.engine;

import static org.alerttuning.engine.AlertTuningJobConstants.ADAPTIVE_THRESHOLD_CONFIG_FILE;
import static org.alerttuning.engine.AlertTuningJobConstants.ALERT_SUMMARY_FILE;
import static org.alerttuning.engine.AlertTuningJobConstants.ANALYSIS_REPORT_FILE;
import static org.alerttuning.engine.AlertTuningJobConstants.COMBINED_ALERT_HISTORY_FILE;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_CONFIG;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_CONFIG_OUTPUT_DIR;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_CONFIG_REPORT_FILE_NAME;
import static org.alerttuning.engine.AlertTuningJobConstants.JOB_CONFIG_ZONE_ID;
import static org.alerttuning.engine.AlertTuningJobConstants.SUPPRESSION_ANALYSIS_FILE;
import static org.alerttuning.engine.AlertTuningJobConstants.THRESHOLD_RECOMMENDATIONS_FILE;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.alerttuning.engine.analyzer.AnalysisReport;
import org.alerttuning.engine.analyzer.HistoricalAnalyzer;
import org.alerttuning.engine.collector.AlertEventCollector;
import org.alerttuning.engine.collector.AlertHistorySummary;
import org.alerttuning.engine.event.datamodel.JsonOutputWriter;
import org.alerttuning.engine.event.datamodel.NormalizedAlertEvent;
import org.alerttuning.engine.event.datamodel.ThresholdConfig;
import org.alerttuning.engine.suppressor.AlertSuppressor;
import org.alerttuning.engine.suppressor.SuppressionBatchResult;
import org.alerttuning.engine.tuner.AdaptiveThreshold;
import org.alerttuning.engine.tuner.ExpectedImpact;
import org.alerttuning.engine.tuner.ThresholdAdjuster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One batch run over the collected alert history: collect, summarize, analyze, tune, suppress
 * and write every result into the configured output directory.
 *
 * <p>A failed output file is logged and counted; the remaining files are still written.
 */
public class AlertTuningPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertTuningPipeline.class);

  static final String PIPELINE_RUNS_COUNTER = "alert.tuning.pipeline.runs";
  static final String OUTPUT_ERROR_COUNTER = "alert.tuning.pipeline.output.error";
  static final String PIPELINE_TIMER = "alert.tuning.pipeline.time";

  private final Config appConfig;
  private final AlertEventCollector collector;
  private final Path outputDir;
  private final String reportFileName;
  private final ZoneId zoneId;
  private final Clock clock;
  private final Counter runsCounter;
  private final Counter outputErrorCounter;
  private final Timer pipelineTimer;

  public AlertTuningPipeline(Config appConfig) {
    this(appConfig, Clock.systemUTC(), Metrics.globalRegistry);
  }

  public AlertTuningPipeline(Config appConfig, Clock clock, MeterRegistry meterRegistry) {
    Config jobConfig = appConfig.getConfig(JOB_CONFIG);
    this.appConfig = appConfig;
    this.collector = new AlertEventCollector(appConfig, clock);
    this.outputDir = Paths.get(jobConfig.getString(JOB_CONFIG_OUTPUT_DIR));
    this.reportFileName = jobConfig.getString(JOB_CONFIG_REPORT_FILE_NAME);
    this.zoneId =
        jobConfig.hasPath(JOB_CONFIG_ZONE_ID)
            ? ZoneId.of(jobConfig.getString(JOB_CONFIG_ZONE_ID))
            : ZoneId.systemDefault();
    this.clock = clock;
    this.runsCounter = meterRegistry.counter(PIPELINE_RUNS_COUNTER);
    this.outputErrorCounter = meterRegistry.counter(OUTPUT_ERROR_COUNTER);
    this.pipelineTimer = meterRegistry.timer(PIPELINE_TIMER);
  }

  /** Zone of the local wall-clock used for business hours and hour/day buckets. */
  public ZoneId getZoneId() {
    return zoneId;
  }

  public Path getOutputDir() {
    return outputDir;
  }

  /** Returns empty when there is no alert history; nothing is written in that case. */
  public Optional<PipelineResult> run() {
    Instant startTime = clock.instant();
    runsCounter.increment();

    List<NormalizedAlertEvent> alerts = collector.collectAllAlerts();
    if (alerts.isEmpty()) {
      LOGGER.info("No alert data found, skipping analysis");
      return Optional.empty();
    }

    AlertHistorySummary summary = collector.generateSummary(alerts);
    LOGGER.info(
        "Collected: {} alerts from {} services",
        alerts.size(),
        summary.getAlertsByService().size());

    int failedOutputs = 0;
    failedOutputs +=
        writeOutput(
            COMBINED_ALERT_HISTORY_FILE,
            path -> collector.writeCombinedAlertHistory(alerts, path));
    failedOutputs += writeOutput(ALERT_SUMMARY_FILE, path -> collector.writeSummary(summary, path));

    HistoricalAnalyzer analyzer = new HistoricalAnalyzer(alerts, zoneId, clock);
    AnalysisReport analysisReport = analyzer.analyze();
    failedOutputs += writeJson(ANALYSIS_REPORT_FILE, analysisReport);

    ThresholdAdjuster adjuster =
        new ThresholdAdjuster(
            alerts,
            analysisReport.getServiceBaselines(),
            ThresholdAdjuster.currentThresholdsFrom(appConfig),
            clock);
    List<AdaptiveThreshold> recommendations = adjuster.calculateAdaptiveThresholds();
    ThresholdConfig thresholdConfig = adjuster.exportThresholdConfig();
    ExpectedImpact impact = adjuster.calculateExpectedImpact();
    failedOutputs += writeJson(THRESHOLD_RECOMMENDATIONS_FILE, recommendations);
    failedOutputs += writeJson(ADAPTIVE_THRESHOLD_CONFIG_FILE, thresholdConfig);

    SuppressionBatchResult suppression =
        new AlertSuppressor(clock.withZone(zoneId)).suppressAlerts(alerts);
    failedOutputs += writeJson(SUPPRESSION_ANALYSIS_FILE, suppression);

    String markdown =
        new ReportGenerator(clock)
            .generateMarkdownReport(analysisReport, recommendations, impact);
    failedOutputs +=
        writeOutput(
            reportFileName,
            path -> {
              Files.createDirectories(outputDir);
              Files.writeString(path, markdown, StandardCharsets.UTF_8);
            });

    pipelineTimer.record(Duration.between(startTime, clock.instant()));
    LOGGER.info(
        "Alert tuning run complete: {} recommendations, suppression rate {}%, {} failed outputs",
        recommendations.size(),
        String.format(Locale.ROOT, "%.1f", suppression.getSummary().getSuppressionRatePercent()),
        failedOutputs);

    return Optional.of(
        PipelineResult.builder()
            .alertSummary(summary)
            .analysisReport(analysisReport)
            .thresholdRecommendations(recommendations)
            .thresholdConfig(thresholdConfig)
            .expectedImpact(impact)
            .suppression(suppression)
            .failedOutputs(failedOutputs)
            .build());
  }

  private int writeJson(String fileName, Object value) {
    return writeOutput(fileName, path -> JsonOutputWriter.write(value, path));
  }

  private int writeOutput(String fileName, OutputWriter writer) {
    Path path = outputDir.resolve(fileName);
    try {
      writer.write(path);
      LOGGER.debug("Wrote {}", path);
      return 0;
    } catch (IOException e) {
      outputErrorCounter.increment();
      LOGGER.error("Failed to write output file {}", path, e);
      return 1;
    }
  }

  @FunctionalInterface
  private interface OutputWriter {
    void write(Path path) throws IOException;
  }
}
