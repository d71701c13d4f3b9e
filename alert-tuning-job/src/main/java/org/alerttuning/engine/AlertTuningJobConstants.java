package org.alerttuning.engine;

public class AlertTuningJobConstants {
  public static final String JOB_CONFIG = "job";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";
  public static final String JOB_CONFIG_OUTPUT_DIR = "outputDir";
  public static final String JOB_CONFIG_REPORT_FILE_NAME = "reportFileName";
  public static final String JOB_CONFIG_ZONE_ID = "zoneId";

  public static final String JOB_DATA_MAP_PIPELINE = "alertTuningPipeline";

  public static final String JOB_NAME = "alert-tuning-job";
  public static final String JOB_GROUP = "alert-tuning";
  public static final String JOB_TRIGGER_NAME = "alert-tuning-trigger";
  public static final String CRON_EXPRESSION = "0 0 * * * ?";

  public static final String COMBINED_ALERT_HISTORY_FILE = "combined-alert-history.json";
  public static final String ALERT_SUMMARY_FILE = "alert-summary.json";
  public static final String ANALYSIS_REPORT_FILE = "analysis-report.json";
  public static final String THRESHOLD_RECOMMENDATIONS_FILE = "threshold-recommendations.json";
  public static final String ADAPTIVE_THRESHOLD_CONFIG_FILE = "adaptive-threshold-config.json";
  public static final String SUPPRESSION_ANALYSIS_FILE = "suppression-analysis.json";
}
