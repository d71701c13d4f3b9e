package org.alerttuning.engine.detector.job;

public class DetectorJobConstants {
  public static final String JOB_DATA_MAP_DETECTOR = "alertDetector";

  public static final String JOB_NAME = "alert-detector-tick";
  public static final String JOB_GROUP = "alert-detector";
  public static final String JOB_TRIGGER_NAME = "alert-detector-tick-trigger";
}
