package org.alerttuning.engine.detector;

import com.typesafe.config.Config;
import java.util.Optional;
import org.alerttuning.engine.detector.job.DetectorTickJobManager;
import org.alerttuning.engine.event.datamodel.job.JobManager;
import org.alerttuning.engine.event.datamodel.job.SchedulerProvider;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds an {@link AlertDetector} in a host service: builds it from the {@code detector} config
 * block and runs its periodic check on a dedicated Quartz scheduler.
 */
public class AlertDetectorService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDetectorService.class);

  private final AlertDetector alertDetector;
  private final Scheduler scheduler;
  private final JobManager jobManager;

  public AlertDetectorService(Config appConfig) {
    this(appConfig, Optional.empty());
  }

  public AlertDetectorService(Config appConfig, Optional<DatastoreProbe> datastoreProbe) {
    DetectorConfig detectorConfig = DetectorConfig.fromConfig(appConfig);
    this.alertDetector = new AlertDetector(detectorConfig, datastoreProbe);
    try {
      scheduler =
          SchedulerProvider.newScheduler("alert-detector-" + detectorConfig.getServiceName(), 1);
      jobManager = new DetectorTickJobManager(alertDetector);
      jobManager.initJob(appConfig);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public AlertDetector getAlertDetector() {
    return alertDetector;
  }

  public void start() {
    try {
      jobManager.startJob(scheduler);
      scheduler.start();
      LOGGER.info("Alert detector started");
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public void stop() {
    try {
      jobManager.stopJob(scheduler);
      scheduler.shutdown();
      LOGGER.info("Alert detector stopped");
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }
}
